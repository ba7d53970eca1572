package quest.gekko.dataflag.service.voting;

import java.util.Map;

/**
 * A flag a strategy wants created; nothing is written until the outcome is recorded.
 */
public record FlagDraft(double startTime, Double finishTime, Map<String, Object> metadata) {}
