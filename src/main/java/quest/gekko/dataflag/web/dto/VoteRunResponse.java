package quest.gekko.dataflag.web.dto;

import java.util.List;

/**
 * Result of a voting run. {@code flags} is only filled for verbose runs.
 */
public record VoteRunResponse(String mode, String revision, int flagsCreated, List<FlagDTO> flags) {}
