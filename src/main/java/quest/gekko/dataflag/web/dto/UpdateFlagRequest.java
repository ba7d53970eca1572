package quest.gekko.dataflag.web.dto;

import java.util.List;
import java.util.Map;

/**
 * Changes to an existing flag; {@code null} fields are left alone and {@code metadata} is merged.
 */
public record UpdateFlagRequest(
        String type,
        Double startTime,
        Double finishTime,
        String instrument,
        List<Integer> freq,
        List<Integer> inputs,
        String description,
        String user,
        Map<String, Object> metadata
) {}
