package quest.gekko.dataflag.web.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

import java.util.List;
import java.util.Map;

/**
 * A new flag. Times are UNIX seconds; a missing finish time leaves the flag open ended.
 * The explicit metadata fields win over the same keys in {@code metadata}.
 */
public record CreateFlagRequest(
        @NotBlank String type,
        @NotNull Double startTime,
        Double finishTime,
        String instrument,
        List<Integer> freq,
        List<Integer> inputs,
        String description,
        String user,
        Map<String, Object> metadata
) {}
