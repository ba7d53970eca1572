package quest.gekko.dataflag.web.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

import java.util.List;
import java.util.Map;

/**
 * An opinion about one LSD. Submitting a second opinion for the same type, user, LSD and revision
 * updates the first one.
 */
public record CreateOpinionRequest(
        @NotBlank String type,
        @NotBlank String user,
        @NotNull String decision,
        @NotNull Integer lsd,
        @NotBlank String revision,
        String notes,
        Double creationTime,
        String clientName,
        String clientVersion,
        String instrument,
        List<Integer> freq,
        List<Integer> inputs,
        Map<String, Object> metadata,
        List<String> categories
) {}
