package quest.gekko.dataflag.web.dto;

import java.util.List;

/**
 * Changes to an opinion. {@code user} may only repeat the current author.
 */
public record EditOpinionRequest(
        String user,
        String decision,
        String type,
        Integer lsd,
        String notes,
        List<String> categories
) {}
