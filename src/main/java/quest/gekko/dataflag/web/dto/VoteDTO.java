package quest.gekko.dataflag.web.dto;

import java.util.List;

/**
 * One vote with the opinions it consumed; {@code flagId} is null when no flag resulted.
 */
public record VoteDTO(
        Long id,
        double time,
        String mode,
        int lsd,
        String revision,
        Long flagId,
        String client,
        List<Long> opinionIds
) {}
