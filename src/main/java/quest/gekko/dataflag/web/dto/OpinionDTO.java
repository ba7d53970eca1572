package quest.gekko.dataflag.web.dto;

import quest.gekko.dataflag.domain.DataFlagCategoryType;
import quest.gekko.dataflag.domain.DataFlagOpinion;

import java.util.List;
import java.util.Map;

public record OpinionDTO(
        Long id,
        String type,
        String user,
        String decision,
        int lsd,
        String revision,
        double creationTime,
        double lastEdit,
        String notes,
        String client,
        Map<String, Object> metadata,
        List<String> categories
) {

    public static OpinionDTO from(DataFlagOpinion opinion) {
        return new OpinionDTO(
                opinion.getId(),
                opinion.getType().getName(),
                opinion.getUser().getUserName(),
                opinion.getDecision().value(),
                opinion.getLsd(),
                opinion.getRevision().getName(),
                opinion.getCreationTime(),
                opinion.getLastEdit(),
                opinion.getNotes(),
                opinion.getClient().getClientName() + " " + opinion.getClient().getClientVersion(),
                opinion.getMetadata(),
                opinion.getCategories().stream().map(DataFlagCategoryType::getName).sorted().toList()
        );
    }
}
