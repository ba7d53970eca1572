package quest.gekko.dataflag.web.dto;

import quest.gekko.dataflag.domain.DataFlagCategoryType;
import quest.gekko.dataflag.domain.DataSubsetType;

import java.util.Map;

public record SubsetTypeDTO(Long id, String name, String description, Map<String, Object> metadata) {

    public static SubsetTypeDTO from(DataSubsetType type) {
        return new SubsetTypeDTO(type.getId(), type.getName(), type.getDescription(), type.getMetadata());
    }

    public static SubsetTypeDTO from(DataFlagCategoryType category) {
        return new SubsetTypeDTO(category.getId(), category.getName(), category.getDescription(), null);
    }
}
