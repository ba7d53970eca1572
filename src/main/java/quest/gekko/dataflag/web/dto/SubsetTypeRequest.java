package quest.gekko.dataflag.web.dto;

import jakarta.validation.constraints.NotBlank;

import java.util.Map;

/**
 * Body for creating a flag, opinion or category type. Categories ignore the metadata.
 */
public record SubsetTypeRequest(@NotBlank String name, String description, Map<String, Object> metadata) {}
