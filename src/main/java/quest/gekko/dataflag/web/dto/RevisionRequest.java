package quest.gekko.dataflag.web.dto;

import jakarta.validation.constraints.NotBlank;

public record RevisionRequest(@NotBlank String name, String description) {}
