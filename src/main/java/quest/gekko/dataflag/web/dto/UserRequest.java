package quest.gekko.dataflag.web.dto;

import jakarta.validation.constraints.NotBlank;

public record UserRequest(@NotBlank String userName) {}
