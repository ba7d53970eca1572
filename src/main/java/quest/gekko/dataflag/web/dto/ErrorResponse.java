package quest.gekko.dataflag.web.dto;

public record ErrorResponse(int status, String error, String message) {}
