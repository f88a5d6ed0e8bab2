package haven.adapter.in.dto;

public record MessageResponse(String message) {}
