package eu.virtualparadox.techrag.web.dto;

public record MessageResponse(String message) {
}
