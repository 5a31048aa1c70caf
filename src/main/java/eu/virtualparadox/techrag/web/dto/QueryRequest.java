package eu.virtualparadox.techrag.web.dto;

import jakarta.validation.constraints.NotBlank;

public record QueryRequest(@NotBlank(message = "question must not be blank") String question) {
}
