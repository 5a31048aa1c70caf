package eu.virtualparadox.techrag.web.dto;

import jakarta.validation.constraints.NotBlank;

/**
 * A file or directory on the server's file system.
 */
public record PathRequest(@NotBlank(message = "path must not be blank") String path) {
}
