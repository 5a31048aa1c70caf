package eu.virtualparadox.techrag.web.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;

public record UrlRequest(@NotBlank(message = "url must not be blank")
                         @Pattern(regexp = "(?i)https?://.+", message = "url must be an http(s) URL")
                         String url) {
}
