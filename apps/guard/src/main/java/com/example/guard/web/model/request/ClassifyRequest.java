package com.example.guard.web.model.request;

import com.example.guard.sanitize.InputContext;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;

public record ClassifyRequest(
        @NotBlank(message = "Identifier is required")
        @Size(max = 256)
        String identifier,

        @NotBlank(message = "Endpoint is required")
        @Size(max = 512)
        String endpoint,

        @Size(max = 100_000, message = "Input must not exceed 100000 characters")
        String text,

        @Pattern(regexp = "text|email|phone", message = "Format must be one of text, email, phone")
        String format,

        InputContext context
) {
    public ClassifyRequest {
        if (format == null) {
            format = "text";
        }
        if (context == null) {
            context = InputContext.GUEST;
        }
    }
}
