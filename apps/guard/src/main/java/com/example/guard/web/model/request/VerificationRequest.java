package com.example.guard.web.model.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

/**
 * A blank or missing response is accepted here and fails verification, consuming an attempt.
 */
public record VerificationRequest(
        @NotBlank(message = "Identifier is required")
        @Size(max = 256)
        String identifier,

        @Size(max = 2048)
        String response
) {}
