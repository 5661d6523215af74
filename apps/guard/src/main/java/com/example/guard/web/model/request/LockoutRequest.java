package com.example.guard.web.model.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

import java.time.Duration;

/**
 * @param duration optional; the endpoint's configured lockout applies when absent
 */
public record LockoutRequest(
        @NotBlank(message = "Identifier is required")
        @Size(max = 256)
        String identifier,

        @NotBlank(message = "Endpoint is required")
        @Size(max = 512)
        String endpoint,

        Duration duration
) {}
