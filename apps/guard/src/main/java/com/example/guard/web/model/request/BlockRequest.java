package com.example.guard.web.model.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

import java.time.Duration;

public record BlockRequest(
        @NotBlank(message = "Identifier is required")
        @Size(max = 256)
        String identifier,

        Duration duration
) {}
