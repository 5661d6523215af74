package com.example.guard.web.model.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

/**
 * @param endpoint limits the reset to one endpoint; all endpoints and rate-limit
 *                 state are cleared when absent
 */
public record ResetRequest(
        @NotBlank(message = "Identifier is required")
        @Size(max = 256)
        String identifier,

        @Size(max = 512)
        String endpoint
) {}
