package com.example.guard.web.model.request;

import com.example.guard.ledger.RequestMetadata;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

import java.util.Map;

/**
 * Outcome of one protected operation, reported by the calling service.
 * Used for both brute-force attempts and rate-limited requests.
 */
public record ReportRequest(
        @NotBlank(message = "Identifier is required")
        @Size(max = 256, message = "Identifier must not exceed 256 characters")
        String identifier,

        @NotBlank(message = "Endpoint is required")
        @Size(max = 512, message = "Endpoint must not exceed 512 characters")
        String endpoint,

        @NotNull(message = "Success flag is required")
        Boolean success,

        @Size(max = 64)
        String networkAddress,

        @Size(max = 512)
        String clientSignature,

        @Size(max = 256)
        String userId,

        @Size(max = 32, message = "At most 32 attributes are accepted")
        Map<String, String> attributes
) {
    public RequestMetadata toMetadata(String resolvedAddress) {
        return new RequestMetadata(resolvedAddress, clientSignature, userId, attributes);
    }
}
