package com.example.guard.web.model.request;

import com.example.guard.alert.Severity;
import com.example.guard.event.SecurityEvent;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;

import java.time.Instant;
import java.util.Map;

/**
 * Event observed by another service, for example a {@code data_access} record.
 */
public record SecurityEventRequest(
        @NotBlank(message = "Event type is required")
        @Pattern(regexp = "[a-z][a-z0-9_]{0,63}", message = "Event type must be a lower-case identifier")
        String type,

        @Size(max = 256)
        String identifier,

        @Size(max = 512)
        String endpoint,

        @NotNull(message = "Severity is required")
        Severity severity,

        @Size(max = 32, message = "At most 32 metadata entries are accepted")
        Map<String, Object> metadata
) {
    public SecurityEvent toEvent(Instant timestamp) {
        return new SecurityEvent(timestamp, type, identifier, endpoint, severity, metadata);
    }
}
