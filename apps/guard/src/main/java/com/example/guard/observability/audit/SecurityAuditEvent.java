package com.example.guard.observability.audit;

import com.fasterxml.jackson.annotation.JsonInclude;
import org.springframework.lang.NonNull;
import org.springframework.lang.Nullable;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * Structured record written to the {@code SECURITY_AUDIT} logger.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record SecurityAuditEvent(
        @NonNull String eventId,
        @NonNull Instant timestamp,
        @NonNull EventType eventType,
        @NonNull Outcome outcome,
        @Nullable String severity,
        @Nullable String identifier,
        @Nullable String endpoint,
        @Nullable String reference,
        @Nullable String description,
        @Nullable Map<String, Object> details
) {
    public enum EventType {
        ALERT_RAISED,
        INCIDENT_OPENED,
        INCIDENT_STATUS_CHANGED,
        ACTION_REQUESTED,
        ACTION_EXECUTED,
        ADMIN_OPERATION
    }

    public enum Outcome {
        SUCCESS,
        FAILURE,
        BLOCKED
    }

    public static SecurityAuditEvent of(EventType type, Outcome outcome, @Nullable String severity,
                                        @Nullable String identifier, @Nullable String endpoint,
                                        @Nullable String reference, @Nullable String description,
                                        @Nullable Map<String, Object> details) {
        return new SecurityAuditEvent(UUID.randomUUID().toString(), Instant.now(), type, outcome,
                severity, identifier, endpoint, reference, description,
                details == null || details.isEmpty() ? null : details);
    }
}
