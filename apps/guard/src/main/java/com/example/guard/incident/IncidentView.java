package com.example.guard.incident;

import com.example.guard.action.SecurityAction;
import com.example.guard.alert.Severity;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Consistent point-in-time copy of a {@link SecurityIncident}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record IncidentView(
        String id,
        IncidentType type,
        Severity severity,
        String title,
        String description,
        Instant timestamp,
        String source,
        String identifier,
        Map<String, Object> metadata,
        IncidentStatus status,
        List<SecurityAction> actions,
        String resolution,
        Instant resolvedAt
) {
}
