package com.example.guard.threat;

import com.fasterxml.jackson.annotation.JsonInclude;
import org.springframework.lang.Nullable;

import java.time.Instant;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record SystemHealth(
        HealthStatus status,
        ThreatLevel threatLevel,
        Instant evaluatedAt,
        @Nullable Instant lastIncidentAt,
        long uptimeSeconds
) {
}
