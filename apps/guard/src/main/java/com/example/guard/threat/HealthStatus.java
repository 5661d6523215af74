package com.example.guard.threat;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum HealthStatus {
    HEALTHY,
    WARNING,
    CRITICAL;

    public static HealthStatus from(ThreatLevel.Level level) {
        return switch (level) {
            case CRITICAL, HIGH -> CRITICAL;
            case MEDIUM -> WARNING;
            case LOW, NONE -> HEALTHY;
        };
    }

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }
}
