package com.example.guard.incident;

import com.example.guard.alert.AlertType;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum IncidentType {
    ATTACK,
    BREACH_ATTEMPT,
    ANOMALY,
    POLICY_VIOLATION;

    public static IncidentType from(AlertType alertType) {
        return switch (alertType) {
            case ATTACK_DETECTED -> ATTACK;
            case RATE_LIMIT_EXCEEDED -> POLICY_VIOLATION;
            case SUSPICIOUS_ACTIVITY -> ANOMALY;
        };
    }

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }
}
