package com.example.guard.alert;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import org.springframework.lang.Nullable;

import java.util.Locale;
import java.util.Optional;

/**
 * Ordered severity scale shared by decisions, alerts, events and incidents.
 */
public enum Severity {
    LOW,
    MEDIUM,
    HIGH,
    CRITICAL;

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    public boolean isAtLeast(Severity other) {
        return compareTo(other) >= 0;
    }

    /**
     * Severity of a failed-attempt ratio against the configured maximum:
     * at least 2 is critical, 1.5 high, 1 medium.
     */
    public static Severity fromRatio(double ratio) {
        if (ratio >= 2.0) {
            return CRITICAL;
        }
        if (ratio >= 1.5) {
            return HIGH;
        }
        if (ratio >= 1.0) {
            return MEDIUM;
        }
        return LOW;
    }

    @JsonCreator
    public static Severity from(String value) {
        return parse(value).orElseThrow(() ->
                new IllegalArgumentException("Unknown severity: " + value));
    }

    public static Optional<Severity> parse(@Nullable String value) {
        if (value == null) {
            return Optional.empty();
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT);
        for (Severity severity : values()) {
            if (severity.name().equals(normalized)) {
                return Optional.of(severity);
            }
        }
        return Optional.empty();
    }
}
