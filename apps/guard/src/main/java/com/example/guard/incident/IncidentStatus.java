package com.example.guard.incident;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Incident lifecycle. Status only moves forward: open, then optionally investigating,
 * then one of the terminal states.
 */
public enum IncidentStatus {
    OPEN,
    INVESTIGATING,
    RESOLVED,
    FALSE_POSITIVE;

    public boolean isTerminal() {
        return this == RESOLVED || this == FALSE_POSITIVE;
    }

    public boolean canTransitionTo(IncidentStatus target) {
        return switch (this) {
            case OPEN -> target != OPEN;
            case INVESTIGATING -> target.isTerminal();
            case RESOLVED, FALSE_POSITIVE -> false;
        };
    }

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static IncidentStatus from(String value) {
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
