package com.example.guard.detection;

import java.time.Duration;
import java.util.Objects;

public record AttackPattern(
        AttackType type,
        int threshold,
        Duration timeWindow,
        PatternAction action,
        String description
) {
    public AttackPattern {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(timeWindow, "timeWindow");
        Objects.requireNonNull(action, "action");
        if (threshold <= 0) {
            throw new IllegalArgumentException("Pattern threshold must be positive");
        }
        if (timeWindow.isNegative() || timeWindow.isZero()) {
            throw new IllegalArgumentException("Pattern window must be positive");
        }
        description = description == null ? type.value() : description;
    }
}
