package com.example.guard.threat;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.List;
import java.util.Locale;

public record ThreatLevel(
        Level level,
        int score,
        List<String> factors,
        List<String> recommendations
) {
    public static final ThreatLevel NONE = new ThreatLevel(Level.NONE, 0, List.of(), List.of());

    public ThreatLevel {
        factors = List.copyOf(factors);
        recommendations = List.copyOf(recommendations);
    }

    public enum Level {
        NONE,
        LOW,
        MEDIUM,
        HIGH,
        CRITICAL;

        /**
         * Score bands: 50 critical, 20 high, 10 medium, 5 low.
         */
        public static Level fromScore(int score) {
            if (score >= 50) {
                return CRITICAL;
            }
            if (score >= 20) {
                return HIGH;
            }
            if (score >= 10) {
                return MEDIUM;
            }
            if (score >= 5) {
                return LOW;
            }
            return NONE;
        }

        @JsonValue
        public String value() {
            return name().toLowerCase(Locale.ROOT);
        }
    }
}
