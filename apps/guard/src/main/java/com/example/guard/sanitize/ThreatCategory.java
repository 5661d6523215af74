package com.example.guard.sanitize;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum ThreatCategory {
    XSS,
    INJECTION,
    MALFORMED,
    SUSPICIOUS;

    /**
     * Category implied by a detection rule name.
     */
    public static ThreatCategory ofRule(String rule) {
        if (rule.contains("script") || rule.contains("javascript")) {
            return XSS;
        }
        if (rule.contains("sql") || rule.contains("injection")) {
            return INJECTION;
        }
        if (rule.contains("malformed") || rule.contains("invalid")) {
            return MALFORMED;
        }
        return SUSPICIOUS;
    }

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }
}
