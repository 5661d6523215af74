package com.example.guard.alert;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum AlertType {
    RATE_LIMIT_EXCEEDED,
    ATTACK_DETECTED,
    SUSPICIOUS_ACTIVITY;

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static AlertType from(String value) {
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
