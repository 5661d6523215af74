package com.example.guard.detection;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum PatternAction {
    BLOCK,
    CAPTCHA,
    DELAY,
    ALERT;

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static PatternAction from(String value) {
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
