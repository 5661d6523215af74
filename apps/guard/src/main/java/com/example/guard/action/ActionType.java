package com.example.guard.action;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum ActionType {
    BLOCK,
    ALERT,
    LOG,
    ESCALATE,
    CAPTCHA;

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static ActionType from(String value) {
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
