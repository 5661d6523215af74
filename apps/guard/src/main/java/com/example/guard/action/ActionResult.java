package com.example.guard.action;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum ActionResult {
    SUCCESS,
    FAILED,
    PENDING;

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }
}
