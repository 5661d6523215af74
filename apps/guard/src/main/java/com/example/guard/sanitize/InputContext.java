package com.example.guard.sanitize;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Who submitted the input; decides how strictly the sanitized value is rewritten.
 */
public enum InputContext {
    /** Markup characters are removed. */
    GUEST,
    /** Markup characters are escaped. */
    USER,
    /** Markup is cleaned, harmless formatting survives. */
    ADMIN;

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static InputContext from(String value) {
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
