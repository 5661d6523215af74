package com.example.guard.policy;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum RuleOperator {
    EQUALS,
    CONTAINS,
    GREATER_THAN,
    LESS_THAN,
    REGEX;

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static RuleOperator from(String value) {
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
