package com.example.guard.detection;

import com.example.guard.ledger.Attempt;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Attack signatures and the attempts each one counts.
 */
public enum AttackType {
    BRUTE_FORCE,
    DDOS,
    ENUMERATION,
    SCRAPING;

    public boolean counts(Attempt attempt) {
        return switch (this) {
            case BRUTE_FORCE, ENUMERATION -> attempt.failed();
            case SCRAPING -> attempt.success();
            case DDOS -> true;
        };
    }

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static AttackType from(String value) {
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
