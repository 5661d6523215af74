package com.example.guard.progression;

import com.fasterxml.jackson.annotation.JsonInclude;
import org.springframework.lang.Nullable;

import java.time.Instant;

/**
 * Verdict for a request on the rate-limit path.
 *
 * @param total              effective limit after adaptive scaling
 * @param retryAfterSeconds  present only while blocked
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record RateDecision(
        int remaining,
        @Nullable Instant resetAt,
        int total,
        boolean blocked,
        @Nullable Long retryAfterSeconds,
        double adaptiveMultiplier
) {
    public static RateDecision unrestricted() {
        return new RateDecision(ProtectionDecision.UNLIMITED, null, ProtectionDecision.UNLIMITED, false, null, 1.0);
    }

    public static RateDecision blocked(Instant until, int total, long retryAfterSeconds, double multiplier) {
        return new RateDecision(0, until, total, true, retryAfterSeconds, multiplier);
    }

    public static RateDecision allowed(int remaining, Instant resetAt, int total, double multiplier) {
        return new RateDecision(remaining, resetAt, total, false, null, multiplier);
    }
}
