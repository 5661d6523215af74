package com.example.guard.progression;

import com.example.guard.alert.Severity;
import com.fasterxml.jackson.annotation.JsonInclude;
import org.springframework.lang.Nullable;

import java.time.Instant;

/**
 * Verdict for a reported attempt. {@code remainingAttempts} is {@link #UNLIMITED} when
 * the endpoint has no protection config.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ProtectionDecision(
        boolean blocked,
        int remainingAttempts,
        @Nullable Instant lockoutExpiry,
        boolean requiresCaptcha,
        long delayMs,
        Severity severity
) {
    public static final int UNLIMITED = Integer.MAX_VALUE;

    public static ProtectionDecision unrestricted() {
        return new ProtectionDecision(false, UNLIMITED, null, false, 0, Severity.LOW);
    }

    public static ProtectionDecision whitelisted(int maxAttempts) {
        return new ProtectionDecision(false, maxAttempts, null, false, 0, Severity.LOW);
    }

    /**
     * Existing lockout; the attempt was not recorded.
     */
    public static ProtectionDecision lockedOut(Instant expiry) {
        return new ProtectionDecision(true, 0, expiry, true, 0, Severity.HIGH);
    }

    public static ProtectionDecision lockoutTriggered(Instant expiry, Severity severity) {
        return new ProtectionDecision(true, 0, expiry, true, 0, severity);
    }

    public static ProtectionDecision allowed(int remaining, boolean requiresCaptcha, long delayMs, Severity severity) {
        return new ProtectionDecision(false, remaining, null, requiresCaptcha, delayMs, severity);
    }

    /**
     * Permissive verdict used when the decision itself could not be computed.
     */
    public static ProtectionDecision failOpen(int maxAttempts) {
        return new ProtectionDecision(false, maxAttempts, null, false, 0, Severity.LOW);
    }
}
