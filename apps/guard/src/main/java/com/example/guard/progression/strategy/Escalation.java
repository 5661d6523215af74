package com.example.guard.progression.strategy;

import java.time.Duration;
import java.util.Objects;

/**
 * The escalation arithmetic used by both decision paths. {@link #defaults()} holds the
 * stock formulas; any part can be swapped by declaring a different bean.
 */
public record Escalation(
        LockoutScaling lockout,
        AdaptiveScaling adaptive,
        BlockDurationPolicy block,
        DelayCurve delay
) {
    public static final double MAX_LOCKOUT_MULTIPLIER = 5.0;
    public static final double MAX_ADAPTIVE_MULTIPLIER = 4.0;
    public static final Duration MAX_BLOCK = Duration.ofHours(24);

    public Escalation {
        Objects.requireNonNull(lockout, "lockout");
        Objects.requireNonNull(adaptive, "adaptive");
        Objects.requireNonNull(block, "block");
        Objects.requireNonNull(delay, "delay");
    }

    public static Escalation defaults() {
        return new Escalation(linearLockout(), linearAdaptive(), logarithmicBlock(), exponentialDelay());
    }

    /**
     * {@code min(5, 1 + 0.5 * excess)} where excess is the failures beyond the maximum.
     */
    public static LockoutScaling linearLockout() {
        return (failedAttempts, maxAttempts) -> {
            int excess = Math.max(0, failedAttempts - maxAttempts);
            return Math.min(MAX_LOCKOUT_MULTIPLIER, 1 + 0.5 * excess);
        };
    }

    /**
     * 1 below the threshold, then {@code min(4, 1 + 0.5 * (failures - threshold))}.
     */
    public static AdaptiveScaling linearAdaptive() {
        return (recentFailures, threshold) -> {
            if (recentFailures < threshold) {
                return 1.0;
            }
            return Math.min(MAX_ADAPTIVE_MULTIPLIER, 1 + 0.5 * (recentFailures - threshold));
        };
    }

    /**
     * {@code window * (1 + log2(max(1, violations)))}, doubled when more than half the
     * attempts failed, capped at 24 hours.
     */
    public static BlockDurationPolicy logarithmicBlock() {
        return (window, violations, failureRate) -> {
            double factor = 1 + log2(Math.max(1, violations));
            if (failureRate > 0.5) {
                factor *= 2;
            }
            long millis = Math.round(window.toMillis() * factor);
            Duration duration = Duration.ofMillis(millis);
            return duration.compareTo(MAX_BLOCK) > 0 ? MAX_BLOCK : duration;
        };
    }

    public static DelayCurve exponentialDelay() {
        return (failedAttempts, settings) -> {
            double raw = settings.baseDelay().toMillis() * Math.pow(settings.multiplier(), failedAttempts - 1);
            return (long) Math.min(settings.maxDelay().toMillis(), raw);
        };
    }

    private static double log2(int value) {
        return Math.log(value) / Math.log(2);
    }
}
