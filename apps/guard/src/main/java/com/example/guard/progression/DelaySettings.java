package com.example.guard.progression;

import java.time.Duration;

/**
 * Progressive delay curve: {@code min(maxDelay, baseDelay * multiplier^(failures-1))}
 * plus uniform jitter in {@code [0, maxJitter)}.
 */
public record DelaySettings(
        Duration baseDelay,
        double multiplier,
        Duration maxDelay,
        Duration maxJitter
) {
    public DelaySettings {
        if (baseDelay == null) {
            baseDelay = Duration.ofSeconds(1);
        }
        if (multiplier < 1.0) {
            multiplier = 2.0;
        }
        if (maxDelay == null) {
            maxDelay = Duration.ofSeconds(30);
        }
        if (maxJitter == null) {
            maxJitter = Duration.ofSeconds(1);
        }
    }

    public static DelaySettings defaults() {
        return new DelaySettings(null, 2.0, null, null);
    }
}
