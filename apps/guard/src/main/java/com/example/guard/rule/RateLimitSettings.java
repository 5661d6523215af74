package com.example.guard.rule;

import java.time.Duration;
import java.util.Objects;

/**
 * @param adaptiveThreshold recent failures at which the limit starts shrinking; ignored
 *                          unless {@code adaptiveEnabled}
 */
public record RateLimitSettings(
        Duration window,
        int maxRequests,
        boolean skipSuccessful,
        boolean skipFailed,
        boolean adaptiveEnabled,
        int adaptiveThreshold
) {
    public RateLimitSettings {
        Objects.requireNonNull(window, "window");
        if (window.isNegative() || window.isZero()) {
            throw new IllegalArgumentException("Rate limit window must be positive");
        }
        if (maxRequests <= 0) {
            throw new IllegalArgumentException("maxRequests must be positive");
        }
    }

    public static RateLimitSettings of(Duration window, int maxRequests) {
        return new RateLimitSettings(window, maxRequests, false, false, false, 0);
    }

    public boolean adaptive() {
        return adaptiveEnabled && adaptiveThreshold > 0;
    }
}
