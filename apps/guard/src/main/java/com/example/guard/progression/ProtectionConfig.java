package com.example.guard.progression;

import org.springframework.lang.Nullable;

import java.time.Duration;
import java.util.Objects;
import java.util.Set;

/**
 * Brute-force protection settings for one endpoint class (login, payment, ...).
 */
public record ProtectionConfig(
        int maxAttempts,
        Duration timeWindow,
        Duration lockoutDuration,
        boolean progressiveDelayEnabled,
        int captchaThreshold,
        int alertThreshold,
        Set<String> whitelistedAddresses
) {
    public ProtectionConfig {
        if (maxAttempts <= 0) {
            throw new IllegalArgumentException("maxAttempts must be positive");
        }
        Objects.requireNonNull(timeWindow, "timeWindow");
        Objects.requireNonNull(lockoutDuration, "lockoutDuration");
        if (timeWindow.isNegative() || timeWindow.isZero()) {
            throw new IllegalArgumentException("timeWindow must be positive");
        }
        if (lockoutDuration.isNegative()) {
            throw new IllegalArgumentException("lockoutDuration must not be negative");
        }
        whitelistedAddresses = whitelistedAddresses == null ? Set.of() : Set.copyOf(whitelistedAddresses);
    }

    public boolean isWhitelisted(@Nullable String networkAddress) {
        return networkAddress != null && whitelistedAddresses.contains(networkAddress);
    }
}
