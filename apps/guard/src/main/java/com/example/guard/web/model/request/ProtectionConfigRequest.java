package com.example.guard.web.model.request;

import com.example.guard.progression.ProtectionConfig;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;

import java.time.Duration;
import java.util.Set;

public record ProtectionConfigRequest(
        @Min(value = 1, message = "maxAttempts must be at least 1")
        int maxAttempts,

        @NotNull(message = "timeWindow is required")
        Duration timeWindow,

        @NotNull(message = "lockoutDuration is required")
        Duration lockoutDuration,

        boolean progressiveDelay,

        @Min(0)
        int captchaThreshold,

        @Min(0)
        int alertThreshold,

        Set<String> whitelistedAddresses
) {
    public ProtectionConfig toConfig() {
        return new ProtectionConfig(maxAttempts, timeWindow, lockoutDuration, progressiveDelay,
                captchaThreshold, alertThreshold, whitelistedAddresses);
    }
}
