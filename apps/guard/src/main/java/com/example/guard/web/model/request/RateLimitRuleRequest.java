package com.example.guard.web.model.request;

import com.example.guard.rule.EndpointMatcher;
import com.example.guard.rule.RateLimitRule;
import com.example.guard.rule.RateLimitSettings;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

import java.time.Duration;

/**
 * @param endpoint exact path, or a regular expression prefixed with {@code regex:}
 */
public record RateLimitRuleRequest(
        @NotBlank(message = "Rule name is required")
        @Size(max = 64)
        String name,

        @NotBlank(message = "Endpoint is required")
        @Size(max = 512)
        String endpoint,

        @NotNull(message = "Window is required")
        Duration window,

        @Min(value = 1, message = "maxRequests must be at least 1")
        int maxRequests,

        boolean skipSuccessful,

        boolean skipFailed,

        boolean adaptive,

        @Min(0)
        int adaptiveThreshold,

        @Size(max = 256)
        String description
) {
    public RateLimitRule toRule() {
        return new RateLimitRule(name, EndpointMatcher.parse(endpoint),
                new RateLimitSettings(window, maxRequests, skipSuccessful, skipFailed, adaptive, adaptiveThreshold),
                description);
    }
}
