package com.example.guard.rule;

import java.util.Objects;

public record RateLimitRule(
        String name,
        EndpointMatcher matcher,
        RateLimitSettings settings,
        String description
) {
    public RateLimitRule {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(matcher, "matcher");
        Objects.requireNonNull(settings, "settings");
        description = description == null ? "" : description;
    }

    public boolean appliesTo(String endpoint) {
        return matcher.matches(endpoint);
    }
}
