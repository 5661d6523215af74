package com.example.guard.progression.strategy;

/**
 * Multiplier applied to the configured lockout duration.
 */
@FunctionalInterface
public interface LockoutScaling {

    double multiplier(int failedAttempts, int maxAttempts);
}
