package com.example.guard.progression.strategy;

/**
 * Divisor applied to a rule's request limit while recent failures are high.
 * Must return at least 1.
 */
@FunctionalInterface
public interface AdaptiveScaling {

    double multiplier(int recentFailures, int adaptiveThreshold);
}
