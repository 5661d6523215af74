package com.example.guard.progression.strategy;

import com.example.guard.progression.DelaySettings;

/**
 * Base progressive delay in milliseconds before jitter. Only called with at least one failure.
 */
@FunctionalInterface
public interface DelayCurve {

    long baseDelayMillis(int failedAttempts, DelaySettings settings);
}
