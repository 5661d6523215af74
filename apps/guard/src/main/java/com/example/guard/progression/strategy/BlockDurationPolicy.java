package com.example.guard.progression.strategy;

import java.time.Duration;

@FunctionalInterface
public interface BlockDurationPolicy {

    Duration blockDuration(Duration window, int violations, double failureRate);
}
