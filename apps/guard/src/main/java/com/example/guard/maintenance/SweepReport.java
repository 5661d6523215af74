package com.example.guard.maintenance;

import java.util.List;
import java.util.Map;

/**
 * Outcome of one sweep: entries removed per step and the steps that failed.
 */
public record SweepReport(Map<String, Integer> removed, List<String> failedSteps) {

    public SweepReport {
        removed = Map.copyOf(removed);
        failedSteps = List.copyOf(failedSteps);
    }

    public int total() {
        return removed.values().stream().mapToInt(Integer::intValue).sum();
    }

    public boolean successful() {
        return failedSteps.isEmpty();
    }
}
