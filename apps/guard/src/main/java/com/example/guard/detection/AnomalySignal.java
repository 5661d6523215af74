package com.example.guard.detection;

import com.example.guard.event.SecurityEvent;

import java.util.List;

/**
 * Tests the events inside a rule's window against the rule's threshold.
 */
@FunctionalInterface
public interface AnomalySignal {

    boolean test(List<SecurityEvent> events, int threshold);
}
