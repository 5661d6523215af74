package com.example.guard.alert;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Deque;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Bounded history of published alerts plus cumulative per-type and per-severity counts.
 */
public class AlertLog {

    private final int capacity;
    private final Deque<SecurityAlert> alerts = new ConcurrentLinkedDeque<>();
    private final AtomicInteger size = new AtomicInteger();
    private final Map<AlertType, AtomicLong> byType = new EnumMap<>(AlertType.class);
    private final Map<Severity, AtomicLong> bySeverity = new EnumMap<>(Severity.class);

    public AlertLog(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("Alert log capacity must be positive");
        }
        this.capacity = capacity;
        for (AlertType type : AlertType.values()) {
            byType.put(type, new AtomicLong());
        }
        for (Severity severity : Severity.values()) {
            bySeverity.put(severity, new AtomicLong());
        }
    }

    public void append(SecurityAlert alert) {
        alerts.addLast(alert);
        byType.get(alert.type()).incrementAndGet();
        bySeverity.get(alert.severity()).incrementAndGet();
        if (size.incrementAndGet() > capacity && alerts.pollFirst() != null) {
            size.decrementAndGet();
        }
    }

    public List<SecurityAlert> recent(Duration window, Instant now) {
        Instant cutoff = now.minus(window);
        List<SecurityAlert> result = new ArrayList<>();
        for (SecurityAlert alert : alerts) {
            if (alert.timestamp().isAfter(cutoff)) {
                result.add(alert);
            }
        }
        return result;
    }

    public List<SecurityAlert> all() {
        return List.copyOf(alerts);
    }

    public int purgeOlderThan(Instant cutoff) {
        int removed = 0;
        for (SecurityAlert alert : alerts) {
            if (!alert.timestamp().isAfter(cutoff) && alerts.remove(alert)) {
                size.decrementAndGet();
                removed++;
            }
        }
        return removed;
    }

    public Map<AlertType, Long> countsByType() {
        Map<AlertType, Long> counts = new EnumMap<>(AlertType.class);
        byType.forEach((type, count) -> counts.put(type, count.get()));
        return counts;
    }

    public Map<Severity, Long> countsBySeverity() {
        Map<Severity, Long> counts = new EnumMap<>(Severity.class);
        bySeverity.forEach((severity, count) -> counts.put(severity, count.get()));
        return counts;
    }

    public int size() {
        return size.get();
    }
}
