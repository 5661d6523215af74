package com.example.guard.event;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Bounded, append-only event stream. Oldest events are dropped first when the cap is reached.
 */
public class SecurityEventStore {

    private final int capacity;
    private final Deque<SecurityEvent> events = new ConcurrentLinkedDeque<>();
    private final AtomicInteger size = new AtomicInteger();

    public SecurityEventStore(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("Event store capacity must be positive");
        }
        this.capacity = capacity;
    }

    public void append(SecurityEvent event) {
        events.addLast(event);
        if (size.incrementAndGet() > capacity && events.pollFirst() != null) {
            size.decrementAndGet();
        }
    }

    public List<SecurityEvent> recent(Duration window, Instant now) {
        Instant cutoff = now.minus(window);
        List<SecurityEvent> result = new ArrayList<>();
        for (SecurityEvent event : events) {
            if (event.timestamp().isAfter(cutoff)) {
                result.add(event);
            }
        }
        return result;
    }

    public int purgeOlderThan(Instant cutoff) {
        int removed = 0;
        for (SecurityEvent event : events) {
            if (!event.timestamp().isAfter(cutoff) && events.remove(event)) {
                size.decrementAndGet();
                removed++;
            }
        }
        return removed;
    }

    public int size() {
        return size.get();
    }
}
