package com.example.guard.ledger;

import org.springframework.lang.Nullable;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Time-ordered attempt history per {@link AttemptKey}, bounded to a fixed number of
 * entries per key.
 *
 * <p>Appends and purges for a key go through {@link ConcurrentHashMap#compute}; reads
 * copy the deque under its monitor, so callers always get a consistent snapshot.
 */
public class AttemptLedger {

    private final String name;
    private final int capacity;
    private final ConcurrentHashMap<AttemptKey, Deque<Attempt>> entries = new ConcurrentHashMap<>();

    public AttemptLedger(String name, int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("Ledger capacity must be positive");
        }
        this.name = name;
        this.capacity = capacity;
    }

    public void record(Attempt attempt) {
        entries.compute(attempt.key(), (key, existing) -> {
            Deque<Attempt> deque = existing != null ? existing : new ArrayDeque<>();
            synchronized (deque) {
                deque.addLast(attempt);
                while (deque.size() > capacity) {
                    deque.pollFirst();
                }
            }
            return deque;
        });
    }

    /**
     * Entries strictly newer than {@code now - window}, oldest first.
     */
    public List<Attempt> windowed(AttemptKey key, Duration window, Instant now) {
        return windowed(key, window, now, null);
    }

    /**
     * As {@link #windowed(AttemptKey, Duration, Instant)}, additionally dropping entries
     * recorded before {@code notBefore}.
     */
    public List<Attempt> windowed(AttemptKey key, Duration window, Instant now, @Nullable Instant notBefore) {
        Deque<Attempt> deque = entries.get(key);
        if (deque == null) {
            return List.of();
        }
        Instant cutoff = now.minus(window);
        List<Attempt> result = new ArrayList<>();
        synchronized (deque) {
            for (Attempt attempt : deque) {
                if (attempt.timestamp().isAfter(cutoff)
                        && (notBefore == null || !attempt.timestamp().isBefore(notBefore))) {
                    result.add(attempt);
                }
            }
        }
        return result;
    }

    public List<Attempt> entries(AttemptKey key) {
        Deque<Attempt> deque = entries.get(key);
        if (deque == null) {
            return List.of();
        }
        synchronized (deque) {
            return List.copyOf(deque);
        }
    }

    /**
     * Drops entries at or before the cutoff and removes keys left empty.
     *
     * @return number of entries removed
     */
    public int purgeOlderThan(Instant cutoff) {
        int[] removed = {0};
        for (AttemptKey key : entries.keySet()) {
            entries.computeIfPresent(key, (k, deque) -> {
                synchronized (deque) {
                    int before = deque.size();
                    deque.removeIf(attempt -> !attempt.timestamp().isAfter(cutoff));
                    removed[0] += before - deque.size();
                    return deque.isEmpty() ? null : deque;
                }
            });
        }
        return removed[0];
    }

    public void clear(AttemptKey key) {
        entries.remove(key);
    }

    public int clearIdentifier(String identifier) {
        int cleared = 0;
        for (AttemptKey key : entries.keySet()) {
            if (key.identifier().equals(identifier) && entries.remove(key) != null) {
                cleared++;
            }
        }
        return cleared;
    }

    public Set<AttemptKey> keys() {
        return Set.copyOf(entries.keySet());
    }

    public List<Attempt> snapshot() {
        List<Attempt> all = new ArrayList<>();
        for (Deque<Attempt> deque : entries.values()) {
            synchronized (deque) {
                all.addAll(deque);
            }
        }
        return all;
    }

    public int size() {
        int total = 0;
        for (Deque<Attempt> deque : entries.values()) {
            synchronized (deque) {
                total += deque.size();
            }
        }
        return total;
    }

    public Map<String, Integer> countsByEndpoint() {
        Map<String, Integer> counts = new TreeMap<>();
        entries.forEach((key, deque) -> {
            int count;
            synchronized (deque) {
                count = deque.size();
            }
            counts.merge(key.endpoint(), count, Integer::sum);
        });
        return counts;
    }

    public String name() {
        return name;
    }

    public int capacity() {
        return capacity;
    }
}
