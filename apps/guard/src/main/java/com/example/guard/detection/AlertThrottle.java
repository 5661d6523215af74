package com.example.guard.detection;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Suppresses repeat reports of the same finding until its window has passed.
 */
public class AlertThrottle {

    private final ConcurrentHashMap<String, Instant> quietUntil = new ConcurrentHashMap<>();

    /**
     * @return true if the caller may report now; the key is then silenced for {@code window}
     */
    public boolean tryAcquire(String key, Duration window, Instant now) {
        boolean[] acquired = {false};
        quietUntil.compute(key, (k, until) -> {
            if (until != null && until.isAfter(now)) {
                return until;
            }
            acquired[0] = true;
            return now.plus(window);
        });
        return acquired[0];
    }

    public int purgeExpired(Instant now) {
        int before = quietUntil.size();
        quietUntil.values().removeIf(until -> !until.isAfter(now));
        return before - quietUntil.size();
    }

    public int size() {
        return quietUntil.size();
    }
}
