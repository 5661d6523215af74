package com.example.guard.progression;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Identifier-wide blocks consulted by the rate-limit path. Overlapping blocks keep the
 * later expiry.
 */
public class BlockRegistry {

    private final ConcurrentHashMap<String, Instant> blocks = new ConcurrentHashMap<>();

    public Instant block(String identifier, Instant until) {
        return blocks.merge(identifier, until, (current, candidate) -> candidate.isAfter(current) ? candidate : current);
    }

    public boolean unblock(String identifier) {
        return blocks.remove(identifier) != null;
    }

    public Optional<Instant> activeUntil(String identifier, Instant now) {
        Instant expiry = blocks.get(identifier);
        if (expiry == null || !expiry.isAfter(now)) {
            return Optional.empty();
        }
        return Optional.of(expiry);
    }

    public boolean isBlocked(String identifier, Instant now) {
        return activeUntil(identifier, now).isPresent();
    }

    public int purgeExpired(Instant now) {
        int before = blocks.size();
        blocks.entrySet().removeIf(entry -> !entry.getValue().isAfter(now));
        return before - blocks.size();
    }

    public int activeCount(Instant now) {
        return (int) blocks.values().stream().filter(expiry -> expiry.isAfter(now)).count();
    }

    public Map<String, Instant> active(Instant now) {
        Map<String, Instant> active = new LinkedHashMap<>();
        blocks.forEach((identifier, expiry) -> {
            if (expiry.isAfter(now)) {
                active.put(identifier, expiry);
            }
        });
        return active;
    }
}
