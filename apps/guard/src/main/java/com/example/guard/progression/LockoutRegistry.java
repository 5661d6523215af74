package com.example.guard.progression;

import com.example.guard.ledger.AttemptKey;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Active lockouts per (identifier, endpoint), plus the window floor that makes the
 * failure count start from zero once a lockout is over.
 *
 * <p>Expiry is evaluated at read time; sweeping only reclaims memory.
 */
public class LockoutRegistry {

    private final ConcurrentHashMap<AttemptKey, Instant> lockouts = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<AttemptKey, Instant> windowFloors = new ConcurrentHashMap<>();

    public void lock(AttemptKey key, Instant expiry) {
        lockouts.put(key, expiry);
        windowFloors.merge(key, expiry, (current, candidate) -> candidate.isAfter(current) ? candidate : current);
    }

    /**
     * Ends a lockout early; attempts made before {@code now} no longer count.
     */
    public boolean release(AttemptKey key, Instant now) {
        boolean released = lockouts.remove(key) != null;
        windowFloors.put(key, now);
        return released;
    }

    public Optional<Instant> activeUntil(AttemptKey key, Instant now) {
        Instant expiry = lockouts.get(key);
        if (expiry == null || !expiry.isAfter(now)) {
            return Optional.empty();
        }
        return Optional.of(expiry);
    }

    public Optional<Instant> windowFloor(AttemptKey key) {
        return Optional.ofNullable(windowFloors.get(key));
    }

    public void clear(AttemptKey key) {
        lockouts.remove(key);
        windowFloors.remove(key);
    }

    public int clearIdentifier(String identifier) {
        windowFloors.keySet().removeIf(key -> key.identifier().equals(identifier));
        int before = lockouts.size();
        lockouts.keySet().removeIf(key -> key.identifier().equals(identifier));
        return before - lockouts.size();
    }

    public int purgeExpired(Instant now) {
        int before = lockouts.size();
        lockouts.entrySet().removeIf(entry -> !entry.getValue().isAfter(now));
        return before - lockouts.size();
    }

    public int purgeFloorsOlderThan(Instant cutoff) {
        int before = windowFloors.size();
        windowFloors.entrySet().removeIf(entry -> entry.getValue().isBefore(cutoff));
        return before - windowFloors.size();
    }

    public int activeCount(Instant now) {
        return (int) lockouts.values().stream().filter(expiry -> expiry.isAfter(now)).count();
    }

    public Map<AttemptKey, Instant> active(Instant now) {
        Map<AttemptKey, Instant> active = new LinkedHashMap<>();
        lockouts.forEach((key, expiry) -> {
            if (expiry.isAfter(now)) {
                active.put(key, expiry);
            }
        });
        return active;
    }
}
