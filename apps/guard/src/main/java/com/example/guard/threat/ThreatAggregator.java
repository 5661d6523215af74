package com.example.guard.threat;

import com.example.guard.alert.Severity;
import com.example.guard.event.SecurityEvent;
import com.example.guard.event.SecurityEventStore;
import com.example.guard.incident.IncidentManager;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Rolls recent events up into a scored threat level and keeps the latest
 * {@link SystemHealth} for the admin API, metrics and the actuator health endpoint.
 */
@Slf4j
public class ThreatAggregator {

    private final SecurityEventStore events;
    private final IncidentManager incidents;
    private final Clock clock;
    private final Duration window;
    private final Instant startedAt;
    private final AtomicReference<SystemHealth> latest = new AtomicReference<>();

    public ThreatAggregator(SecurityEventStore events, IncidentManager incidents, Clock clock, Duration window) {
        this.events = events;
        this.incidents = incidents;
        this.clock = clock;
        this.window = window;
        this.startedAt = clock.instant();
        latest.set(new SystemHealth(HealthStatus.HEALTHY, ThreatLevel.NONE, startedAt, null, 0));
    }

    public SystemHealth aggregate() {
        Instant now = clock.instant();
        ThreatLevel level = assess(events.recent(window, now));
        SystemHealth previous = latest.get();
        SystemHealth health = new SystemHealth(HealthStatus.from(level.level()), level, now,
                incidents.lastIncidentAt(), Duration.between(startedAt, now).toSeconds());
        latest.set(health);

        if (previous.status() != health.status()) {
            log.warn("System health changed from {} to {} (threat level {}, score {})",
                    previous.status().value(), health.status().value(), level.level().value(), level.score());
        }
        return health;
    }

    /**
     * Scores events as {@code critical*10 + high*5 + medium*2 + low}.
     */
    public static ThreatLevel assess(List<SecurityEvent> recent) {
        Map<Severity, Integer> buckets = new EnumMap<>(Severity.class);
        for (Severity severity : Severity.values()) {
            buckets.put(severity, 0);
        }
        recent.forEach(event -> buckets.merge(event.severity(), 1, Integer::sum));

        int critical = buckets.get(Severity.CRITICAL);
        int high = buckets.get(Severity.HIGH);
        int medium = buckets.get(Severity.MEDIUM);
        int low = buckets.get(Severity.LOW);
        int score = critical * 10 + high * 5 + medium * 2 + low;
        ThreatLevel.Level level = ThreatLevel.Level.fromScore(score);

        List<String> factors = new ArrayList<>();
        if (critical > 0) {
            factors.add(critical + " critical security events");
        }
        if (high > 0) {
            factors.add(high + " high severity events");
        }
        if (medium > 0) {
            factors.add(medium + " medium severity events");
        }
        if (low > 0) {
            factors.add(low + " low severity events");
        }
        return new ThreatLevel(level, score, factors, recommendationsFor(level));
    }

    public SystemHealth health() {
        return latest.get();
    }

    public ThreatLevel threatLevel() {
        return latest.get().threatLevel();
    }

    private static List<String> recommendationsFor(ThreatLevel.Level level) {
        return switch (level) {
            case CRITICAL -> List.of(
                    "Activate incident response procedures",
                    "Consider blocking suspicious network ranges",
                    "Review all recent authentication attempts");
            case HIGH -> List.of(
                    "Increase monitoring frequency",
                    "Review recent security events",
                    "Verify integrity of critical systems");
            case MEDIUM -> List.of(
                    "Monitor for escalating activity",
                    "Review failed authentication patterns");
            case LOW -> List.of("Continue routine monitoring");
            case NONE -> List.of();
        };
    }
}
