package com.example.guard.observability.health;

import com.example.guard.threat.HealthStatus;
import com.example.guard.threat.SystemHealth;
import com.example.guard.threat.ThreatAggregator;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.ReactiveHealthIndicator;
import org.springframework.boot.actuate.health.Status;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

/**
 * Surfaces the latest threat assessment on {@code /actuator/health}.
 * A critical threat level reports {@code OUT_OF_SERVICE}, a warning stays {@code UP}
 * with the details attached.
 */
@Component
@RequiredArgsConstructor
public class ThreatLevelHealthIndicator implements ReactiveHealthIndicator {

    private final ThreatAggregator threatAggregator;

    @Override
    public Mono<Health> health() {
        return Mono.fromSupplier(threatAggregator::health).map(ThreatLevelHealthIndicator::toHealth);
    }

    static Health toHealth(SystemHealth health) {
        Status status = health.status() == HealthStatus.CRITICAL ? Status.OUT_OF_SERVICE : Status.UP;
        Health.Builder builder = Health.status(status)
                .withDetail("status", health.status().value())
                .withDetail("threatLevel", health.threatLevel().level().value())
                .withDetail("score", health.threatLevel().score())
                .withDetail("evaluatedAt", health.evaluatedAt().toString())
                .withDetail("uptimeSeconds", health.uptimeSeconds());
        if (health.lastIncidentAt() != null) {
            builder.withDetail("lastIncidentAt", health.lastIncidentAt().toString());
        }
        if (!health.threatLevel().factors().isEmpty()) {
            builder.withDetail("factors", health.threatLevel().factors());
        }
        return builder.build();
    }
}
