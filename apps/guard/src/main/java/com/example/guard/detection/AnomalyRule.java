package com.example.guard.detection;

import com.example.guard.alert.Severity;
import com.example.guard.event.SecurityEvent;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

public record AnomalyRule(
        String name,
        String description,
        int threshold,
        Duration timeWindow,
        AnomalySignal signal
) {
    public AnomalyRule {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(timeWindow, "timeWindow");
        Objects.requireNonNull(signal, "signal");
        if (threshold <= 0) {
            throw new IllegalArgumentException("Anomaly threshold must be positive");
        }
    }

    public static List<AnomalyRule> defaults() {
        return List.of(rapidFire(), credentialStuffing(), dataExfiltration(), privilegeEscalation());
    }

    /**
     * More than {@code threshold} events from one source in a minute.
     */
    public static AnomalyRule rapidFire() {
        return new AnomalyRule("rapid_fire_requests", "Unusually high request rate from single source",
                100, Duration.ofMinutes(1), (events, threshold) -> {
                    Map<String, Long> bySource = events.stream()
                            .collect(Collectors.groupingBy(SecurityEvent::source, Collectors.counting()));
                    return bySource.values().stream().anyMatch(count -> count > threshold);
                });
    }

    /**
     * Non-trivial login events spread over more than {@code threshold} identifiers.
     */
    public static AnomalyRule credentialStuffing() {
        return new AnomalyRule("credential_stuffing", "Multiple failed logins with different credentials",
                50, Duration.ofMinutes(5), (events, threshold) -> events.stream()
                        .filter(e -> e.endpoint().contains("login") && e.severity() != Severity.LOW)
                        .map(SecurityEvent::identifier)
                        .distinct()
                        .count() > threshold);
    }

    public static AnomalyRule dataExfiltration() {
        return new AnomalyRule("data_exfiltration", "Unusual data access patterns",
                20, Duration.ofMinutes(10), (events, threshold) -> events.stream()
                        .filter(e -> e.endpoint().contains("api") && SecurityEvent.DATA_ACCESS.equals(e.type()))
                        .count() > threshold);
    }

    public static AnomalyRule privilegeEscalation() {
        return new AnomalyRule("privilege_escalation", "Attempts to access admin functions",
                5, Duration.ofMinutes(5), (events, threshold) -> events.stream()
                        .filter(e -> e.endpoint().contains("admin") && e.severity() == Severity.HIGH)
                        .count() > threshold);
    }
}
