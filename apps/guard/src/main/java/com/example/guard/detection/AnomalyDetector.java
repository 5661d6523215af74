package com.example.guard.detection;

import com.example.guard.alert.AlertBus;
import com.example.guard.alert.AlertType;
import com.example.guard.alert.SecurityAlert;
import com.example.guard.alert.Severity;
import com.example.guard.common.util.StringSanitizer;
import com.example.guard.event.SecurityEvent;
import com.example.guard.event.SecurityEventStore;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Collectors;

/**
 * Evaluates anomaly rules and the per-identifier activity rule over the event stream.
 * Each rule reports at most once per its own window.
 */
@Slf4j
public class AnomalyDetector {

    static final String SYSTEM_IDENTIFIER = "system";

    private final List<AnomalyRule> rules = new CopyOnWriteArrayList<>();
    private final SecurityEventStore events;
    private final AlertBus alertBus;
    private final AlertThrottle throttle;
    private final Clock clock;
    private final int identifierThreshold;
    private final Duration identifierWindow;

    public AnomalyDetector(List<AnomalyRule> rules, SecurityEventStore events, AlertBus alertBus,
                           AlertThrottle throttle, Clock clock, int identifierThreshold, Duration identifierWindow) {
        this.rules.addAll(rules);
        this.events = events;
        this.alertBus = alertBus;
        this.throttle = throttle;
        this.clock = clock;
        this.identifierThreshold = identifierThreshold;
        this.identifierWindow = identifierWindow;
    }

    /**
     * @return number of alerts raised
     */
    public int evaluate() {
        Instant now = clock.instant();
        int raised = 0;
        for (AnomalyRule rule : rules) {
            List<SecurityEvent> inWindow = events.recent(rule.timeWindow(), now);
            if (rule.signal().test(inWindow, rule.threshold())
                    && throttle.tryAcquire("anomaly:" + rule.name(), rule.timeWindow(), now)) {
                log.warn("Anomaly {} detected over {} events", rule.name(), inWindow.size());
                alertBus.publish(new SecurityAlert(AlertType.SUSPICIOUS_ACTIVITY, Severity.HIGH,
                        SYSTEM_IDENTIFIER, "multiple", rule.description(), now,
                        Map.of("anomalyType", rule.name(), "threshold", rule.threshold())));
                raised++;
            }
        }
        return raised + evaluateIdentifiers(now);
    }

    public void addRule(AnomalyRule rule) {
        rules.add(rule);
        log.info("Added anomaly rule {}", rule.name());
    }

    public List<AnomalyRule> rules() {
        return List.copyOf(rules);
    }

    private int evaluateIdentifiers(Instant now) {
        Map<String, Long> perIdentifier = events.recent(identifierWindow, now).stream()
                .filter(e -> !e.identifier().isEmpty() && !SYSTEM_IDENTIFIER.equals(e.identifier()))
                .collect(Collectors.groupingBy(SecurityEvent::identifier, LinkedHashMap::new, Collectors.counting()));

        int raised = 0;
        for (Map.Entry<String, Long> entry : perIdentifier.entrySet()) {
            if (entry.getValue() > identifierThreshold
                    && throttle.tryAcquire("activity:" + entry.getKey(), identifierWindow, now)) {
                log.info("High activity for {}: {} events", StringSanitizer.forLog(entry.getKey()), entry.getValue());
                alertBus.publish(new SecurityAlert(AlertType.SUSPICIOUS_ACTIVITY, Severity.MEDIUM,
                        entry.getKey(), "multiple", "High activity from single identifier", now,
                        Map.of("eventCount", entry.getValue(), "timeWindowSeconds", identifierWindow.toSeconds())));
                raised++;
            }
        }
        return raised;
    }
}
