package com.example.guard.engine;

import com.example.guard.alert.AlertSubscriber;
import com.example.guard.alert.SecurityAlert;
import com.example.guard.common.util.StringSanitizer;
import com.example.guard.event.SecurityEvent;
import com.example.guard.event.SecurityEventStore;
import com.example.guard.incident.IncidentManager;
import com.example.guard.incident.SecurityIncident;
import com.example.guard.observability.audit.SecurityAuditLogger;
import com.example.guard.observability.metrics.ProtectionMetrics;
import com.example.guard.policy.PolicyEngine;
import com.example.guard.policy.PolicyOutcome;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.Nullable;

import java.util.List;
import java.util.Optional;

/**
 * Alert bus subscriber that turns alerts into events, incidents and policy actions.
 *
 * <p>Incident creation and policy evaluation fail independently: a broken policy
 * never prevents the incident for the same alert from being recorded.
 */
@Slf4j
@RequiredArgsConstructor
public class SecurityMonitor implements AlertSubscriber {

    private final SecurityEventStore events;
    private final IncidentManager incidents;
    private final PolicyEngine policies;
    private final SecurityAuditLogger auditLogger;
    private final ProtectionMetrics metrics;

    @Override
    public void onAlert(SecurityAlert alert) {
        auditLogger.logAlert(alert);
        metrics.recordAlert(alert);

        Optional<SecurityIncident> incident = Optional.empty();
        try {
            incident = incidents.openFromAlert(alert);
            incident.ifPresent(created -> metrics.recordIncident(created.getType().value()));
        } catch (RuntimeException e) {
            log.error("Incident creation failed for {} alert on {}: {}", alert.type().value(),
                    StringSanitizer.forLog(alert.identifier()), e.getMessage(), e);
        }
        handleEvent(SecurityEvent.from(alert), incident.orElse(null));
    }

    /**
     * Appends the event to the stream and applies the security policies to it.
     */
    public void handleEvent(SecurityEvent event, @Nullable SecurityIncident incident) {
        events.append(event);
        List<PolicyOutcome> outcomes = policies.evaluate(event, incident != null ? incident.getId() : null);
        if (outcomes.isEmpty()) {
            return;
        }
        try {
            if (incident != null) {
                incidents.attachPolicyOutcomes(incident, outcomes);
            } else {
                SecurityIncident violation = incidents.recordPolicyViolation(event, outcomes);
                metrics.recordIncident(violation.getType().value());
            }
        } catch (RuntimeException e) {
            log.error("Failed to record policy outcomes for {} event: {}", event.type(), e.getMessage(), e);
        }
    }

    @Override
    public String name() {
        return "security-monitor";
    }
}
