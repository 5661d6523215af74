package com.example.guard.incident;

import com.example.guard.action.ActionContext;
import com.example.guard.action.ActionExecutor;
import com.example.guard.action.ActionTemplate;
import com.example.guard.action.ActionType;
import com.example.guard.action.SecurityAction;
import com.example.guard.alert.AlertType;
import com.example.guard.alert.SecurityAlert;
import com.example.guard.alert.Severity;
import com.example.guard.event.SecurityEvent;
import com.example.guard.observability.audit.SecurityAuditLogger;
import com.example.guard.policy.PolicyOutcome;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.Nullable;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.random.RandomGenerator;

/**
 * Creates incidents from qualifying alerts, runs their automatic response and
 * manages the incident lifecycle.
 *
 * <p>An alert qualifies when its severity is high or critical, or when it reports a
 * detected attack. Attacks block the source identifier; critical incidents are escalated.
 */
@Slf4j
public class IncidentManager {

    static final String AUTO_RESOLUTION = "Auto-resolved after timeout";
    static final String POLICY_SOURCE = "policy_engine";

    private static final String ID_ALPHABET = "0123456789ABCDEFGHIJKLMNOPQRSTUVWXYZ";

    private final ConcurrentHashMap<String, SecurityIncident> incidents = new ConcurrentHashMap<>();
    private final ActionExecutor actionExecutor;
    private final SecurityAuditLogger auditLogger;
    private final Clock clock;
    private final RandomGenerator random;
    private volatile Instant lastIncidentAt;

    public IncidentManager(ActionExecutor actionExecutor, SecurityAuditLogger auditLogger,
                           Clock clock, RandomGenerator random) {
        this.actionExecutor = actionExecutor;
        this.auditLogger = auditLogger;
        this.clock = clock;
        this.random = random;
    }

    public static boolean qualifies(SecurityAlert alert) {
        return alert.severity().isAtLeast(Severity.HIGH) || alert.type() == AlertType.ATTACK_DETECTED;
    }

    public Optional<SecurityIncident> openFromAlert(SecurityAlert alert) {
        if (!qualifies(alert)) {
            return Optional.empty();
        }
        IncidentType type = IncidentType.from(alert.type());
        SecurityIncident incident = open(type, alert.severity(), alert.identifier(), alert.description(),
                sourceOf(alert.type()), alert.metadata());

        List<ActionTemplate> response = new ArrayList<>();
        if (type == IncidentType.ATTACK) {
            response.add(ActionTemplate.of(ActionType.BLOCK, "Blocked source identifier"));
        }
        if (alert.severity() == Severity.CRITICAL) {
            response.add(ActionTemplate.of(ActionType.ESCALATE, "Escalated to security team"));
        }
        incident.addActions(execute(incident, response));
        return Optional.of(incident);
    }

    /**
     * Records the policies that fired for an event that opened no incident of its own.
     */
    public SecurityIncident recordPolicyViolation(SecurityEvent event, List<PolicyOutcome> outcomes) {
        Map<String, Object> metadata = new LinkedHashMap<>(event.metadata());
        metadata.put("policies", policyNames(outcomes));
        metadata.put("eventType", event.type());
        SecurityIncident incident = open(IncidentType.POLICY_VIOLATION, event.severity(), event.identifier(),
                "Security policies triggered: " + String.join(", ", policyNames(outcomes)),
                POLICY_SOURCE, metadata);
        incident.addActions(actionsOf(outcomes));
        return incident;
    }

    public void attachPolicyOutcomes(SecurityIncident incident, List<PolicyOutcome> outcomes) {
        if (outcomes.isEmpty()) {
            return;
        }
        incident.putMetadata("policies", policyNames(outcomes));
        incident.addActions(actionsOf(outcomes));
    }

    /**
     * @return false for an unknown id or an incident already marked false positive
     */
    public boolean resolve(String id, @Nullable String resolution) {
        SecurityIncident incident = incidents.get(id);
        if (incident == null) {
            return false;
        }
        IncidentStatus current = incident.status();
        if (current == IncidentStatus.RESOLVED) {
            return true;
        }
        return transition(incident, IncidentStatus.RESOLVED, resolution);
    }

    public boolean investigate(String id) {
        SecurityIncident incident = incidents.get(id);
        if (incident == null) {
            return false;
        }
        if (incident.status() == IncidentStatus.INVESTIGATING) {
            return true;
        }
        return transition(incident, IncidentStatus.INVESTIGATING, null);
    }

    public boolean markFalsePositive(String id, @Nullable String note) {
        SecurityIncident incident = incidents.get(id);
        if (incident == null) {
            return false;
        }
        if (incident.status() == IncidentStatus.FALSE_POSITIVE) {
            return true;
        }
        return transition(incident, IncidentStatus.FALSE_POSITIVE, note);
    }

    /**
     * Resolves open incidents created strictly before {@code cutoff}. Incidents under
     * investigation are left alone.
     */
    public int autoResolveOpenedBefore(Instant cutoff) {
        int resolved = 0;
        for (SecurityIncident incident : incidents.values()) {
            if (incident.status() == IncidentStatus.OPEN && incident.getTimestamp().isBefore(cutoff)
                    && transition(incident, IncidentStatus.RESOLVED, AUTO_RESOLUTION)) {
                resolved++;
            }
        }
        if (resolved > 0) {
            log.info("Auto-resolved {} stale incidents", resolved);
        }
        return resolved;
    }

    /**
     * Drops closed incidents older than the retention horizon.
     */
    public int purgeClosedBefore(Instant cutoff) {
        int before = incidents.size();
        incidents.values().removeIf(incident ->
                incident.status().isTerminal() && incident.getTimestamp().isBefore(cutoff));
        return before - incidents.size();
    }

    public Optional<SecurityIncident> find(String id) {
        return Optional.ofNullable(incidents.get(id));
    }

    /**
     * Newest first, optionally filtered by status.
     */
    public List<SecurityIncident> list(@Nullable IncidentStatus status) {
        return incidents.values().stream()
                .filter(incident -> status == null || incident.status() == status)
                .sorted(Comparator.comparing(SecurityIncident::getTimestamp).reversed())
                .toList();
    }

    public Map<IncidentStatus, Long> countsByStatus() {
        Map<IncidentStatus, Long> counts = new EnumMap<>(IncidentStatus.class);
        for (IncidentStatus status : IncidentStatus.values()) {
            counts.put(status, 0L);
        }
        incidents.values().forEach(incident -> counts.merge(incident.status(), 1L, Long::sum));
        return counts;
    }

    @Nullable
    public Instant lastIncidentAt() {
        return lastIncidentAt;
    }

    public int size() {
        return incidents.size();
    }

    private SecurityIncident open(IncidentType type, Severity severity, String identifier, String description,
                                  String source, Map<String, Object> metadata) {
        Instant now = clock.instant();
        String title = severity.name() + " " + type.name() + " - " + identifier;
        SecurityIncident incident = new SecurityIncident(nextId(now), type, severity, title, description,
                now, source, identifier, metadata);
        incidents.put(incident.getId(), incident);
        lastIncidentAt = now;
        log.warn("Security incident {} opened: {}", incident.getId(), title);
        auditLogger.logIncidentOpened(incident.getId(), type.value(), severity, identifier, title);
        return incident;
    }

    private boolean transition(SecurityIncident incident, IncidentStatus target, @Nullable String note) {
        IncidentStatus previous = incident.transitionTo(target, clock.instant(), note);
        if (previous == null) {
            log.debug("Incident {} cannot move from {} to {}", incident.getId(), incident.status(), target);
            return false;
        }
        auditLogger.logIncidentStatusChanged(incident.getId(), previous.value(), target.value(), note);
        return true;
    }

    private List<SecurityAction> execute(SecurityIncident incident, List<ActionTemplate> templates) {
        ActionContext context = new ActionContext(incident.getIdentifier(), incident.getSeverity(),
                incident.getId(), incident.getTitle());
        List<SecurityAction> executed = new ArrayList<>();
        for (ActionTemplate template : templates) {
            executed.add(actionExecutor.execute(context, template));
        }
        return executed;
    }

    private String nextId(Instant now) {
        StringBuilder suffix = new StringBuilder(9);
        for (int i = 0; i < 9; i++) {
            suffix.append(ID_ALPHABET.charAt(random.nextInt(ID_ALPHABET.length())));
        }
        return "SEC-" + Long.toString(now.toEpochMilli(), 36).toUpperCase(Locale.ROOT) + "-" + suffix;
    }

    private static String sourceOf(AlertType type) {
        return switch (type) {
            case RATE_LIMIT_EXCEEDED -> "rate_limiter";
            case ATTACK_DETECTED -> "attack_detector";
            case SUSPICIOUS_ACTIVITY -> "security_monitor";
        };
    }

    private static List<String> policyNames(List<PolicyOutcome> outcomes) {
        return outcomes.stream().map(PolicyOutcome::policyName).toList();
    }

    private static List<SecurityAction> actionsOf(List<PolicyOutcome> outcomes) {
        return outcomes.stream().flatMap(outcome -> outcome.actions().stream()).toList();
    }
}
