package com.example.guard.engine;

import com.example.guard.alert.AlertBus;
import com.example.guard.alert.AlertSubscriber;
import com.example.guard.alert.SecurityAlert;
import com.example.guard.captcha.CaptchaChallenge;
import com.example.guard.captcha.CaptchaService;
import com.example.guard.captcha.CaptchaType;
import com.example.guard.common.util.StringSanitizer;
import com.example.guard.detection.AttackPattern;
import com.example.guard.detection.AttackPatternDetector;
import com.example.guard.event.SecurityEvent;
import com.example.guard.incident.IncidentManager;
import com.example.guard.incident.IncidentStatus;
import com.example.guard.incident.IncidentView;
import com.example.guard.incident.SecurityIncident;
import com.example.guard.ledger.AttemptLedger;
import com.example.guard.ledger.RequestMetadata;
import com.example.guard.observability.audit.SecurityAuditLogger;
import com.example.guard.observability.metrics.ProtectionMetrics;
import com.example.guard.policy.PolicyEngine;
import com.example.guard.policy.SecurityPolicy;
import com.example.guard.progression.BlockRegistry;
import com.example.guard.progression.LockoutRegistry;
import com.example.guard.progression.ProgressionEngine;
import com.example.guard.progression.ProtectionConfig;
import com.example.guard.progression.ProtectionConfigRegistry;
import com.example.guard.progression.ProtectionDecision;
import com.example.guard.progression.RateDecision;
import com.example.guard.progression.RateLimitEvaluator;
import com.example.guard.rule.RateLimitRule;
import com.example.guard.rule.RuleMatcher;
import com.example.guard.sanitize.ClassificationResult;
import com.example.guard.sanitize.InputClassifier;
import com.example.guard.sanitize.InputContext;
import com.example.guard.threat.SystemHealth;
import com.example.guard.threat.ThreatAggregator;
import com.example.guard.threat.ThreatLevel;
import lombok.Builder;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.Nullable;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Entry point of the protection service. Every caller, HTTP or programmatic, goes
 * through this facade so metrics and the admin audit trail stay complete.
 */
@Slf4j
@Builder
public class ProtectionEngine {

    private static final Duration STATISTICS_WINDOW = Duration.ofHours(24);
    private static final int TOP_TARGETS = 10;
    private static final String NO_RULE = "none";

    private final Clock clock;
    private final ProtectionConfigRegistry configs;
    private final RuleMatcher rules;
    private final AttemptLedger abuseLedger;
    private final AttemptLedger rateLedger;
    private final LockoutRegistry lockouts;
    private final BlockRegistry blocks;
    private final ProgressionEngine progression;
    private final RateLimitEvaluator rateLimits;
    private final CaptchaService captcha;
    private final AttackPatternDetector detector;
    private final PolicyEngine policies;
    private final IncidentManager incidents;
    private final ThreatAggregator threats;
    private final InputClassifier inputClassifier;
    private final AlertBus alertBus;
    private final SecurityMonitor monitor;
    private final SecurityAuditLogger auditLogger;
    private final ProtectionMetrics metrics;

    // --- ingestion ---

    public ProtectionDecision reportAttempt(String identifier, String endpoint, boolean success,
                                            RequestMetadata metadata) {
        ProtectionDecision decision = progression.evaluate(identifier, endpoint, success, metadata);
        metrics.recordAttempt(endpoint, configs.find(endpoint).isPresent(), success, decision);
        return decision;
    }

    public RateDecision reportRequest(String identifier, String endpoint, boolean success, RequestMetadata metadata) {
        RateDecision decision = rateLimits.evaluate(identifier, endpoint, success, metadata);
        metrics.recordRequest(rules.resolve(endpoint).map(RateLimitRule::name).orElse(NO_RULE), decision);
        return decision;
    }

    /**
     * Feeds an externally observed event (for example a {@code data_access} record
     * from an upstream service) into anomaly detection and policy evaluation.
     */
    public void recordEvent(SecurityEvent event) {
        monitor.handleEvent(event, null);
    }

    // --- configuration ---

    public void registerProtectionConfig(String endpoint, ProtectionConfig config) {
        configs.register(endpoint, config);
        auditLogger.logAdminOperation("register_protection_config", endpoint,
                Map.of("maxAttempts", config.maxAttempts(), "timeWindowSeconds", config.timeWindow().toSeconds()));
    }

    public Map<String, ProtectionConfig> protectionConfigs() {
        return configs.all();
    }

    public void registerRateLimitRule(RateLimitRule rule) {
        rules.register(rule);
        auditLogger.logAdminOperation("register_rate_limit_rule", rule.name(),
                Map.of("endpoint", rule.matcher().expression(), "maxRequests", rule.settings().maxRequests()));
    }

    public boolean removeRateLimitRule(String name) {
        boolean removed = rules.remove(name);
        if (removed) {
            auditLogger.logAdminOperation("remove_rate_limit_rule", name, Map.of());
        }
        return removed;
    }

    public List<RateLimitRule> rateLimitRules() {
        return rules.rules();
    }

    public void addAttackPattern(AttackPattern pattern) {
        detector.addPattern(pattern);
        auditLogger.logAdminOperation("add_attack_pattern", pattern.type().value(),
                Map.of("threshold", pattern.threshold(), "action", pattern.action().value()));
    }

    public List<AttackPattern> attackPatterns() {
        return detector.patterns();
    }

    public void registerPolicy(SecurityPolicy policy) {
        policies.register(policy);
        auditLogger.logAdminOperation("register_policy", policy.name(),
                Map.of("enabled", policy.enabled(), "rules", policy.rules().size()));
    }

    public boolean removePolicy(String name) {
        boolean removed = policies.remove(name);
        if (removed) {
            auditLogger.logAdminOperation("remove_policy", name, Map.of());
        }
        return removed;
    }

    public boolean setPolicyEnabled(String name, boolean enabled) {
        boolean changed = policies.setEnabled(name, enabled);
        if (changed) {
            auditLogger.logAdminOperation(enabled ? "enable_policy" : "disable_policy", name, Map.of());
        }
        return changed;
    }

    public List<SecurityPolicy> policies() {
        return policies.policies();
    }

    // --- manual enforcement ---

    public Instant lockout(String identifier, String endpoint, @Nullable Duration duration) {
        Instant expiry = progression.lockout(identifier, endpoint, duration);
        auditLogger.logAdminOperation("lockout", identifier, Map.of("endpoint", endpoint, "until", expiry.toString()));
        return expiry;
    }

    public boolean releaseLockout(String identifier, String endpoint) {
        boolean released = progression.releaseLockout(identifier, endpoint);
        auditLogger.logAdminOperation("release_lockout", identifier, Map.of("endpoint", endpoint, "released", released));
        return released;
    }

    public Optional<Instant> lockedUntil(String identifier, String endpoint) {
        return progression.lockedUntil(identifier, endpoint);
    }

    public Instant block(String identifier, @Nullable Duration duration) {
        Instant expiry = rateLimits.block(identifier, duration);
        auditLogger.logAdminOperation("block", identifier, Map.of("until", expiry.toString()));
        return expiry;
    }

    public boolean unblock(String identifier) {
        boolean unblocked = rateLimits.unblock(identifier);
        auditLogger.logAdminOperation("unblock", identifier, Map.of("unblocked", unblocked));
        return unblocked;
    }

    public Optional<Instant> blockedUntil(String identifier) {
        return rateLimits.blockedUntil(identifier);
    }

    /**
     * Clears attempts, lockouts and the CAPTCHA challenge for the identifier, scoped to
     * one endpoint when given. Rate-limit history and blocks are only cleared for a
     * full reset.
     */
    public void reset(String identifier, @Nullable String endpoint) {
        progression.reset(identifier, endpoint);
        if (endpoint == null) {
            rateLimits.reset(identifier);
        }
        auditLogger.logAdminOperation("reset", identifier,
                endpoint != null ? Map.of("endpoint", endpoint) : Map.of("scope", "all"));
    }

    // --- captcha ---

    public CaptchaChallenge issueChallenge(String identifier, CaptchaType type) {
        return captcha.issueChallenge(identifier, type);
    }

    public boolean verifyChallenge(String identifier, @Nullable String response) {
        boolean valid = captcha.verify(identifier, response);
        metrics.recordCaptchaVerification(valid);
        return valid;
    }

    // --- input classification ---

    public ClassificationResult classifyInput(String identifier, String endpoint, @Nullable String text,
                                              InputContext context) {
        ClassificationResult result = inputClassifier.classifyAndReport(identifier, endpoint, text, context);
        metrics.recordInputClassification(result.valid());
        return result;
    }

    public ClassificationResult classifyEmail(@Nullable String email) {
        return inputClassifier.classifyEmail(email);
    }

    public ClassificationResult classifyPhone(@Nullable String phone) {
        return inputClassifier.classifyPhone(phone);
    }

    // --- incidents ---

    public List<IncidentView> incidents(@Nullable IncidentStatus status) {
        return incidents.list(status).stream().map(SecurityIncident::view).toList();
    }

    public Optional<IncidentView> incident(String id) {
        return incidents.find(id).map(SecurityIncident::view);
    }

    public boolean resolveIncident(String id, @Nullable String resolution) {
        return incidents.resolve(id, resolution);
    }

    public boolean investigateIncident(String id) {
        return incidents.investigate(id);
    }

    public boolean markFalsePositive(String id, @Nullable String note) {
        return incidents.markFalsePositive(id, note);
    }

    // --- monitoring ---

    public List<SecurityAlert> alerts(@Nullable Duration window) {
        return window == null
                ? alertBus.alertLog().all()
                : alertBus.alertLog().recent(window, clock.instant());
    }

    public Flux<SecurityAlert> alertStream() {
        return alertBus.stream();
    }

    public Disposable subscribe(AlertSubscriber subscriber) {
        log.info("Alert subscriber registered: {}", StringSanitizer.forLog(subscriber.name()));
        return alertBus.subscribe(subscriber);
    }

    public ThreatLevel threatLevel() {
        return threats.threatLevel();
    }

    public SystemHealth health() {
        return threats.health();
    }

    public ProtectionStatistics statistics() {
        Instant now = clock.instant();
        List<SecurityAlert> allAlerts = alertBus.alertLog().all();
        List<ProtectionStatistics.TargetCount> topTargets = allAlerts.stream()
                .filter(alert -> alert.identifier() != null)
                .collect(Collectors.groupingBy(SecurityAlert::identifier, Collectors.counting()))
                .entrySet().stream()
                .sorted(Map.Entry.<String, Long>comparingByValue(Comparator.reverseOrder())
                        .thenComparing(Map.Entry.comparingByKey()))
                .limit(TOP_TARGETS)
                .map(entry -> new ProtectionStatistics.TargetCount(entry.getKey(), entry.getValue()))
                .toList();

        return new ProtectionStatistics(
                alertBus.alertLog().countsByType(),
                alertBus.alertLog().countsBySeverity(),
                alertBus.alertLog().recent(STATISTICS_WINDOW, now).size(),
                lockouts.activeCount(now),
                blocks.activeCount(now),
                captcha.activeCount(),
                abuseLedger.countsByEndpoint(),
                rateLedger.countsByEndpoint(),
                topTargets,
                inputClassifier.threatCounts(),
                incidents.countsByStatus(),
                List.copyOf(configs.all().keySet()),
                rules.rules().size(),
                detector.patterns().size(),
                policies.policies().size(),
                threats.health());
    }

    /**
     * Registers the engine's state gauges with the meter registry.
     */
    public void registerGauges() {
        metrics.gauge("protection.lockouts.active", "Active endpoint lockouts",
                () -> lockouts.activeCount(clock.instant()));
        metrics.gauge("protection.blocks.active", "Active identifier blocks",
                () -> blocks.activeCount(clock.instant()));
        metrics.gauge("protection.captcha.active", "Live CAPTCHA challenges", captcha::activeCount);
        metrics.gauge("protection.ledger.entries", "Attempts held in the abuse ledger", abuseLedger::size);
        metrics.gauge("protection.incidents.open", "Open incidents",
                () -> incidents.countsByStatus().getOrDefault(IncidentStatus.OPEN, 0L));
        metrics.gauge("protection.threat.score", "Threat score over the aggregation window",
                () -> threats.threatLevel().score());
    }
}
