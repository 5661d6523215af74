package com.example.guard.config;

import com.example.guard.action.ActionExecutor;
import com.example.guard.action.LoggingSecurityNotifier;
import com.example.guard.action.SecurityNotifier;
import com.example.guard.alert.AlertBus;
import com.example.guard.alert.AlertLog;
import com.example.guard.captcha.CaptchaService;
import com.example.guard.captcha.CaptchaVerifier;
import com.example.guard.captcha.IssuedTokenVerifier;
import com.example.guard.detection.AlertThrottle;
import com.example.guard.detection.AnomalyDetector;
import com.example.guard.detection.AnomalyRule;
import com.example.guard.detection.AttackPattern;
import com.example.guard.detection.AttackPatternDetector;
import com.example.guard.engine.ProtectionEngine;
import com.example.guard.engine.SecurityMonitor;
import com.example.guard.event.SecurityEventStore;
import com.example.guard.incident.IncidentManager;
import com.example.guard.ledger.AttemptLedger;
import com.example.guard.maintenance.MaintenanceSweeper;
import com.example.guard.observability.audit.SecurityAuditLogger;
import com.example.guard.observability.metrics.ProtectionMetrics;
import com.example.guard.policy.PolicyEngine;
import com.example.guard.policy.SecurityPolicy;
import com.example.guard.progression.BlockRegistry;
import com.example.guard.progression.KeyedLocks;
import com.example.guard.progression.LockoutRegistry;
import com.example.guard.progression.ProgressionEngine;
import com.example.guard.progression.ProtectionConfigRegistry;
import com.example.guard.progression.RateLimitEvaluator;
import com.example.guard.progression.strategy.Escalation;
import com.example.guard.rule.RateLimitRule;
import com.example.guard.rule.RuleMatcher;
import com.example.guard.sanitize.InputClassifier;
import com.example.guard.sanitize.MarkupCleaner;
import com.example.guard.sanitize.TagStrippingMarkupCleaner;
import com.example.guard.threat.ThreatAggregator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.List;
import java.util.Random;
import java.util.random.RandomGenerator;

/**
 * Composition root of the protection engine. Components are plain classes; this
 * configuration owns their lifetimes and seeds them from {@link ProtectionProperties}.
 *
 * <p>{@link Clock}, {@link RandomGenerator}, {@link Escalation}, {@link CaptchaVerifier},
 * {@link MarkupCleaner} and {@link SecurityNotifier} can be replaced by defining a bean
 * of the same type.
 */
@Slf4j
@Configuration
public class EngineConfiguration {

    public static final String ABUSE_LEDGER = "abuseLedger";
    public static final String RATE_LEDGER = "rateLedger";

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    @ConditionalOnMissingBean
    public RandomGenerator randomGenerator() {
        return new Random();
    }

    @Bean
    @ConditionalOnMissingBean
    public Escalation escalation() {
        return Escalation.defaults();
    }

    @Bean
    @ConditionalOnMissingBean
    public CaptchaVerifier captchaVerifier() {
        return new IssuedTokenVerifier();
    }

    @Bean
    @ConditionalOnMissingBean
    public MarkupCleaner markupCleaner() {
        return new TagStrippingMarkupCleaner();
    }

    @Bean
    @ConditionalOnMissingBean
    public SecurityNotifier securityNotifier() {
        return new LoggingSecurityNotifier();
    }

    // --- state ---

    @Bean(ABUSE_LEDGER)
    public AttemptLedger abuseLedger(ProtectionProperties properties) {
        return new AttemptLedger(ABUSE_LEDGER, properties.ledger().abuseCapacity());
    }

    @Bean(RATE_LEDGER)
    public AttemptLedger rateLedger(ProtectionProperties properties) {
        return new AttemptLedger(RATE_LEDGER, properties.ledger().rateCapacity());
    }

    @Bean
    public LockoutRegistry lockoutRegistry() {
        return new LockoutRegistry();
    }

    @Bean
    public BlockRegistry blockRegistry() {
        return new BlockRegistry();
    }

    @Bean
    public AlertLog alertLog(ProtectionProperties properties) {
        return new AlertLog(properties.monitoring().alertLogCapacity());
    }

    @Bean
    public AlertBus alertBus(AlertLog alertLog) {
        return new AlertBus(alertLog);
    }

    @Bean
    public SecurityEventStore securityEventStore(ProtectionProperties properties) {
        return new SecurityEventStore(properties.monitoring().eventCapacity());
    }

    @Bean
    public AlertThrottle alertThrottle() {
        return new AlertThrottle();
    }

    // --- configuration-driven registries ---

    @Bean
    public ProtectionConfigRegistry protectionConfigRegistry(ProtectionProperties properties) {
        ProtectionConfigRegistry registry = new ProtectionConfigRegistry(properties.protectionConfigs());
        log.info("Loaded {} endpoint protection configs from configuration", registry.size());
        return registry;
    }

    @Bean
    public RuleMatcher ruleMatcher(ProtectionProperties properties) {
        List<RateLimitRule> rules = properties.rateLimitRules();
        log.info("Loaded {} rate limit rules from configuration", rules.size());
        rules.forEach(rule -> log.debug("  - {} ({}): {}", rule.name(), rule.matcher().expression(),
                rule.description()));
        return new RuleMatcher(rules);
    }

    // --- engine components ---

    @Bean
    public CaptchaService captchaService(CaptchaVerifier verifier, Clock clock, ProtectionProperties properties) {
        return new CaptchaService(verifier, clock, properties.captcha().ttl(), properties.captcha().maxAttempts());
    }

    @Bean
    public AttackPatternDetector attackPatternDetector(ProtectionProperties properties,
                                                       @Qualifier(ABUSE_LEDGER) AttemptLedger abuseLedger,
                                                       @Qualifier(RATE_LEDGER) AttemptLedger rateLedger,
                                                       BlockRegistry blocks, CaptchaService captcha,
                                                       AlertBus alertBus, AlertThrottle throttle, Clock clock) {
        List<AttackPattern> patterns = properties.patterns();
        return new AttackPatternDetector(patterns, List.of(abuseLedger, rateLedger), blocks, captcha,
                alertBus, throttle, clock);
    }

    @Bean
    public AnomalyDetector anomalyDetector(ProtectionProperties properties, SecurityEventStore events,
                                           AlertBus alertBus, AlertThrottle throttle, Clock clock) {
        ProtectionProperties.Monitoring monitoring = properties.monitoring();
        return new AnomalyDetector(AnomalyRule.defaults(), events, alertBus, throttle, clock,
                monitoring.identifierEventThreshold(), monitoring.identifierEventWindow());
    }

    @Bean
    public KeyedLocks keyedLocks(ProtectionProperties properties) {
        return new KeyedLocks(properties.lockStripes());
    }

    @Bean
    public ProgressionEngine progressionEngine(ProtectionConfigRegistry configs,
                                               @Qualifier(ABUSE_LEDGER) AttemptLedger abuseLedger,
                                               LockoutRegistry lockouts, KeyedLocks locks, Escalation escalation,
                                               ProtectionProperties properties, RandomGenerator random, Clock clock,
                                               AlertBus alertBus, AttackPatternDetector detector,
                                               CaptchaService captcha) {
        return new ProgressionEngine(configs, abuseLedger, lockouts, locks, escalation,
                properties.delay().toSettings(), random, clock, alertBus, detector, captcha);
    }

    @Bean
    public RateLimitEvaluator rateLimitEvaluator(RuleMatcher rules, @Qualifier(RATE_LEDGER) AttemptLedger rateLedger,
                                                 BlockRegistry blocks, KeyedLocks locks, Escalation escalation,
                                                 Clock clock, AlertBus alertBus, AttackPatternDetector detector) {
        return new RateLimitEvaluator(rules, rateLedger, blocks, locks, escalation, clock, alertBus, detector);
    }

    @Bean
    public ActionExecutor actionExecutor(BlockRegistry blocks, CaptchaService captcha, SecurityNotifier notifier,
                                         SecurityAuditLogger auditLogger, Clock clock,
                                         ProtectionProperties properties) {
        return new ActionExecutor(blocks, captcha, notifier, auditLogger, clock,
                properties.incidents().blockDuration());
    }

    @Bean
    public PolicyEngine policyEngine(ProtectionProperties properties, ActionExecutor actionExecutor) {
        List<SecurityPolicy> policies = properties.securityPolicies();
        log.info("Loaded {} security policies from configuration", policies.size());
        policies.forEach(policy -> log.debug("  - {} (enabled={}): {}", policy.name(), policy.enabled(),
                policy.description()));
        return new PolicyEngine(policies, actionExecutor);
    }

    @Bean
    public IncidentManager incidentManager(ActionExecutor actionExecutor, SecurityAuditLogger auditLogger,
                                           Clock clock, RandomGenerator random) {
        return new IncidentManager(actionExecutor, auditLogger, clock, random);
    }

    @Bean
    public ThreatAggregator threatAggregator(SecurityEventStore events, IncidentManager incidents, Clock clock,
                                             ProtectionProperties properties) {
        return new ThreatAggregator(events, incidents, clock, properties.monitoring().threatWindow());
    }

    @Bean
    public InputClassifier inputClassifier(MarkupCleaner markupCleaner, AlertBus alertBus, Clock clock) {
        return new InputClassifier(markupCleaner, alertBus, clock);
    }

    @Bean
    public SecurityMonitor securityMonitor(SecurityEventStore events, IncidentManager incidents,
                                           PolicyEngine policies, SecurityAuditLogger auditLogger,
                                           ProtectionMetrics metrics) {
        return new SecurityMonitor(events, incidents, policies, auditLogger, metrics);
    }

    @Bean
    public MaintenanceSweeper maintenanceSweeper(Clock clock,
                                                 @Qualifier(ABUSE_LEDGER) AttemptLedger abuseLedger,
                                                 @Qualifier(RATE_LEDGER) AttemptLedger rateLedger,
                                                 LockoutRegistry lockouts, BlockRegistry blocks,
                                                 CaptchaService captcha, AlertLog alertLog,
                                                 SecurityEventStore events, AlertThrottle throttle,
                                                 IncidentManager incidents, ProtectionProperties properties) {
        return MaintenanceSweeper.builder()
                .clock(clock)
                .abuseLedger(abuseLedger)
                .rateLedger(rateLedger)
                .lockouts(lockouts)
                .blocks(blocks)
                .captcha(captcha)
                .alertLog(alertLog)
                .events(events)
                .throttle(throttle)
                .incidents(incidents)
                .historyHorizon(properties.ledger().historyHorizon())
                .incidentAutoResolveAfter(properties.incidents().autoResolveAfter())
                .incidentRetention(properties.incidents().retention())
                .build();
    }

    @Bean
    public ProtectionEngine protectionEngine(Clock clock, ProtectionConfigRegistry configs, RuleMatcher rules,
                                             @Qualifier(ABUSE_LEDGER) AttemptLedger abuseLedger,
                                             @Qualifier(RATE_LEDGER) AttemptLedger rateLedger,
                                             LockoutRegistry lockouts, BlockRegistry blocks,
                                             ProgressionEngine progression, RateLimitEvaluator rateLimits,
                                             CaptchaService captcha, AttackPatternDetector detector,
                                             PolicyEngine policies, IncidentManager incidents,
                                             ThreatAggregator threats, InputClassifier inputClassifier,
                                             AlertBus alertBus, SecurityMonitor monitor,
                                             SecurityAuditLogger auditLogger, ProtectionMetrics metrics) {
        ProtectionEngine engine = ProtectionEngine.builder()
                .clock(clock)
                .configs(configs)
                .rules(rules)
                .abuseLedger(abuseLedger)
                .rateLedger(rateLedger)
                .lockouts(lockouts)
                .blocks(blocks)
                .progression(progression)
                .rateLimits(rateLimits)
                .captcha(captcha)
                .detector(detector)
                .policies(policies)
                .incidents(incidents)
                .threats(threats)
                .inputClassifier(inputClassifier)
                .alertBus(alertBus)
                .monitor(monitor)
                .auditLogger(auditLogger)
                .metrics(metrics)
                .build();
        engine.subscribe(monitor);
        engine.registerGauges();
        return engine;
    }
}
