package com.example.guard.config;

import com.example.guard.action.ActionTemplate;
import com.example.guard.action.ActionType;
import com.example.guard.detection.AttackPattern;
import com.example.guard.detection.AttackType;
import com.example.guard.detection.PatternAction;
import com.example.guard.policy.PolicyRule;
import com.example.guard.policy.RuleOperator;
import com.example.guard.policy.SecurityPolicy;
import com.example.guard.progression.DelaySettings;
import com.example.guard.progression.ProtectionConfig;
import com.example.guard.rule.EndpointMatcher;
import com.example.guard.rule.RateLimitRule;
import com.example.guard.rule.RateLimitSettings;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Protection engine settings bound from {@code protection.*}.
 *
 * <p>Endpoint configs, rate-limit rules, attack patterns and policies are seeded from
 * here at startup and can be changed at runtime through the admin API.
 * Rate-limit endpoints prefixed with {@code regex:} are matched as patterns.
 */
@ConfigurationProperties(prefix = "protection")
public record ProtectionProperties(
        Map<String, EndpointProtection> endpoints,
        List<RateLimitDefinition> rateLimits,
        List<AttackPatternDefinition> attackPatterns,
        List<PolicyDefinition> policies,
        Delay delay,
        Captcha captcha,
        Ledger ledger,
        Monitoring monitoring,
        Incidents incidents,
        int lockStripes
) {
    public ProtectionProperties {
        endpoints = endpoints == null ? Map.of() : new LinkedHashMap<>(endpoints);
        if (rateLimits == null) {
            rateLimits = List.of();
        }
        if (attackPatterns == null) {
            attackPatterns = List.of();
        }
        if (policies == null) {
            policies = List.of();
        }
        if (delay == null) {
            delay = new Delay(null, null, null, null);
        }
        if (captcha == null) {
            captcha = new Captcha(null, 0);
        }
        if (ledger == null) {
            ledger = new Ledger(0, 0, null);
        }
        if (monitoring == null) {
            monitoring = new Monitoring(0, 0, 0, null, null);
        }
        if (incidents == null) {
            incidents = new Incidents(null, null, null);
        }
        if (lockStripes <= 0) {
            lockStripes = 64;
        }
    }

    public static ProtectionProperties defaults() {
        return new ProtectionProperties(null, null, null, null, null, null, null, null, null, 0);
    }

    public Map<String, ProtectionConfig> protectionConfigs() {
        Map<String, ProtectionConfig> configs = new LinkedHashMap<>();
        endpoints.forEach((name, endpoint) -> configs.put(name, endpoint.toConfig()));
        return configs;
    }

    public List<RateLimitRule> rateLimitRules() {
        return rateLimits.stream().map(RateLimitDefinition::toRule).toList();
    }

    public List<AttackPattern> patterns() {
        return attackPatterns.stream().map(AttackPatternDefinition::toPattern).toList();
    }

    public List<SecurityPolicy> securityPolicies() {
        return policies.stream().map(PolicyDefinition::toPolicy).toList();
    }

    public record EndpointProtection(
            int maxAttempts,
            Duration timeWindow,
            Duration lockoutDuration,
            boolean progressiveDelay,
            int captchaThreshold,
            int alertThreshold,
            Set<String> whitelistedAddresses
    ) {
        public ProtectionConfig toConfig() {
            return new ProtectionConfig(maxAttempts, timeWindow, lockoutDuration, progressiveDelay,
                    captchaThreshold, alertThreshold, whitelistedAddresses);
        }
    }

    public record RateLimitDefinition(
            String name,
            String endpoint,
            Duration window,
            int maxRequests,
            boolean skipSuccessful,
            boolean skipFailed,
            boolean adaptive,
            int adaptiveThreshold,
            String description
    ) {
        public RateLimitRule toRule() {
            RateLimitSettings settings = new RateLimitSettings(window, maxRequests, skipSuccessful, skipFailed,
                    adaptive, adaptiveThreshold);
            return new RateLimitRule(name, EndpointMatcher.parse(endpoint), settings, description);
        }
    }

    public record AttackPatternDefinition(
            AttackType type,
            int threshold,
            Duration timeWindow,
            PatternAction action,
            String description
    ) {
        public AttackPattern toPattern() {
            return new AttackPattern(type, threshold, timeWindow, action, description);
        }
    }

    public record PolicyDefinition(
            String name,
            String description,
            Boolean enabled,
            List<RuleDefinition> rules,
            List<ActionDefinition> actions
    ) {
        public PolicyDefinition {
            if (enabled == null) {
                enabled = true;
            }
            if (rules == null) {
                rules = List.of();
            }
            if (actions == null) {
                actions = List.of();
            }
        }

        public SecurityPolicy toPolicy() {
            return new SecurityPolicy(name, description, enabled,
                    rules.stream().map(RuleDefinition::toRule).toList(),
                    actions.stream().map(ActionDefinition::toTemplate).toList());
        }
    }

    public record RuleDefinition(String condition, RuleOperator operator, String value, boolean negated) {
        public PolicyRule toRule() {
            return new PolicyRule(condition, operator, value, negated);
        }
    }

    public record ActionDefinition(ActionType type, String description) {
        public ActionTemplate toTemplate() {
            return ActionTemplate.of(type, description);
        }
    }

    public record Delay(Duration base, Double multiplier, Duration max, Duration maxJitter) {
        public DelaySettings toSettings() {
            return new DelaySettings(base, multiplier == null ? 0.0 : multiplier, max, maxJitter);
        }
    }

    public record Captcha(Duration ttl, int maxAttempts) {
        public Captcha {
            if (ttl == null) {
                ttl = Duration.ofMinutes(5);
            }
            if (maxAttempts <= 0) {
                maxAttempts = 3;
            }
        }
    }

    public record Ledger(int abuseCapacity, int rateCapacity, Duration historyHorizon) {
        public Ledger {
            if (abuseCapacity <= 0) {
                abuseCapacity = 100;
            }
            if (rateCapacity <= 0) {
                rateCapacity = 1000;
            }
            if (historyHorizon == null) {
                historyHorizon = Duration.ofHours(24);
            }
        }
    }

    public record Monitoring(
            int alertLogCapacity,
            int eventCapacity,
            int identifierEventThreshold,
            Duration identifierEventWindow,
            Duration threatWindow
    ) {
        public Monitoring {
            if (alertLogCapacity <= 0) {
                alertLogCapacity = 1000;
            }
            if (eventCapacity <= 0) {
                eventCapacity = 10000;
            }
            if (identifierEventThreshold <= 0) {
                identifierEventThreshold = 20;
            }
            if (identifierEventWindow == null) {
                identifierEventWindow = Duration.ofHours(1);
            }
            if (threatWindow == null) {
                threatWindow = Duration.ofHours(1);
            }
        }
    }

    public record Incidents(Duration autoResolveAfter, Duration retention, Duration blockDuration) {
        public Incidents {
            if (autoResolveAfter == null) {
                autoResolveAfter = Duration.ofHours(24);
            }
            if (retention == null) {
                retention = Duration.ofDays(7);
            }
            if (blockDuration == null) {
                blockDuration = Duration.ofHours(1);
            }
        }
    }
}
