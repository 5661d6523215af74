package com.example.guard.progression;

import com.example.guard.alert.AlertBus;
import com.example.guard.alert.AlertType;
import com.example.guard.alert.SecurityAlert;
import com.example.guard.alert.Severity;
import com.example.guard.common.util.StringSanitizer;
import com.example.guard.detection.AttackPatternDetector;
import com.example.guard.ledger.Attempt;
import com.example.guard.ledger.AttemptKey;
import com.example.guard.ledger.AttemptLedger;
import com.example.guard.ledger.RequestMetadata;
import com.example.guard.progression.strategy.Escalation;
import com.example.guard.rule.RateLimitRule;
import com.example.guard.rule.RateLimitSettings;
import com.example.guard.rule.RuleMatcher;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.Nullable;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Rate-limit decision path: sliding-window request counting per (identifier, endpoint)
 * under the first matching {@link RateLimitRule}, with an adaptive limit that shrinks
 * while failures are high and identifier-wide blocks once the limit is exceeded.
 */
@Slf4j
@RequiredArgsConstructor
public class RateLimitEvaluator {

    static final Duration DEFAULT_MANUAL_BLOCK = Duration.ofHours(1);

    private final RuleMatcher rules;
    private final AttemptLedger ledger;
    private final BlockRegistry blocks;
    private final KeyedLocks locks;
    private final Escalation escalation;
    private final Clock clock;
    private final AlertBus alertBus;
    private final AttackPatternDetector detector;

    public RateDecision evaluate(String identifier, String endpoint, boolean success, RequestMetadata metadata) {
        Optional<RateLimitRule> found = rules.resolve(endpoint);
        if (found.isEmpty()) {
            return RateDecision.unrestricted();
        }
        RateLimitRule rule = found.get();
        AttemptKey key = new AttemptKey(identifier, endpoint);
        List<SecurityAlert> pending = new ArrayList<>();
        RateDecision decision;
        try {
            decision = locks.withLock(key, () -> decide(key, rule, success, metadata, pending));
        } catch (RuntimeException e) {
            log.error("Rate decision failed for {} on {}, allowing: {}",
                    StringSanitizer.forLog(identifier), StringSanitizer.forLog(endpoint), e.getMessage(), e);
            int max = rule.settings().maxRequests();
            return RateDecision.allowed(max, clock.instant().plus(rule.settings().window()), max, 1.0);
        }

        pending.forEach(alertBus::publish);
        try {
            detector.inspect(identifier, endpoint, ledger.entries(key));
        } catch (RuntimeException e) {
            log.error("Inline pattern detection failed for {}: {}", StringSanitizer.forLog(identifier), e.getMessage(), e);
        }
        return decision;
    }

    public Instant block(String identifier, @Nullable Duration duration) {
        Instant expiry = blocks.block(identifier, clock.instant().plus(duration != null ? duration : DEFAULT_MANUAL_BLOCK));
        log.info("Identifier {} blocked until {}", StringSanitizer.forLog(identifier), expiry);
        return expiry;
    }

    public boolean unblock(String identifier) {
        return blocks.unblock(identifier);
    }

    public Optional<Instant> blockedUntil(String identifier) {
        return blocks.activeUntil(identifier, clock.instant());
    }

    /**
     * Clears the identifier's request history on every endpoint and lifts its block.
     */
    public void reset(String identifier) {
        ledger.clearIdentifier(identifier);
        blocks.unblock(identifier);
    }

    /**
     * Critical when violations exceed twice the limit with over 80% failures, high when
     * they exceed the limit with over 60% failures, medium above half the limit.
     */
    static Severity severityOf(int violations, double failureRate, int maxRequests) {
        if (violations > maxRequests * 2 && failureRate > 0.8) {
            return Severity.CRITICAL;
        }
        if (violations > maxRequests && failureRate > 0.6) {
            return Severity.HIGH;
        }
        if (violations > maxRequests * 0.5) {
            return Severity.MEDIUM;
        }
        return Severity.LOW;
    }

    private RateDecision decide(AttemptKey key, RateLimitRule rule, boolean success,
                                RequestMetadata metadata, List<SecurityAlert> pending) {
        Instant now = clock.instant();
        RateLimitSettings settings = rule.settings();

        Optional<Instant> blockedUntil = blocks.activeUntil(key.identifier(), now);
        if (blockedUntil.isPresent()) {
            long retryAfter = ceilSeconds(Duration.between(now, blockedUntil.get()));
            return RateDecision.blocked(blockedUntil.get(), settings.maxRequests(), retryAfter, 1.0);
        }

        ledger.record(Attempt.of(key.identifier(), key.endpoint(), now, success, metadata));
        List<Attempt> attempts = ledger.windowed(key, settings.window(), now);
        int failures = (int) attempts.stream().filter(Attempt::failed).count();
        int relevant = (int) attempts.stream()
                .filter(a -> !(settings.skipSuccessful() && a.success()))
                .filter(a -> !(settings.skipFailed() && a.failed()))
                .count();

        double multiplier = settings.adaptive()
                ? Math.max(1.0, escalation.adaptive().multiplier(failures, settings.adaptiveThreshold()))
                : 1.0;
        int effectiveLimit = (int) Math.floor(settings.maxRequests() / multiplier);

        if (relevant > effectiveLimit) {
            int violations = attempts.size() - settings.maxRequests();
            double failureRate = failures / (double) attempts.size();
            Duration blockFor = escalation.block().blockDuration(settings.window(), violations, failureRate);
            Instant expiry = blocks.block(key.identifier(), now.plus(blockFor));
            Severity severity = severityOf(violations, failureRate, settings.maxRequests());
            log.warn("Rate limit {} exceeded by {} on {} ({} of {}), blocked for {}s", rule.name(),
                    StringSanitizer.forLog(key.identifier()), StringSanitizer.forLog(key.endpoint()),
                    relevant, effectiveLimit, blockFor.toSeconds());

            Map<String, Object> alertMetadata = new LinkedHashMap<>();
            alertMetadata.put("rule", rule.name());
            alertMetadata.put("requests", attempts.size());
            alertMetadata.put("limit", effectiveLimit);
            alertMetadata.put("violations", violations);
            alertMetadata.put("failureRate", failureRate);
            alertMetadata.put("adaptiveMultiplier", multiplier);
            alertMetadata.put("blockDurationSeconds", blockFor.toSeconds());
            if (metadata.networkAddress() != null) {
                alertMetadata.put("networkAddress", metadata.networkAddress());
            }
            pending.add(new SecurityAlert(AlertType.RATE_LIMIT_EXCEEDED, severity, key.identifier(), key.endpoint(),
                    "Rate limit exceeded for " + rule.name(), now, alertMetadata));
            return RateDecision.blocked(expiry, effectiveLimit, ceilSeconds(Duration.between(now, expiry)), multiplier);
        }

        return RateDecision.allowed(Math.max(0, effectiveLimit - relevant), now.plus(settings.window()),
                effectiveLimit, multiplier);
    }

    private static long ceilSeconds(Duration duration) {
        long millis = duration.toMillis();
        return Math.max(1, (millis + 999) / 1000);
    }
}
