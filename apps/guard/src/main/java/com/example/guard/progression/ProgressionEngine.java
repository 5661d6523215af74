package com.example.guard.progression;

import com.example.guard.alert.AlertBus;
import com.example.guard.alert.AlertType;
import com.example.guard.alert.SecurityAlert;
import com.example.guard.alert.Severity;
import com.example.guard.captcha.CaptchaService;
import com.example.guard.common.util.StringSanitizer;
import com.example.guard.detection.AttackPatternDetector;
import com.example.guard.ledger.Attempt;
import com.example.guard.ledger.AttemptKey;
import com.example.guard.ledger.AttemptLedger;
import com.example.guard.ledger.RequestMetadata;
import com.example.guard.progression.strategy.Escalation;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.Nullable;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.random.RandomGenerator;

/**
 * Brute-force decision path: turns the failure history of an (identifier, endpoint)
 * pair into a verdict of allow, delay, CAPTCHA or lockout.
 *
 * <p>Each record-evaluate-react sequence runs under the key's lock. Alerts raised by
 * the sequence are published after the lock is released, followed by inline attack
 * pattern detection over the key's history. A fault while deciding yields the
 * permissive verdict; only a threshold breach or an admin call locks a key out.
 *
 * <p>A lockout sets the key's window floor, so the next window counts from zero and a
 * lockout normally fires at exactly {@code maxAttempts} failures. Failures beyond the
 * maximum, and with them a lockout multiplier above 1, only occur when a config is
 * replaced with a lower maximum while failures are already in the window.
 */
@Slf4j
@RequiredArgsConstructor
public class ProgressionEngine {

    static final Duration DEFAULT_MANUAL_LOCKOUT = Duration.ofHours(1);

    private final ProtectionConfigRegistry configs;
    private final AttemptLedger ledger;
    private final LockoutRegistry lockouts;
    private final KeyedLocks locks;
    private final Escalation escalation;
    private final DelaySettings delaySettings;
    private final RandomGenerator random;
    private final Clock clock;
    private final AlertBus alertBus;
    private final AttackPatternDetector detector;
    private final CaptchaService captcha;

    public ProtectionDecision evaluate(String identifier, String endpoint, boolean success, RequestMetadata metadata) {
        Optional<ProtectionConfig> found = configs.find(endpoint);
        if (found.isEmpty()) {
            return ProtectionDecision.unrestricted();
        }
        ProtectionConfig config = found.get();
        if (config.isWhitelisted(metadata.networkAddress())) {
            return ProtectionDecision.whitelisted(config.maxAttempts());
        }

        AttemptKey key = new AttemptKey(identifier, endpoint);
        List<SecurityAlert> pending = new ArrayList<>();
        ProtectionDecision decision;
        try {
            decision = locks.withLock(key, () -> decide(key, config, success, metadata, pending));
        } catch (RuntimeException e) {
            log.error("Protection decision failed for {} on {}, allowing: {}",
                    StringSanitizer.forLog(identifier), StringSanitizer.forLog(endpoint), e.getMessage(), e);
            return ProtectionDecision.failOpen(config.maxAttempts());
        }

        pending.forEach(alertBus::publish);
        try {
            detector.inspect(identifier, endpoint, ledger.entries(key));
        } catch (RuntimeException e) {
            log.error("Inline pattern detection failed for {}: {}", StringSanitizer.forLog(identifier), e.getMessage(), e);
        }
        return decision;
    }

    /**
     * Locks the pair out until {@code now + duration}; without a duration the endpoint's
     * configured lockout (or one hour) applies.
     */
    public Instant lockout(String identifier, String endpoint, @Nullable Duration duration) {
        Duration effective = duration != null
                ? duration
                : configs.find(endpoint).map(ProtectionConfig::lockoutDuration).orElse(DEFAULT_MANUAL_LOCKOUT);
        AttemptKey key = new AttemptKey(identifier, endpoint);
        Instant expiry = clock.instant().plus(effective);
        locks.withLock(key, () -> {
            lockouts.lock(key, expiry);
            return expiry;
        });
        log.info("Manual lockout for {} on {} until {}", StringSanitizer.forLog(identifier),
                StringSanitizer.forLog(endpoint), expiry);
        return expiry;
    }

    public boolean releaseLockout(String identifier, String endpoint) {
        AttemptKey key = new AttemptKey(identifier, endpoint);
        return locks.withLock(key, () -> lockouts.release(key, clock.instant()));
    }

    public Optional<Instant> lockedUntil(String identifier, String endpoint) {
        return lockouts.activeUntil(new AttemptKey(identifier, endpoint), clock.instant());
    }

    /**
     * Forgets history and lockouts for one endpoint, or for every endpoint when
     * {@code endpoint} is null, and drops the identifier's CAPTCHA challenge.
     */
    public void reset(String identifier, @Nullable String endpoint) {
        if (endpoint != null) {
            AttemptKey key = new AttemptKey(identifier, endpoint);
            locks.withLock(key, () -> {
                ledger.clear(key);
                lockouts.clear(key);
                return key;
            });
        } else {
            ledger.clearIdentifier(identifier);
            lockouts.clearIdentifier(identifier);
        }
        captcha.clear(identifier);
        log.info("Protection state reset for {}{}", StringSanitizer.forLog(identifier),
                endpoint != null ? " on " + StringSanitizer.forLog(endpoint) : "");
    }

    private ProtectionDecision decide(AttemptKey key, ProtectionConfig config, boolean success,
                                      RequestMetadata metadata, List<SecurityAlert> pending) {
        Instant now = clock.instant();
        Optional<Instant> lockedUntil = lockouts.activeUntil(key, now);
        if (lockedUntil.isPresent()) {
            return ProtectionDecision.lockedOut(lockedUntil.get());
        }

        ledger.record(Attempt.of(key.identifier(), key.endpoint(), now, success, metadata));
        List<Attempt> recent = ledger.windowed(key, config.timeWindow(), now, lockouts.windowFloor(key).orElse(null));
        int failedCount = (int) recent.stream().filter(Attempt::failed).count();
        Severity severity = Severity.fromRatio(failedCount / (double) config.maxAttempts());

        if (failedCount >= config.maxAttempts()) {
            double multiplier = escalation.lockout().multiplier(failedCount, config.maxAttempts());
            Duration duration = Duration.ofMillis(Math.round(config.lockoutDuration().toMillis() * multiplier));
            Instant expiry = now.plus(duration);
            lockouts.lock(key, expiry);
            log.warn("Locked out {} on {} for {}s after {} failures", StringSanitizer.forLog(key.identifier()),
                    StringSanitizer.forLog(key.endpoint()), duration.toSeconds(), failedCount);
            pending.add(alert(AlertType.ATTACK_DETECTED, severity, key, now, recent, config, true,
                    "Brute force attack detected and blocked for " + key.endpoint()));
            return ProtectionDecision.lockoutTriggered(expiry, severity);
        }

        int remaining = Math.max(0, config.maxAttempts() - failedCount);
        boolean requiresCaptcha = failedCount >= config.captchaThreshold();
        long delayMs = config.progressiveDelayEnabled() ? progressiveDelay(failedCount) : 0;
        if (failedCount >= config.alertThreshold()) {
            pending.add(alert(AlertType.SUSPICIOUS_ACTIVITY, severity, key, now, recent, config, false,
                    "Suspicious activity detected for " + key.endpoint()));
        }
        return ProtectionDecision.allowed(remaining, requiresCaptcha, delayMs, severity);
    }

    private long progressiveDelay(int failedCount) {
        if (failedCount <= 0) {
            return 0;
        }
        long base = escalation.delay().baseDelayMillis(failedCount, delaySettings);
        double jitter = random.nextDouble() * delaySettings.maxJitter().toMillis();
        return (long) Math.floor(base + jitter);
    }

    private SecurityAlert alert(AlertType type, Severity severity, AttemptKey key, Instant now, List<Attempt> recent,
                                ProtectionConfig config, boolean lockout, String description) {
        Set<String> addresses = new LinkedHashSet<>();
        Set<String> signatures = new LinkedHashSet<>();
        recent.forEach(attempt -> {
            if (attempt.networkAddress() != null) {
                addresses.add(attempt.networkAddress());
            }
            if (attempt.clientSignature() != null) {
                signatures.add(attempt.clientSignature());
            }
        });

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("failedAttempts", recent.stream().filter(Attempt::failed).count());
        metadata.put("totalAttempts", recent.size());
        metadata.put("timeWindowSeconds", config.timeWindow().toSeconds());
        metadata.put("lockoutDurationSeconds", config.lockoutDuration().toSeconds());
        metadata.put("isLockout", lockout);
        metadata.put("networkAddresses", List.copyOf(addresses));
        metadata.put("clientSignatures", List.copyOf(signatures));
        recent.stream()
                .map(Attempt::networkAddress)
                .filter(Objects::nonNull)
                .reduce((first, second) -> second)
                .ifPresent(address -> metadata.put("networkAddress", address));
        return new SecurityAlert(type, severity, key.identifier(), key.endpoint(), description, now, metadata);
    }
}
