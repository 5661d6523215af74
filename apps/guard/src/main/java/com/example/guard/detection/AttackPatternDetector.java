package com.example.guard.detection;

import com.example.guard.alert.AlertBus;
import com.example.guard.alert.AlertType;
import com.example.guard.alert.SecurityAlert;
import com.example.guard.alert.Severity;
import com.example.guard.captcha.CaptchaService;
import com.example.guard.captcha.CaptchaType;
import com.example.guard.common.util.StringSanitizer;
import com.example.guard.ledger.Attempt;
import com.example.guard.ledger.AttemptLedger;
import com.example.guard.progression.BlockRegistry;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Matches attempt histories against {@link AttackPattern}s.
 *
 * <p>{@link #inspect} runs after every decision over the history of one
 * (identifier, endpoint) pair. {@link #sweep} runs periodically over every ledger,
 * grouping attempts per identifier, and for enumeration per source address
 * counting distinct identifiers. A finding for the same pattern and target is
 * reported once per pattern window.
 */
@Slf4j
public class AttackPatternDetector {

    static final String MULTIPLE_ENDPOINTS = "multiple";

    private final List<AttackPattern> patterns = new CopyOnWriteArrayList<>();
    private final List<AttemptLedger> ledgers;
    private final BlockRegistry blocks;
    private final CaptchaService captcha;
    private final AlertBus alertBus;
    private final AlertThrottle throttle;
    private final Clock clock;

    public AttackPatternDetector(List<AttackPattern> patterns, List<AttemptLedger> ledgers, BlockRegistry blocks,
                                 CaptchaService captcha, AlertBus alertBus, AlertThrottle throttle, Clock clock) {
        this.patterns.addAll(patterns);
        this.ledgers = List.copyOf(ledgers);
        this.blocks = blocks;
        this.captcha = captcha;
        this.alertBus = alertBus;
        this.throttle = throttle;
        this.clock = clock;
        log.info("Attack pattern detector initialized with {} patterns", this.patterns.size());
    }

    /**
     * @return number of patterns that fired
     */
    public int inspect(String identifier, String endpoint, List<Attempt> history) {
        Instant now = clock.instant();
        int fired = 0;
        for (AttackPattern pattern : patterns) {
            Instant cutoff = now.minus(pattern.timeWindow());
            List<Attempt> matching = history.stream()
                    .filter(attempt -> attempt.timestamp().isAfter(cutoff))
                    .filter(pattern.type()::counts)
                    .toList();
            if (matching.size() >= pattern.threshold()
                    && respond(pattern, identifier, endpoint, matching.size(), lastAddress(matching), now)) {
                fired++;
            }
        }
        return fired;
    }

    /**
     * Cross-key pass over all ledgers.
     *
     * @return number of findings reported
     */
    public int sweep() {
        Instant now = clock.instant();
        List<Attempt> all = new ArrayList<>();
        ledgers.forEach(ledger -> all.addAll(ledger.snapshot()));

        int fired = 0;
        for (AttackPattern pattern : patterns) {
            Instant cutoff = now.minus(pattern.timeWindow());
            List<Attempt> matching = all.stream()
                    .filter(attempt -> attempt.timestamp().isAfter(cutoff))
                    .filter(pattern.type()::counts)
                    .toList();
            fired += pattern.type() == AttackType.ENUMERATION
                    ? sweepEnumeration(pattern, matching, now)
                    : sweepPerIdentifier(pattern, matching, now);
        }
        if (fired > 0) {
            log.info("Attack pattern sweep reported {} findings", fired);
        }
        return fired;
    }

    public void addPattern(AttackPattern pattern) {
        patterns.add(pattern);
        log.info("Added attack pattern {} (threshold={}, window={}, action={})",
                pattern.type().value(), pattern.threshold(), pattern.timeWindow(), pattern.action().value());
    }

    public List<AttackPattern> patterns() {
        return List.copyOf(patterns);
    }

    private int sweepPerIdentifier(AttackPattern pattern, List<Attempt> matching, Instant now) {
        Map<String, List<Attempt>> byIdentifier = new LinkedHashMap<>();
        matching.forEach(a -> byIdentifier.computeIfAbsent(a.identifier(), k -> new ArrayList<>()).add(a));

        int fired = 0;
        for (Map.Entry<String, List<Attempt>> entry : byIdentifier.entrySet()) {
            List<Attempt> attempts = entry.getValue();
            if (attempts.size() >= pattern.threshold()
                    && respond(pattern, entry.getKey(), MULTIPLE_ENDPOINTS, attempts.size(), lastAddress(attempts), now)) {
                fired++;
            }
        }
        return fired;
    }

    private int sweepEnumeration(AttackPattern pattern, List<Attempt> failures, Instant now) {
        Map<String, Set<String>> identifiersBySource = new LinkedHashMap<>();
        for (Attempt attempt : failures) {
            // no address, no source to act on
            if (attempt.networkAddress() == null) {
                continue;
            }
            identifiersBySource.computeIfAbsent(attempt.networkAddress(), k -> new HashSet<>())
                    .add(attempt.identifier());
        }

        int fired = 0;
        for (Map.Entry<String, Set<String>> entry : identifiersBySource.entrySet()) {
            int distinct = entry.getValue().size();
            if (distinct >= pattern.threshold()
                    && respond(pattern, entry.getKey(), MULTIPLE_ENDPOINTS, distinct, entry.getKey(), now)) {
                fired++;
            }
        }
        return fired;
    }

    private boolean respond(AttackPattern pattern, String target, String endpoint, int observed,
                            String networkAddress, Instant now) {
        if (!throttle.tryAcquire(pattern.type().value() + ":" + target, pattern.timeWindow(), now)) {
            return false;
        }

        switch (pattern.action()) {
            case BLOCK -> blocks.block(target, now.plus(pattern.timeWindow()));
            case CAPTCHA -> captcha.issueChallenge(target, CaptchaType.RECAPTCHA);
            case DELAY, ALERT -> {
                // alert only
            }
        }

        log.warn("Attack pattern {} detected for {} ({} observed, threshold {}), action={}",
                pattern.type().value(), StringSanitizer.forLog(target), observed,
                pattern.threshold(), pattern.action().value());

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("attackType", pattern.type().value());
        metadata.put("threshold", pattern.threshold());
        metadata.put("observed", observed);
        metadata.put("timeWindowSeconds", pattern.timeWindow().toSeconds());
        metadata.put("action", pattern.action().value());
        if (networkAddress != null) {
            metadata.put("networkAddress", networkAddress);
        }
        alertBus.publish(new SecurityAlert(AlertType.ATTACK_DETECTED, Severity.HIGH, target, endpoint,
                pattern.description() + " detected", now, metadata));
        return true;
    }

    private static String lastAddress(List<Attempt> attempts) {
        for (int i = attempts.size() - 1; i >= 0; i--) {
            String address = attempts.get(i).networkAddress();
            if (address != null) {
                return address;
            }
        }
        return null;
    }
}
