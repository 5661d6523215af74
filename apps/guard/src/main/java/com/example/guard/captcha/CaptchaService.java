package com.example.guard.captcha;

import com.example.guard.common.util.StringSanitizer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.Nullable;

import java.security.SecureRandom;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HexFormat;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * CAPTCHA challenge lifecycle: at most one live challenge per identifier, a fixed
 * lifetime and a bounded number of verification attempts.
 */
@Slf4j
public class CaptchaService {

    private static final int TOKEN_BYTES = 16;

    private final ConcurrentHashMap<String, CaptchaChallenge> challenges = new ConcurrentHashMap<>();
    private final SecureRandom secureRandom = new SecureRandom();
    private final CaptchaVerifier verifier;
    private final Clock clock;
    private final Duration ttl;
    private final int maxAttempts;

    public CaptchaService(CaptchaVerifier verifier, Clock clock, Duration ttl, int maxAttempts) {
        this.verifier = verifier;
        this.clock = clock;
        this.ttl = ttl;
        this.maxAttempts = maxAttempts;
    }

    /**
     * Issues a fresh challenge, replacing any challenge still live for the identifier.
     */
    public CaptchaChallenge issueChallenge(String identifier, CaptchaType type) {
        byte[] bytes = new byte[TOKEN_BYTES];
        secureRandom.nextBytes(bytes);
        Instant now = clock.instant();
        CaptchaChallenge challenge = new CaptchaChallenge(identifier, type,
                HexFormat.of().formatHex(bytes), now, now.plus(ttl), 0);
        challenges.put(identifier, challenge);
        log.debug("Issued {} challenge for {}", type.value(), StringSanitizer.forLog(identifier));
        return challenge;
    }

    /**
     * Never throws: unknown, expired or exhausted challenges and malformed responses all
     * yield {@code false}. Every call against a live challenge consumes an attempt.
     */
    public boolean verify(String identifier, @Nullable String response) {
        CaptchaChallenge current = challenges.computeIfPresent(identifier, (id, c) -> c.withAttempt());
        if (current == null) {
            return false;
        }
        if (current.isExpired(clock.instant())) {
            challenges.remove(identifier, current);
            log.debug("Challenge for {} expired", StringSanitizer.forLog(identifier));
            return false;
        }
        if (current.attemptsUsed() > maxAttempts) {
            challenges.remove(identifier, current);
            return false;
        }

        boolean valid = response != null && !response.isBlank() && check(current, response);
        if (valid) {
            challenges.remove(identifier, current);
        } else if (current.attemptsUsed() >= maxAttempts) {
            challenges.remove(identifier, current);
            log.info("Challenge for {} exhausted after {} attempts",
                    StringSanitizer.forLog(identifier), current.attemptsUsed());
        }
        return valid;
    }

    public Optional<CaptchaChallenge> find(String identifier) {
        CaptchaChallenge challenge = challenges.get(identifier);
        if (challenge == null || challenge.isExpired(clock.instant())) {
            return Optional.empty();
        }
        return Optional.of(challenge);
    }

    public boolean clear(String identifier) {
        return challenges.remove(identifier) != null;
    }

    public int purgeExpired(Instant now) {
        int before = challenges.size();
        challenges.values().removeIf(challenge -> challenge.isExpired(now));
        return before - challenges.size();
    }

    public int activeCount() {
        Instant now = clock.instant();
        return (int) challenges.values().stream().filter(c -> !c.isExpired(now)).count();
    }

    private boolean check(CaptchaChallenge challenge, String response) {
        try {
            return verifier.verify(challenge, response);
        } catch (RuntimeException e) {
            log.warn("Captcha verifier failed for {}: {}",
                    StringSanitizer.forLog(challenge.identifier()), e.getMessage());
            return false;
        }
    }
}
