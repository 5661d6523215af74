package com.example.guard.captcha;

import java.time.Instant;

public record CaptchaChallenge(
        String identifier,
        CaptchaType type,
        String token,
        Instant issuedAt,
        Instant expiresAt,
        int attemptsUsed
) {
    public CaptchaChallenge withAttempt() {
        return new CaptchaChallenge(identifier, type, token, issuedAt, expiresAt, attemptsUsed + 1);
    }

    public boolean isExpired(Instant now) {
        return !expiresAt.isAfter(now);
    }
}
