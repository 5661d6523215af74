package com.example.guard.web.model.response;

import com.example.guard.captcha.CaptchaChallenge;
import com.example.guard.captcha.CaptchaType;

import java.time.Instant;

/**
 * Issued challenge. The token is handed to the rendering service, which embeds it
 * in the challenge shown to the user.
 */
public record ChallengeResponse(String identifier, CaptchaType type, String token, Instant expiresAt) {

    public static ChallengeResponse from(CaptchaChallenge challenge) {
        return new ChallengeResponse(challenge.identifier(), challenge.type(), challenge.token(),
                challenge.expiresAt());
    }
}
