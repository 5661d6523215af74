package com.example.guard.captcha;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;

/**
 * Accepts a response only when it equals the token that was issued with the challenge.
 */
public class IssuedTokenVerifier implements CaptchaVerifier {

    @Override
    public boolean verify(CaptchaChallenge challenge, String response) {
        return MessageDigest.isEqual(
                challenge.token().getBytes(StandardCharsets.UTF_8),
                response.trim().getBytes(StandardCharsets.UTF_8));
    }
}
