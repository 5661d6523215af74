package com.example.guard.captcha;

/**
 * Checks a solved challenge. Provider-backed implementations (reCAPTCHA, hCaptcha)
 * replace the default bean.
 */
@FunctionalInterface
public interface CaptchaVerifier {

    /**
     * @param response non-blank response submitted by the client
     */
    boolean verify(CaptchaChallenge challenge, String response);
}
