package com.example.guard.web.model.request;

import com.example.guard.captcha.CaptchaType;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record ChallengeRequest(
        @NotBlank(message = "Identifier is required")
        @Size(max = 256)
        String identifier,

        CaptchaType type
) {
    public ChallengeRequest {
        if (type == null) {
            type = CaptchaType.RECAPTCHA;
        }
    }
}
