package com.example.guard.captcha;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum CaptchaType {
    RECAPTCHA,
    HCAPTCHA,
    IMAGE,
    MATH;

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static CaptchaType from(String value) {
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
