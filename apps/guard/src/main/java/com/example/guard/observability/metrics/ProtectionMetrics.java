package com.example.guard.observability.metrics;

import com.example.guard.alert.SecurityAlert;
import com.example.guard.common.util.StringSanitizer;
import com.example.guard.progression.ProtectionDecision;
import com.example.guard.progression.RateDecision;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.lang.NonNull;

import java.util.function.Supplier;

/**
 * Micrometer instrumentation for the protection engine.
 * Endpoint tags carry only configured endpoint names, never raw caller input.
 */
public class ProtectionMetrics {

    private static final String UNCONFIGURED = "unconfigured";

    private final MeterRegistry registry;

    public ProtectionMetrics(@NonNull MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordAttempt(String endpoint, boolean configured, boolean success, ProtectionDecision decision) {
        String outcome;
        if (decision.blocked()) {
            outcome = "blocked";
        } else if (decision.requiresCaptcha()) {
            outcome = "captcha";
        } else if (decision.delayMs() > 0) {
            outcome = "delayed";
        } else {
            outcome = "allowed";
        }
        Counter.builder("protection.attempts")
                .tag("endpoint", configured ? StringSanitizer.forTag(endpoint) : UNCONFIGURED)
                .tag("result", success ? "success" : "failure")
                .tag("outcome", outcome)
                .description("Reported attempts by decision outcome")
                .register(registry)
                .increment();
    }

    public void recordRequest(String rule, RateDecision decision) {
        Counter.builder("protection.requests")
                .tag("rule", StringSanitizer.forTag(rule))
                .tag("outcome", decision.blocked() ? "blocked" : "allowed")
                .description("Rate-limited requests by outcome")
                .register(registry)
                .increment();
    }

    public void recordAlert(SecurityAlert alert) {
        Counter.builder("protection.alerts")
                .tag("type", alert.type().value())
                .tag("severity", alert.severity().value())
                .description("Security alerts published")
                .register(registry)
                .increment();
    }

    public void recordIncident(String type) {
        Counter.builder("protection.incidents")
                .tag("type", type)
                .description("Security incidents opened")
                .register(registry)
                .increment();
    }

    public void recordCaptchaVerification(boolean valid) {
        Counter.builder("protection.captcha.verifications")
                .tag("outcome", valid ? "success" : "failure")
                .description("CAPTCHA verification attempts")
                .register(registry)
                .increment();
    }

    public void recordInputClassification(boolean valid) {
        Counter.builder("protection.inputs.classified")
                .tag("outcome", valid ? "clean" : "threat")
                .description("Classified form inputs")
                .register(registry)
                .increment();
    }

    public void recordSweep(String job, boolean successful) {
        Counter.builder("protection.jobs")
                .tag("job", job)
                .tag("outcome", successful ? "success" : "failure")
                .description("Background job runs")
                .register(registry)
                .increment();
    }

    public void gauge(String name, String description, Supplier<Number> value) {
        Gauge.builder(name, value)
                .description(description)
                .register(registry);
    }
}
