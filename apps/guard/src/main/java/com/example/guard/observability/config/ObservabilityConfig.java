package com.example.guard.observability.config;

import com.example.guard.observability.audit.SecurityAuditLogger;
import com.example.guard.observability.metrics.ProtectionMetrics;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tag;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.actuate.autoconfigure.metrics.MeterRegistryCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/**
 * Metrics tagging and the audit/metrics sinks shared by the engine components.
 */
@Configuration
public class ObservabilityConfig {

    @Value("${spring.application.name:guard}")
    private String applicationName;

    @Value("${spring.profiles.active:local}")
    private String environment;

    @Bean
    public MeterRegistryCustomizer<MeterRegistry> metricsCommonTags() {
        return registry -> registry.config()
                .commonTags(List.of(
                        Tag.of("application", applicationName),
                        Tag.of("environment", environment)
                ));
    }

    @Bean
    public ProtectionMetrics protectionMetrics(MeterRegistry meterRegistry) {
        return new ProtectionMetrics(meterRegistry);
    }

    @Bean
    public SecurityAuditLogger securityAuditLogger(ObjectMapper objectMapper) {
        return new SecurityAuditLogger(objectMapper);
    }
}
