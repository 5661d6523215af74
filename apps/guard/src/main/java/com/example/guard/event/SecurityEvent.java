package com.example.guard.event;

import com.example.guard.alert.SecurityAlert;
import com.example.guard.alert.Severity;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Entry in the monitoring event stream that anomaly rules, policies and the
 * threat aggregator read.
 */
public record SecurityEvent(
        Instant timestamp,
        String type,
        String identifier,
        String endpoint,
        Severity severity,
        Map<String, Object> metadata
) {
    public static final String DATA_ACCESS = "data_access";

    public SecurityEvent {
        Objects.requireNonNull(timestamp, "timestamp");
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(severity, "severity");
        identifier = identifier == null ? "" : identifier;
        endpoint = endpoint == null ? "" : endpoint;
        metadata = metadata == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    public static SecurityEvent from(SecurityAlert alert) {
        return new SecurityEvent(alert.timestamp(), alert.type().value(), alert.identifier(),
                alert.endpoint(), alert.severity(), alert.metadata());
    }

    /**
     * Network address recorded in metadata, or the identifier when none is known.
     */
    public String source() {
        Object address = metadata.get("networkAddress");
        return address != null ? address.toString() : identifier;
    }
}
