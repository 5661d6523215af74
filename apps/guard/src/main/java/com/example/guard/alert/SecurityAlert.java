package com.example.guard.alert;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Alert raised by a decision path, a detector or the input classifier.
 */
public record SecurityAlert(
        AlertType type,
        Severity severity,
        String identifier,
        String endpoint,
        String description,
        Instant timestamp,
        Map<String, Object> metadata
) {
    public SecurityAlert {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(severity, "severity");
        Objects.requireNonNull(timestamp, "timestamp");
        metadata = metadata == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }
}
