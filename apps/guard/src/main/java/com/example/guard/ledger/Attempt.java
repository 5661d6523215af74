package com.example.guard.ledger;

import org.springframework.lang.Nullable;

import java.time.Instant;
import java.util.Objects;

public record Attempt(
        String identifier,
        String endpoint,
        Instant timestamp,
        boolean success,
        @Nullable String networkAddress,
        @Nullable String clientSignature
) {
    public Attempt {
        Objects.requireNonNull(identifier, "identifier");
        Objects.requireNonNull(endpoint, "endpoint");
        Objects.requireNonNull(timestamp, "timestamp");
    }

    public static Attempt of(String identifier, String endpoint, Instant timestamp,
                             boolean success, RequestMetadata metadata) {
        return new Attempt(identifier, endpoint, timestamp, success,
                metadata.networkAddress(), metadata.clientSignature());
    }

    public AttemptKey key() {
        return new AttemptKey(identifier, endpoint);
    }

    public boolean failed() {
        return !success;
    }
}
