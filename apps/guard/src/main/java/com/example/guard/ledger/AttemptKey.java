package com.example.guard.ledger;

import java.util.Objects;

/**
 * Ledger key: one history per (identifier, endpoint) pair.
 */
public record AttemptKey(String identifier, String endpoint) {

    public AttemptKey {
        Objects.requireNonNull(identifier, "identifier");
        Objects.requireNonNull(endpoint, "endpoint");
    }

    @Override
    public String toString() {
        return identifier + ":" + endpoint;
    }
}
