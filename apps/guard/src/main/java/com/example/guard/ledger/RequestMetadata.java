package com.example.guard.ledger;

import org.springframework.lang.Nullable;

import java.util.Map;
import java.util.stream.Collectors;

/**
 * Context reported alongside an attempt. Attributes are free-form and only
 * consulted by policy rule lookups; entries with a null key or value are dropped.
 */
public record RequestMetadata(
        @Nullable String networkAddress,
        @Nullable String clientSignature,
        @Nullable String userId,
        Map<String, String> attributes
) {
    public static final RequestMetadata EMPTY = new RequestMetadata(null, null, null, Map.of());

    public RequestMetadata {
        attributes = attributes == null ? Map.of() : attributes.entrySet().stream()
                .filter(entry -> entry.getKey() != null && entry.getValue() != null)
                .collect(Collectors.toUnmodifiableMap(Map.Entry::getKey, Map.Entry::getValue));
    }

    public static RequestMetadata fromAddress(@Nullable String networkAddress) {
        return new RequestMetadata(networkAddress, null, null, Map.of());
    }
}
