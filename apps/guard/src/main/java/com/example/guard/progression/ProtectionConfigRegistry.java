package com.example.guard.progression;

import lombok.extern.slf4j.Slf4j;

import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Named protection configurations; a registration replaces the previous config wholesale.
 */
@Slf4j
public class ProtectionConfigRegistry {

    private final ConcurrentHashMap<String, ProtectionConfig> configs = new ConcurrentHashMap<>();

    public ProtectionConfigRegistry(Map<String, ProtectionConfig> initial) {
        configs.putAll(initial);
        log.info("Protection config registry initialized with {} endpoints: {}",
                configs.size(), new TreeMap<>(configs).keySet());
    }

    public Optional<ProtectionConfig> find(String endpoint) {
        return Optional.ofNullable(configs.get(endpoint));
    }

    public void register(String endpoint, ProtectionConfig config) {
        configs.put(endpoint, config);
        log.info("Registered protection config for {} (maxAttempts={}, window={})",
                endpoint, config.maxAttempts(), config.timeWindow());
    }

    public Map<String, ProtectionConfig> all() {
        return new TreeMap<>(configs);
    }

    public int size() {
        return configs.size();
    }
}
