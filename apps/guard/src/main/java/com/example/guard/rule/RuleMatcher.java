package com.example.guard.rule;

import lombok.extern.slf4j.Slf4j;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Ordered registry of rate-limit rules. The first rule (in registration order)
 * whose matcher accepts the endpoint applies; replacing a rule keeps its position.
 */
@Slf4j
public class RuleMatcher {

    private final Map<String, RateLimitRule> rules = new LinkedHashMap<>();
    private volatile List<RateLimitRule> ordered = List.of();

    public RuleMatcher(List<RateLimitRule> initialRules) {
        initialRules.forEach(this::register);
        log.info("Rule matcher initialized with {} rate-limit rules", ordered.size());
    }

    public Optional<RateLimitRule> resolve(String endpoint) {
        for (RateLimitRule rule : ordered) {
            if (rule.appliesTo(endpoint)) {
                return Optional.of(rule);
            }
        }
        return Optional.empty();
    }

    public synchronized void register(RateLimitRule rule) {
        rules.put(rule.name(), rule);
        ordered = List.copyOf(rules.values());
        log.debug("Registered rate-limit rule {} -> {}", rule.name(), rule.matcher().expression());
    }

    public synchronized boolean remove(String name) {
        boolean removed = rules.remove(name) != null;
        if (removed) {
            ordered = List.copyOf(rules.values());
        }
        return removed;
    }

    public Optional<RateLimitRule> find(String name) {
        return ordered.stream().filter(rule -> rule.name().equals(name)).findFirst();
    }

    public List<RateLimitRule> rules() {
        return ordered;
    }
}
