package com.example.guard.policy;

import com.example.guard.action.ActionTemplate;

import java.util.List;
import java.util.Objects;

/**
 * Declarative policy: all rules must hold for the bound actions to run.
 */
public record SecurityPolicy(
        String name,
        String description,
        boolean enabled,
        List<PolicyRule> rules,
        List<ActionTemplate> actions
) {
    public SecurityPolicy {
        Objects.requireNonNull(name, "name");
        description = description == null ? "" : description;
        rules = rules == null ? List.of() : List.copyOf(rules);
        actions = actions == null ? List.of() : List.copyOf(actions);
    }

    public SecurityPolicy withEnabled(boolean enabled) {
        return new SecurityPolicy(name, description, enabled, rules, actions);
    }
}
