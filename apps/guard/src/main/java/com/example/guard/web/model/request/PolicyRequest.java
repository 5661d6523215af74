package com.example.guard.web.model.request;

import com.example.guard.action.ActionTemplate;
import com.example.guard.action.ActionType;
import com.example.guard.policy.PolicyRule;
import com.example.guard.policy.RuleOperator;
import com.example.guard.policy.SecurityPolicy;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

import java.util.List;

public record PolicyRequest(
        @NotBlank(message = "Policy name is required")
        @Size(max = 64)
        String name,

        @Size(max = 256)
        String description,

        Boolean enabled,

        @NotEmpty(message = "At least one rule is required")
        List<@Valid Rule> rules,

        List<@Valid Action> actions
) {
    public record Rule(
            @NotBlank(message = "Condition is required")
            String condition,

            @NotNull(message = "Operator is required")
            RuleOperator operator,

            @NotNull(message = "Value is required")
            String value,

            boolean negated
    ) {}

    public record Action(
            @NotNull(message = "Action type is required")
            ActionType type,

            @Size(max = 256)
            String description
    ) {}

    public SecurityPolicy toPolicy() {
        return new SecurityPolicy(name, description, enabled == null || enabled,
                rules.stream().map(rule -> new PolicyRule(rule.condition(), rule.operator(), rule.value(),
                        rule.negated())).toList(),
                actions == null ? List.of() : actions.stream()
                        .map(action -> ActionTemplate.of(action.type(), action.description()))
                        .toList());
    }
}
