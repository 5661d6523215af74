package com.example.guard.policy;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * One condition of a policy.
 *
 * @param condition event field ({@code endpoint}, {@code severity}, {@code type},
 *                  {@code identifier}) or a metadata key
 */
public record PolicyRule(
        String condition,
        RuleOperator operator,
        String value,
        boolean negated
) {
    public PolicyRule {
        Objects.requireNonNull(condition, "condition");
        Objects.requireNonNull(operator, "operator");
        Objects.requireNonNull(value, "value");
        if (operator == RuleOperator.REGEX) {
            Pattern.compile(value);
        }
    }

    public static PolicyRule of(String condition, RuleOperator operator, String value) {
        return new PolicyRule(condition, operator, value, false);
    }
}
