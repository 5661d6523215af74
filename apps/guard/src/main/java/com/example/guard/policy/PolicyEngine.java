package com.example.guard.policy;

import com.example.guard.action.ActionContext;
import com.example.guard.action.ActionExecutor;
import com.example.guard.action.ActionTemplate;
import com.example.guard.action.SecurityAction;
import com.example.guard.alert.Severity;
import com.example.guard.event.SecurityEvent;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.Nullable;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;

/**
 * Evaluates security events against the registered policies.
 *
 * <p>Every enabled policy whose rules all hold fires, so overlapping policies each
 * contribute their actions. A policy that fails to evaluate is logged and skipped;
 * the remaining policies are still evaluated.
 */
@Slf4j
public class PolicyEngine {

    private final Map<String, SecurityPolicy> policies = new LinkedHashMap<>();
    private final ConcurrentHashMap<String, Pattern> patternCache = new ConcurrentHashMap<>();
    private final ActionExecutor actionExecutor;
    private volatile List<SecurityPolicy> ordered = List.of();

    public PolicyEngine(List<SecurityPolicy> initialPolicies, ActionExecutor actionExecutor) {
        this.actionExecutor = actionExecutor;
        initialPolicies.forEach(this::register);
        log.info("Policy engine initialized with {} policies", ordered.size());
    }

    /**
     * @param reference incident id the actions are taken for, if any
     */
    public List<PolicyOutcome> evaluate(SecurityEvent event, @Nullable String reference) {
        List<PolicyOutcome> outcomes = new ArrayList<>();
        for (SecurityPolicy policy : ordered) {
            if (!policy.enabled()) {
                continue;
            }
            try {
                if (matches(event, policy)) {
                    outcomes.add(new PolicyOutcome(policy.name(), execute(event, policy, reference)));
                }
            } catch (RuntimeException e) {
                log.error("Policy {} failed to evaluate: {}", policy.name(), e.getMessage(), e);
            }
        }
        if (!outcomes.isEmpty()) {
            log.debug("{} policies fired for {} event", outcomes.size(), event.type());
        }
        return outcomes;
    }

    public boolean matches(SecurityEvent event, SecurityPolicy policy) {
        for (PolicyRule rule : policy.rules()) {
            if (!matches(event, rule)) {
                return false;
            }
        }
        return true;
    }

    public synchronized void register(SecurityPolicy policy) {
        policies.put(policy.name(), policy);
        ordered = List.copyOf(policies.values());
    }

    public synchronized boolean remove(String name) {
        boolean removed = policies.remove(name) != null;
        if (removed) {
            ordered = List.copyOf(policies.values());
        }
        return removed;
    }

    public synchronized boolean setEnabled(String name, boolean enabled) {
        SecurityPolicy policy = policies.get(name);
        if (policy == null) {
            return false;
        }
        policies.put(name, policy.withEnabled(enabled));
        ordered = List.copyOf(policies.values());
        return true;
    }

    public Optional<SecurityPolicy> find(String name) {
        return ordered.stream().filter(policy -> policy.name().equals(name)).findFirst();
    }

    public List<SecurityPolicy> policies() {
        return ordered;
    }

    private List<SecurityAction> execute(SecurityEvent event, SecurityPolicy policy, @Nullable String reference) {
        ActionContext context = new ActionContext(event.identifier(), event.severity(),
                reference != null ? reference : policy.name(),
                policy.name() + " triggered by " + event.type() + " on " + event.endpoint());
        List<SecurityAction> actions = new ArrayList<>();
        for (ActionTemplate template : policy.actions()) {
            actions.add(actionExecutor.execute(context, template));
        }
        return actions;
    }

    private boolean matches(SecurityEvent event, PolicyRule rule) {
        String actual = lookup(event, rule.condition());
        boolean result = actual != null && apply(rule.operator(), actual, rule.value());
        return rule.negated() != result;
    }

    @Nullable
    private String lookup(SecurityEvent event, String condition) {
        return switch (condition) {
            case "endpoint" -> event.endpoint();
            case "severity" -> event.severity().value();
            case "type" -> event.type();
            case "identifier" -> event.identifier();
            default -> {
                Object value = event.metadata().get(condition);
                yield value != null ? value.toString() : null;
            }
        };
    }

    private boolean apply(RuleOperator operator, String actual, String expected) {
        return switch (operator) {
            case EQUALS -> actual.equals(expected);
            case CONTAINS -> actual.contains(expected);
            case GREATER_THAN -> compare(actual, expected) > 0;
            case LESS_THAN -> compare(actual, expected) < 0;
            case REGEX -> patternCache.computeIfAbsent(expected, Pattern::compile).matcher(actual).find();
        };
    }

    /**
     * Severity names compare by rank, numbers numerically, anything else lexicographically.
     */
    static int compare(String actual, String expected) {
        Optional<Severity> left = Severity.parse(actual);
        Optional<Severity> right = Severity.parse(expected);
        if (left.isPresent() && right.isPresent()) {
            return left.get().compareTo(right.get());
        }
        Double leftNumber = parseNumber(actual);
        Double rightNumber = parseNumber(expected);
        if (leftNumber != null && rightNumber != null) {
            return Double.compare(leftNumber, rightNumber);
        }
        return actual.compareTo(expected);
    }

    @Nullable
    private static Double parseNumber(String value) {
        try {
            return Double.valueOf(value.trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
