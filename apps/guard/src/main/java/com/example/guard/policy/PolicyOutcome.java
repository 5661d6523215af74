package com.example.guard.policy;

import com.example.guard.action.SecurityAction;

import java.util.List;

/**
 * A policy that fired and the actions it executed.
 */
public record PolicyOutcome(String policyName, List<SecurityAction> actions) {

    public PolicyOutcome {
        actions = List.copyOf(actions);
    }
}
