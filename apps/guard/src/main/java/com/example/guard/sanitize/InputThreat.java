package com.example.guard.sanitize;

import com.example.guard.alert.Severity;

/**
 * @param matched first matching fragment of the input
 */
public record InputThreat(
        ThreatCategory category,
        Severity severity,
        String rule,
        String matched,
        String recommendation
) {
}
