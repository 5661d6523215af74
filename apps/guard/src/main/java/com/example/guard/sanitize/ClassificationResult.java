package com.example.guard.sanitize;

import com.example.guard.alert.Severity;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * @param threats         threats found in the original input
 * @param residualThreats threats still present after sanitization
 * @param confidence      share of threats removed by sanitization; 1.0 for clean input
 */
public record ClassificationResult(
        boolean valid,
        String sanitized,
        List<InputThreat> threats,
        List<InputThreat> residualThreats,
        double confidence
) {
    public ClassificationResult {
        threats = List.copyOf(threats);
        residualThreats = List.copyOf(residualThreats);
    }

    public static ClassificationResult clean(String sanitized) {
        return new ClassificationResult(true, sanitized, List.of(), List.of(), 1.0);
    }

    public Optional<Severity> highestSeverity() {
        return threats.stream().map(InputThreat::severity).max(Comparator.naturalOrder());
    }
}
