package com.example.guard.engine;

import com.example.guard.alert.AlertType;
import com.example.guard.alert.Severity;
import com.example.guard.incident.IncidentStatus;
import com.example.guard.sanitize.ThreatCategory;
import com.example.guard.threat.SystemHealth;

import java.util.List;
import java.util.Map;

/**
 * Aggregated view served by the admin metrics endpoint.
 */
public record ProtectionStatistics(
        Map<AlertType, Long> alertsByType,
        Map<Severity, Long> alertsBySeverity,
        int alertsLast24Hours,
        int activeLockouts,
        int activeBlocks,
        int activeCaptchas,
        Map<String, Integer> attemptsByEndpoint,
        Map<String, Integer> requestsByEndpoint,
        List<TargetCount> topTargets,
        Map<ThreatCategory, Long> inputThreats,
        Map<IncidentStatus, Long> incidentsByStatus,
        List<String> configuredEndpoints,
        int rateLimitRules,
        int attackPatterns,
        int policies,
        SystemHealth health
) {
    public record TargetCount(String identifier, long alerts) {
    }
}
