package com.example.guard.maintenance;

import com.example.guard.detection.AnomalyDetector;
import com.example.guard.detection.AttackPatternDetector;
import com.example.guard.observability.metrics.ProtectionMetrics;
import com.example.guard.threat.ThreatAggregator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.function.BooleanSupplier;

/**
 * Background cadence of the engine: monitoring every 30 seconds, maintenance every
 * five minutes by default. Each step runs even when an earlier one failed.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ScheduledJobs {

    private final AttackPatternDetector attackPatternDetector;
    private final AnomalyDetector anomalyDetector;
    private final ThreatAggregator threatAggregator;
    private final MaintenanceSweeper maintenanceSweeper;
    private final ProtectionMetrics metrics;

    @Scheduled(fixedRateString = "${protection.schedule.monitoring-interval:PT30S}",
            initialDelayString = "${protection.schedule.monitoring-interval:PT30S}")
    public void monitor() {
        run("attack-sweep", () -> {
            int fired = attackPatternDetector.sweep();
            if (fired > 0) {
                log.info("Periodic sweep detected {} attack patterns", fired);
            }
            return true;
        });
        run("anomaly-rules", () -> {
            int raised = anomalyDetector.evaluate();
            if (raised > 0) {
                log.info("Anomaly rules raised {} alerts", raised);
            }
            return true;
        });
        run("threat-aggregation", () -> threatAggregator.aggregate() != null);
    }

    @Scheduled(fixedRateString = "${protection.schedule.maintenance-interval:PT5M}",
            initialDelayString = "${protection.schedule.maintenance-interval:PT5M}")
    public void maintain() {
        run("maintenance", () -> {
            SweepReport report = maintenanceSweeper.sweep();
            if (report.total() > 0) {
                log.info("Maintenance sweep reclaimed {} entries", report.total());
            }
            return report.successful();
        });
    }

    private void run(String job, BooleanSupplier step) {
        try {
            metrics.recordSweep(job, step.getAsBoolean());
        } catch (RuntimeException e) {
            log.error("Scheduled job {} failed: {}", job, e.getMessage(), e);
            metrics.recordSweep(job, false);
        }
    }
}
