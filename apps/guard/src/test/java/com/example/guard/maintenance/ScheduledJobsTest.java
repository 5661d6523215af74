package com.example.guard.maintenance;

import com.example.guard.detection.AnomalyDetector;
import com.example.guard.detection.AttackPatternDetector;
import com.example.guard.observability.metrics.ProtectionMetrics;
import com.example.guard.threat.ThreatAggregator;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("ScheduledJobs")
class ScheduledJobsTest {

    @Mock
    private AttackPatternDetector attackPatternDetector;
    @Mock
    private AnomalyDetector anomalyDetector;
    @Mock
    private ThreatAggregator threatAggregator;
    @Mock
    private MaintenanceSweeper maintenanceSweeper;

    private SimpleMeterRegistry registry;
    private ScheduledJobs jobs;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        jobs = new ScheduledJobs(attackPatternDetector, anomalyDetector, threatAggregator, maintenanceSweeper,
                new ProtectionMetrics(registry));
    }

    private double runs(String job, String outcome) {
        return registry.counter("protection.jobs", "job", job, "outcome", outcome).count();
    }

    @Test
    @DisplayName("should keep monitoring when an earlier step throws")
    void shouldContinueAfterFailure() {
        when(attackPatternDetector.sweep()).thenThrow(new IllegalStateException("ledger unavailable"));
        when(anomalyDetector.evaluate()).thenReturn(0);

        jobs.monitor();

        verify(anomalyDetector).evaluate();
        verify(threatAggregator).aggregate();
        assertThat(runs("attack-sweep", "failure")).isEqualTo(1.0);
        assertThat(runs("anomaly-rules", "success")).isEqualTo(1.0);
    }

    @Test
    @DisplayName("should record a partially failed sweep as a failure")
    void shouldReportSweepFailures() {
        when(maintenanceSweeper.sweep()).thenReturn(new SweepReport(Map.of("lockouts", 2), List.of("blocks")));

        jobs.maintain();

        assertThat(runs("maintenance", "failure")).isEqualTo(1.0);
    }

    @Test
    @DisplayName("should record a clean sweep as a success")
    void shouldReportSweepSuccess() {
        when(maintenanceSweeper.sweep()).thenReturn(new SweepReport(Map.of(), List.of()));

        jobs.maintain();

        assertThat(runs("maintenance", "success")).isEqualTo(1.0);
    }
}
