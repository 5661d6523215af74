package com.example.guard.observability.health;

import com.example.guard.threat.HealthStatus;
import com.example.guard.threat.SystemHealth;
import com.example.guard.threat.ThreatLevel;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.Status;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("ThreatLevelHealthIndicator")
class ThreatLevelHealthIndicatorTest {

    private static final Instant NOW = Instant.parse("2024-06-01T10:00:00Z");

    @Test
    @DisplayName("should report UP while healthy")
    void shouldReportUp() {
        Health health = ThreatLevelHealthIndicator.toHealth(
                new SystemHealth(HealthStatus.HEALTHY, ThreatLevel.NONE, NOW, null, 120));

        assertThat(health.getStatus()).isEqualTo(Status.UP);
        assertThat(health.getDetails())
                .containsEntry("status", "healthy")
                .containsEntry("threatLevel", "none")
                .containsEntry("uptimeSeconds", 120L)
                .doesNotContainKeys("lastIncidentAt", "factors");
    }

    @Test
    @DisplayName("should stay UP with details on a warning")
    void shouldStayUpOnWarning() {
        ThreatLevel level = new ThreatLevel(ThreatLevel.Level.MEDIUM, 12,
                List.of("3 high-severity events"), List.of());

        Health health = ThreatLevelHealthIndicator.toHealth(
                new SystemHealth(HealthStatus.WARNING, level, NOW, NOW.minusSeconds(60), 600));

        assertThat(health.getStatus()).isEqualTo(Status.UP);
        assertThat(health.getDetails())
                .containsEntry("status", "warning")
                .containsEntry("score", 12)
                .containsEntry("lastIncidentAt", "2024-06-01T09:59:00Z")
                .containsEntry("factors", List.of("3 high-severity events"));
    }

    @Test
    @DisplayName("should report OUT_OF_SERVICE on a critical threat level")
    void shouldReportOutOfService() {
        ThreatLevel level = new ThreatLevel(ThreatLevel.Level.CRITICAL, 55, List.of("attack wave"), List.of());

        Health health = ThreatLevelHealthIndicator.toHealth(
                new SystemHealth(HealthStatus.CRITICAL, level, NOW, NOW, 600));

        assertThat(health.getStatus()).isEqualTo(Status.OUT_OF_SERVICE);
        assertThat(health.getDetails()).containsEntry("threatLevel", "critical");
    }
}
