package com.example.guard.threat;

import com.example.guard.alert.AlertType;
import com.example.guard.alert.SecurityAlert;
import com.example.guard.alert.Severity;
import com.example.guard.event.SecurityEvent;
import com.example.guard.util.EngineFixture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("ThreatAggregator")
class ThreatAggregatorTest {

    private EngineFixture fixture;

    @BeforeEach
    void setUp() {
        fixture = EngineFixture.anEngine().withoutMonitor().build();
    }

    private static SecurityEvent event(Severity severity, Instant at) {
        return new SecurityEvent(at, "suspicious_activity", "mallory", "login", severity, Map.of());
    }

    @Test
    @DisplayName("should weight events by severity and list the contributing factors")
    void shouldScoreEvents() {
        Instant now = fixture.clock.instant();
        List<SecurityEvent> events = new ArrayList<>();
        events.add(event(Severity.CRITICAL, now));
        events.add(event(Severity.HIGH, now));
        events.add(event(Severity.HIGH, now));
        events.add(event(Severity.MEDIUM, now));
        events.add(event(Severity.LOW, now));
        events.add(event(Severity.LOW, now));
        events.add(event(Severity.LOW, now));

        ThreatLevel level = ThreatAggregator.assess(events);

        assertThat(level.score()).isEqualTo(25);
        assertThat(level.level()).isEqualTo(ThreatLevel.Level.HIGH);
        assertThat(level.factors()).containsExactly(
                "1 critical security events",
                "2 high severity events",
                "1 medium severity events",
                "3 low severity events");
        assertThat(level.recommendations()).contains("Increase monitoring frequency");
    }

    @ParameterizedTest(name = "score {0} is {1}")
    @CsvSource({"0, NONE", "4, NONE", "5, LOW", "9, LOW", "10, MEDIUM", "19, MEDIUM", "20, HIGH", "49, HIGH", "50, CRITICAL"})
    @DisplayName("should band scores into levels")
    void shouldBandScores(int score, ThreatLevel.Level expected) {
        assertThat(ThreatLevel.Level.fromScore(score)).isEqualTo(expected);
    }

    @Test
    @DisplayName("should start healthy with no threat")
    void shouldStartHealthy() {
        SystemHealth health = fixture.threats.health();

        assertThat(health.status()).isEqualTo(HealthStatus.HEALTHY);
        assertThat(health.threatLevel()).isEqualTo(ThreatLevel.NONE);
        assertThat(health.lastIncidentAt()).isNull();
    }

    @Test
    @DisplayName("should only count events inside the aggregation window")
    void shouldUseWindow() {
        fixture.events.append(event(Severity.CRITICAL, fixture.clock.instant()));
        fixture.clock.advance(Duration.ofMinutes(61));
        fixture.events.append(event(Severity.HIGH, fixture.clock.instant()));

        SystemHealth health = fixture.threats.aggregate();

        assertThat(health.threatLevel().score()).isEqualTo(5);
        assertThat(health.status()).isEqualTo(HealthStatus.HEALTHY);
        assertThat(health.uptimeSeconds()).isEqualTo(Duration.ofMinutes(61).toSeconds());
    }

    @Test
    @DisplayName("should turn critical under a high threat level and report the last incident")
    void shouldReportCritical() {
        for (int i = 0; i < 2; i++) {
            fixture.events.append(event(Severity.CRITICAL, fixture.clock.instant()));
        }
        fixture.incidents.openFromAlert(new SecurityAlert(AlertType.ATTACK_DETECTED, Severity.CRITICAL, "mallory",
                "login", "Brute force attack detected", fixture.clock.instant(), Map.of()));

        SystemHealth health = fixture.threats.aggregate();

        assertThat(health.threatLevel().level()).isEqualTo(ThreatLevel.Level.HIGH);
        assertThat(health.status()).isEqualTo(HealthStatus.CRITICAL);
        assertThat(health.lastIncidentAt()).isEqualTo(fixture.clock.instant());
        assertThat(fixture.threats.threatLevel()).isEqualTo(health.threatLevel());
    }

    @Test
    @DisplayName("should map a medium threat to a warning")
    void shouldWarnOnMedium() {
        assertThat(HealthStatus.from(ThreatLevel.Level.MEDIUM)).isEqualTo(HealthStatus.WARNING);
        assertThat(HealthStatus.from(ThreatLevel.Level.LOW)).isEqualTo(HealthStatus.HEALTHY);
    }
}
