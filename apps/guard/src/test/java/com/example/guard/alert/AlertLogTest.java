package com.example.guard.alert;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("AlertLog")
class AlertLogTest {

    private static final Instant NOW = Instant.parse("2024-06-01T10:00:00Z");

    private static SecurityAlert alert(String identifier, Severity severity, Instant at) {
        return new SecurityAlert(AlertType.RATE_LIMIT_EXCEEDED, severity, identifier, "/api/bookings",
                "Rate limit exceeded for booking_create", at, Map.of());
    }

    @Test
    @DisplayName("should evict the oldest alerts beyond capacity but keep cumulative counts")
    void shouldEvictOldest() {
        AlertLog log = new AlertLog(2);
        log.append(alert("a", Severity.LOW, NOW));
        log.append(alert("b", Severity.HIGH, NOW));
        log.append(alert("c", Severity.HIGH, NOW));

        assertThat(log.all()).extracting(SecurityAlert::identifier).containsExactly("b", "c");
        assertThat(log.size()).isEqualTo(2);
        assertThat(log.countsBySeverity()).containsEntry(Severity.LOW, 1L).containsEntry(Severity.HIGH, 2L);
        assertThat(log.countsByType()).containsEntry(AlertType.RATE_LIMIT_EXCEEDED, 3L);
    }

    @Test
    @DisplayName("should return only alerts inside the window")
    void shouldFilterByWindow() {
        AlertLog log = new AlertLog(10);
        log.append(alert("old", Severity.LOW, NOW.minus(Duration.ofHours(2))));
        log.append(alert("new", Severity.LOW, NOW.minus(Duration.ofMinutes(5))));

        assertThat(log.recent(Duration.ofHours(1), NOW)).extracting(SecurityAlert::identifier).containsExactly("new");
    }

    @Test
    @DisplayName("should purge alerts at or before the cutoff")
    void shouldPurge() {
        AlertLog log = new AlertLog(10);
        log.append(alert("old", Severity.LOW, NOW.minus(Duration.ofDays(2))));
        log.append(alert("edge", Severity.LOW, NOW.minus(Duration.ofDays(1))));
        log.append(alert("new", Severity.LOW, NOW));

        assertThat(log.purgeOlderThan(NOW.minus(Duration.ofDays(1)))).isEqualTo(2);
        assertThat(log.all()).extracting(SecurityAlert::identifier).containsExactly("new");
        assertThat(log.size()).isEqualTo(1);
    }

    @Test
    @DisplayName("should reject a non-positive capacity")
    void shouldRejectBadCapacity() {
        assertThatThrownBy(() -> new AlertLog(0)).isInstanceOf(IllegalArgumentException.class);
    }
}
