package com.example.guard.incident;

import com.example.guard.action.ActionResult;
import com.example.guard.action.ActionType;
import com.example.guard.action.SecurityAction;
import com.example.guard.alert.AlertType;
import com.example.guard.alert.SecurityAlert;
import com.example.guard.alert.Severity;
import com.example.guard.event.SecurityEvent;
import com.example.guard.policy.PolicyOutcome;
import com.example.guard.util.EngineFixture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("IncidentManager")
class IncidentManagerTest {

    private EngineFixture fixture;
    private IncidentManager incidents;

    @BeforeEach
    void setUp() {
        fixture = EngineFixture.anEngine().withoutMonitor().build();
        incidents = fixture.incidents;
    }

    private SecurityAlert alert(AlertType type, Severity severity, String identifier) {
        return new SecurityAlert(type, severity, identifier, "login", "Brute force attack detected",
                fixture.clock.instant(), Map.of("failedAttempts", 5L));
    }

    private SecurityIncident openAttack(String identifier) {
        return incidents.openFromAlert(alert(AlertType.ATTACK_DETECTED, Severity.HIGH, identifier)).orElseThrow();
    }

    @Nested
    @DisplayName("opening from alerts")
    class Opening {

        @Test
        @DisplayName("should ignore alerts below high severity that are not attacks")
        void shouldIgnoreMinorAlerts() {
            assertThat(incidents.openFromAlert(alert(AlertType.SUSPICIOUS_ACTIVITY, Severity.MEDIUM, "u"))).isEmpty();
            assertThat(incidents.openFromAlert(alert(AlertType.RATE_LIMIT_EXCEEDED, Severity.LOW, "u"))).isEmpty();
            assertThat(incidents.size()).isZero();
        }

        @Test
        @DisplayName("should open an attack incident and block the identifier")
        void shouldOpenAttackIncident() {
            SecurityIncident incident = openAttack("mallory");

            assertThat(incident.getId()).startsWith("SEC-");
            assertThat(incident.getType()).isEqualTo(IncidentType.ATTACK);
            assertThat(incident.getSource()).isEqualTo("attack_detector");
            assertThat(incident.getTitle()).isEqualTo("HIGH ATTACK - mallory");
            assertThat(incident.status()).isEqualTo(IncidentStatus.OPEN);
            assertThat(incident.actions()).extracting(SecurityAction::type).containsExactly(ActionType.BLOCK);
            assertThat(fixture.blocks.activeUntil("mallory", fixture.clock.instant()))
                    .contains(fixture.clock.instant().plus(Duration.ofHours(1)));
            assertThat(incidents.lastIncidentAt()).isEqualTo(fixture.clock.instant());
        }

        @Test
        @DisplayName("should escalate critical alerts")
        void shouldEscalateCritical() {
            SecurityIncident incident = incidents.openFromAlert(
                    alert(AlertType.SUSPICIOUS_ACTIVITY, Severity.CRITICAL, "mallory")).orElseThrow();

            assertThat(incident.getType()).isEqualTo(IncidentType.ANOMALY);
            assertThat(incident.actions()).extracting(SecurityAction::type).containsExactly(ActionType.ESCALATE);
            assertThat(fixture.notifier.escalations).hasSize(1);
        }

        @Test
        @DisplayName("should give every incident a distinct id")
        void shouldGenerateDistinctIds() {
            String first = openAttack("a").getId();
            String second = openAttack("b").getId();

            assertThat(first).isNotEqualTo(second);
            assertThat(incidents.size()).isEqualTo(2);
        }
    }

    @Nested
    @DisplayName("policy outcomes")
    class PolicyOutcomes {

        private final SecurityAction captchaIssued = new SecurityAction(ActionType.CAPTCHA,
                Instant.EPOCH, "Require CAPTCHA", true, ActionResult.SUCCESS);

        @Test
        @DisplayName("should open a policy-violation incident for an event without one")
        void shouldRecordPolicyViolation() {
            SecurityEvent event = new SecurityEvent(fixture.clock.instant(), "login_failure", "mallory", "login",
                    Severity.MEDIUM, Map.of("networkAddress", "192.0.2.1"));

            SecurityIncident incident = incidents.recordPolicyViolation(event,
                    List.of(new PolicyOutcome("failed_login_policy", List.of(captchaIssued))));

            assertThat(incident.getType()).isEqualTo(IncidentType.POLICY_VIOLATION);
            assertThat(incident.getSource()).isEqualTo("policy_engine");
            assertThat(incident.getDescription()).isEqualTo("Security policies triggered: failed_login_policy");
            assertThat(incident.view().metadata())
                    .containsEntry("policies", List.of("failed_login_policy"))
                    .containsEntry("eventType", "login_failure")
                    .containsEntry("networkAddress", "192.0.2.1");
            assertThat(incident.actions()).containsExactly(captchaIssued);
        }

        @Test
        @DisplayName("should attach fired policies to an existing incident")
        void shouldAttachOutcomes() {
            SecurityIncident incident = openAttack("mallory");

            incidents.attachPolicyOutcomes(incident,
                    List.of(new PolicyOutcome("brute_force_policy", List.of(captchaIssued))));

            assertThat(incident.actions()).extracting(SecurityAction::type)
                    .containsExactly(ActionType.BLOCK, ActionType.CAPTCHA);
            assertThat(incident.view().metadata()).containsEntry("policies", List.of("brute_force_policy"));
        }
    }

    @Nested
    @DisplayName("lifecycle")
    class Lifecycle {

        @Test
        @DisplayName("should move forward through investigation to resolution")
        void shouldInvestigateThenResolve() {
            SecurityIncident incident = openAttack("mallory");

            assertThat(incidents.investigate(incident.getId())).isTrue();
            assertThat(incidents.resolve(incident.getId(), "Password reset enforced")).isTrue();

            IncidentView view = incident.view();
            assertThat(view.status()).isEqualTo(IncidentStatus.RESOLVED);
            assertThat(view.resolution()).isEqualTo("Password reset enforced");
            assertThat(view.resolvedAt()).isEqualTo(fixture.clock.instant());
        }

        @Test
        @DisplayName("should treat repeating the current status as success")
        void shouldBeIdempotent() {
            SecurityIncident incident = openAttack("mallory");
            incidents.resolve(incident.getId(), null);

            assertThat(incidents.resolve(incident.getId(), "again")).isTrue();
            assertThat(incident.view().resolution()).isNull();
        }

        @Test
        @DisplayName("should never reopen or relabel a closed incident")
        void shouldRejectBackwardTransitions() {
            SecurityIncident falsePositive = openAttack("a");
            SecurityIncident resolved = openAttack("b");
            incidents.markFalsePositive(falsePositive.getId(), "load test");
            incidents.resolve(resolved.getId(), null);

            assertThat(incidents.resolve(falsePositive.getId(), null)).isFalse();
            assertThat(incidents.investigate(falsePositive.getId())).isFalse();
            assertThat(incidents.markFalsePositive(resolved.getId(), null)).isFalse();
            assertThat(falsePositive.status()).isEqualTo(IncidentStatus.FALSE_POSITIVE);
        }

        @Test
        @DisplayName("should report unknown ids as not found")
        void shouldRejectUnknownIds() {
            assertThat(incidents.resolve("SEC-NOPE", null)).isFalse();
            assertThat(incidents.investigate("SEC-NOPE")).isFalse();
            assertThat(incidents.markFalsePositive("SEC-NOPE", null)).isFalse();
            assertThat(incidents.find("SEC-NOPE")).isEmpty();
        }
    }

    @Nested
    @DisplayName("housekeeping")
    class Housekeeping {

        @Test
        @DisplayName("should auto-resolve stale open incidents but not ones under investigation")
        void shouldAutoResolveStale() {
            SecurityIncident stale = openAttack("a");
            SecurityIncident investigating = openAttack("b");
            incidents.investigate(investigating.getId());
            fixture.clock.advance(Duration.ofHours(25));
            SecurityIncident fresh = openAttack("c");

            int resolved = incidents.autoResolveOpenedBefore(fixture.clock.instant().minus(Duration.ofHours(24)));

            assertThat(resolved).isEqualTo(1);
            assertThat(stale.view().resolution()).isEqualTo(IncidentManager.AUTO_RESOLUTION);
            assertThat(investigating.status()).isEqualTo(IncidentStatus.INVESTIGATING);
            assertThat(fresh.status()).isEqualTo(IncidentStatus.OPEN);
        }

        @Test
        @DisplayName("should leave an incident open at exactly the auto-resolve age")
        void shouldNotAutoResolveAtExactAge() {
            SecurityIncident incident = openAttack("a");
            fixture.clock.advance(Duration.ofHours(24));

            assertThat(incidents.autoResolveOpenedBefore(fixture.clock.instant().minus(Duration.ofHours(24)))).isZero();
            assertThat(incident.status()).isEqualTo(IncidentStatus.OPEN);

            fixture.clock.advance(Duration.ofSeconds(1));
            assertThat(incidents.autoResolveOpenedBefore(fixture.clock.instant().minus(Duration.ofHours(24))))
                    .isEqualTo(1);
        }

        @Test
        @DisplayName("should purge only closed incidents past retention")
        void shouldPurgeClosed() {
            SecurityIncident closed = openAttack("a");
            SecurityIncident open = openAttack("b");
            incidents.resolve(closed.getId(), null);
            fixture.clock.advance(Duration.ofDays(8));

            assertThat(incidents.purgeClosedBefore(fixture.clock.instant().minus(Duration.ofDays(7)))).isEqualTo(1);
            assertThat(incidents.find(closed.getId())).isEmpty();
            assertThat(incidents.find(open.getId())).isPresent();
        }

        @Test
        @DisplayName("should list newest first and count by status")
        void shouldListAndCount() {
            SecurityIncident older = openAttack("a");
            fixture.clock.advance(Duration.ofMinutes(1));
            SecurityIncident newer = openAttack("b");
            incidents.investigate(newer.getId());

            assertThat(incidents.list(null)).extracting(SecurityIncident::getId)
                    .containsExactly(newer.getId(), older.getId());
            assertThat(incidents.list(IncidentStatus.OPEN)).extracting(SecurityIncident::getId)
                    .containsExactly(older.getId());
            assertThat(incidents.countsByStatus())
                    .containsEntry(IncidentStatus.OPEN, 1L)
                    .containsEntry(IncidentStatus.INVESTIGATING, 1L)
                    .containsEntry(IncidentStatus.RESOLVED, 0L);
        }
    }

    @Test
    @DisplayName("should parse statuses case-insensitively and reject unknown ones")
    void shouldParseStatus() {
        assertThat(IncidentStatus.from("False_Positive")).isEqualTo(IncidentStatus.FALSE_POSITIVE);
        assertThatThrownBy(() -> IncidentStatus.from("closed"))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
