package com.example.guard.web.controller;

import com.example.guard.common.exception.GlobalExceptionHandler;
import com.example.guard.ledger.RequestMetadata;
import com.example.guard.util.EngineFixture;
import com.example.guard.util.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.test.web.reactive.server.WebTestClient;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("ProtectionAdminController")
class ProtectionAdminControllerTest {

    private static final String BASE = "/api/v1/admin/protection";
    private static final String LOGIN = "/api/auth/login";

    private EngineFixture fixture;
    private WebTestClient client;

    @BeforeEach
    void setUp() {
        fixture = EngineFixture.anEngine()
                .withConfig(LOGIN, EngineFixture.loginConfig())
                .build();
        client = WebTestClient.bindToController(new ProtectionAdminController(fixture.engine, fixture.clock))
                .controllerAdvice(new GlobalExceptionHandler())
                .build();
    }

    private WebTestClient.ResponseSpec send(HttpMethod method, String uri, Object body) {
        return client.method(method)
                .uri(uri)
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(body)
                .exchange();
    }

    @Nested
    @DisplayName("configuration")
    class Configuration {

        @Test
        @DisplayName("should register an endpoint config")
        void shouldRegisterConfig() {
            send(HttpMethod.PUT, BASE + "/configs/payment", Map.of(
                    "maxAttempts", 3,
                    "timeWindow", "PT1H",
                    "lockoutDuration", "PT2H",
                    "progressiveDelay", false,
                    "captchaThreshold", 1,
                    "alertThreshold", 1,
                    "whitelistedAddresses", List.of("10.0.0.1")))
                    .expectStatus().isOk()
                    .expectBody()
                    .jsonPath("$.maxAttempts").isEqualTo(3);

            assertThat(fixture.engine.protectionConfigs()).containsKeys(LOGIN, "payment");
            assertThat(fixture.engine.protectionConfigs().get("payment").lockoutDuration())
                    .isEqualTo(Duration.ofHours(2));
        }

        @Test
        @DisplayName("should reject a config without a window")
        void shouldRejectIncompleteConfig() {
            send(HttpMethod.PUT, BASE + "/configs/payment", Map.of(
                    "maxAttempts", 3,
                    "lockoutDuration", "PT2H"))
                    .expectStatus().isBadRequest()
                    .expectBody()
                    .jsonPath("$.error").isEqualTo("validation_error")
                    .jsonPath("$.details[0].field").isEqualTo("timeWindow");
        }

        @Test
        @DisplayName("should register, list and remove rate-limit rules")
        void shouldManageRules() {
            send(HttpMethod.POST, BASE + "/rules", Map.of(
                    "name", "search_api",
                    "endpoint", "regex:^/api/movies/search",
                    "window", "PT1M",
                    "maxRequests", 30,
                    "skipSuccessful", false,
                    "skipFailed", false,
                    "adaptive", false,
                    "adaptiveThreshold", 0))
                    .expectStatus().isCreated()
                    .expectBody()
                    .jsonPath("$.name").isEqualTo("search_api");

            client.get().uri(BASE + "/rules").exchange()
                    .expectStatus().isOk()
                    .expectBody()
                    .jsonPath("$.length()").isEqualTo(1)
                    .jsonPath("$[0].name").isEqualTo("search_api");

            client.delete().uri(BASE + "/rules/search_api").exchange()
                    .expectStatus().isOk()
                    .expectBody()
                    .jsonPath("$.operation").isEqualTo("remove_rule")
                    .jsonPath("$.changed").isEqualTo(true);

            assertThat(fixture.engine.rateLimitRules()).isEmpty();
        }

        @Test
        @DisplayName("should answer 404 when removing an unknown rule")
        void shouldRejectUnknownRule() {
            client.delete().uri(BASE + "/rules/missing").exchange()
                    .expectStatus().isNotFound()
                    .expectBody()
                    .jsonPath("$.error").isEqualTo("not_found");
        }

        @Test
        @DisplayName("should answer 400 for an invalid rule pattern")
        void shouldRejectInvalidRegex() {
            send(HttpMethod.POST, BASE + "/rules", Map.of(
                    "name", "broken",
                    "endpoint", "regex:[unclosed",
                    "window", "PT1M",
                    "maxRequests", 30))
                    .expectStatus().isBadRequest()
                    .expectBody()
                    .jsonPath("$.error").isEqualTo("invalid_argument");
        }

        @Test
        @DisplayName("should add attack patterns")
        void shouldAddPattern() {
            int before = fixture.engine.attackPatterns().size();

            send(HttpMethod.POST, BASE + "/patterns", Map.of(
                    "type", "SCRAPING",
                    "threshold", 200,
                    "timeWindow", "PT1M",
                    "action", "CAPTCHA"))
                    .expectStatus().isCreated();

            assertThat(fixture.engine.attackPatterns()).hasSize(before + 1);
        }
    }

    @Nested
    @DisplayName("policies")
    class Policies {

        private void registerPolicy() {
            send(HttpMethod.POST, BASE + "/policies", Map.of(
                    "name", "night_logins",
                    "description", "Logins flagged by the night shift",
                    "rules", List.of(Map.of("condition", "type", "operator", "equals", "value", "attack_detected",
                            "negated", false)),
                    "actions", List.of(Map.of("type", "notify"))))
                    .expectStatus().isCreated()
                    .expectBody()
                    .jsonPath("$.name").isEqualTo("night_logins")
                    .jsonPath("$.enabled").isEqualTo(true);
        }

        @Test
        @DisplayName("should register and disable a policy")
        void shouldToggle() {
            registerPolicy();

            client.put().uri(BASE + "/policies/night_logins/enabled?value=false").exchange()
                    .expectStatus().isOk()
                    .expectBody()
                    .jsonPath("$.operation").isEqualTo("disable_policy")
                    .jsonPath("$.changed").isEqualTo(true);

            assertThat(fixture.engine.policies())
                    .filteredOn(policy -> policy.name().equals("night_logins"))
                    .singleElement()
                    .satisfies(policy -> assertThat(policy.enabled()).isFalse());
        }

        @Test
        @DisplayName("should answer 404 for unknown policies")
        void shouldRejectUnknownPolicy() {
            client.put().uri(BASE + "/policies/missing/enabled?value=true").exchange()
                    .expectStatus().isNotFound();
            client.delete().uri(BASE + "/policies/missing").exchange()
                    .expectStatus().isNotFound();
        }

        @Test
        @DisplayName("should reject a policy without rules")
        void shouldRejectEmptyPolicy() {
            send(HttpMethod.POST, BASE + "/policies", Map.of("name", "empty", "rules", List.of()))
                    .expectStatus().isBadRequest()
                    .expectBody()
                    .jsonPath("$.details[0].field").isEqualTo("rules");
        }

        @Test
        @DisplayName("should remove a policy")
        void shouldRemove() {
            registerPolicy();

            client.delete().uri(BASE + "/policies/night_logins").exchange()
                    .expectStatus().isOk();

            assertThat(fixture.engine.policies()).noneMatch(policy -> policy.name().equals("night_logins"));
        }
    }

    @Nested
    @DisplayName("enforcement")
    class Enforcement {

        @Test
        @DisplayName("should lock out with the configured duration and release")
        void shouldLockAndRelease() {
            send(HttpMethod.POST, BASE + "/lockouts", Map.of("identifier", "alice", "endpoint", LOGIN))
                    .expectStatus().isCreated()
                    .expectBody()
                    .jsonPath("$.locked").isEqualTo(true);

            assertThat(fixture.engine.lockedUntil("alice", LOGIN))
                    .contains(MutableClock.EPOCH.plus(Duration.ofMinutes(30)));

            client.get().uri(BASE + "/lockouts?identifier=alice&endpoint=" + LOGIN).exchange()
                    .expectStatus().isOk()
                    .expectBody()
                    .jsonPath("$.locked").isEqualTo(true);

            client.delete().uri(BASE + "/lockouts?identifier=alice&endpoint=" + LOGIN).exchange()
                    .expectStatus().isOk()
                    .expectBody()
                    .jsonPath("$.changed").isEqualTo(true);

            client.get().uri(BASE + "/lockouts?identifier=alice&endpoint=" + LOGIN).exchange()
                    .expectStatus().isOk()
                    .expectBody()
                    .jsonPath("$.locked").isEqualTo(false)
                    .jsonPath("$.lockedUntil").doesNotExist();
        }

        @Test
        @DisplayName("should block and unblock an identifier")
        void shouldBlockAndUnblock() {
            send(HttpMethod.POST, BASE + "/blocks", Map.of("identifier", "198.51.100.7", "duration", "PT2H"))
                    .expectStatus().isCreated()
                    .expectBody()
                    .jsonPath("$.blocked").isEqualTo(true);

            assertThat(fixture.engine.blockedUntil("198.51.100.7"))
                    .contains(MutableClock.EPOCH.plus(Duration.ofHours(2)));

            client.delete().uri(BASE + "/blocks/198.51.100.7").exchange()
                    .expectStatus().isOk()
                    .expectBody()
                    .jsonPath("$.changed").isEqualTo(true);

            client.get().uri(BASE + "/blocks/198.51.100.7").exchange()
                    .expectStatus().isOk()
                    .expectBody()
                    .jsonPath("$.blocked").isEqualTo(false);
        }

        @Test
        @DisplayName("should report nothing changed when unblocking a free identifier")
        void shouldReportNoChange() {
            client.delete().uri(BASE + "/blocks/198.51.100.8").exchange()
                    .expectStatus().isOk()
                    .expectBody()
                    .jsonPath("$.changed").isEqualTo(false);
        }

        @Test
        @DisplayName("should reset recorded failures")
        void shouldReset() {
            RequestMetadata metadata = RequestMetadata.fromAddress("203.0.113.5");
            fixture.engine.reportAttempt("alice", LOGIN, false, metadata);
            fixture.engine.reportAttempt("alice", LOGIN, false, metadata);

            send(HttpMethod.POST, BASE + "/resets", Map.of("identifier", "alice", "endpoint", LOGIN))
                    .expectStatus().isOk()
                    .expectBody()
                    .jsonPath("$.operation").isEqualTo("reset");

            assertThat(fixture.engine.reportAttempt("alice", LOGIN, false, metadata).remainingAttempts())
                    .isEqualTo(4);
        }
    }

    @Nested
    @DisplayName("events and monitoring")
    class Monitoring {

        @Test
        @DisplayName("should accept an external event")
        void shouldRecordEvent() {
            send(HttpMethod.POST, BASE + "/events", Map.of(
                    "type", "data_access",
                    "identifier", "alice",
                    "endpoint", "/api/exports",
                    "severity", "medium",
                    "metadata", Map.of("rows", 1200)))
                    .expectStatus().isAccepted()
                    .expectBody()
                    .jsonPath("$.target").isEqualTo("data_access");

            assertThat(fixture.events.size()).isEqualTo(1);
        }

        @Test
        @DisplayName("should reject an event type that is not an identifier")
        void shouldRejectEventType() {
            send(HttpMethod.POST, BASE + "/events", Map.of("type", "Data Access!", "severity", "low"))
                    .expectStatus().isBadRequest()
                    .expectBody()
                    .jsonPath("$.details[0].field").isEqualTo("type");
        }

        @Test
        @DisplayName("should serve statistics")
        void shouldServeStatistics() {
            RequestMetadata metadata = RequestMetadata.fromAddress("203.0.113.5");
            fixture.engine.reportAttempt("alice", LOGIN, false, metadata);

            client.get().uri(BASE + "/metrics").exchange()
                    .expectStatus().isOk()
                    .expectBody()
                    .jsonPath("$.configuredEndpoints[0]").isEqualTo(LOGIN)
                    .jsonPath("$.activeLockouts").isEqualTo(0)
                    .jsonPath("$.health.status").exists();
        }

        @Test
        @DisplayName("should serve the threat level and health")
        void shouldServeThreatLevel() {
            client.get().uri(BASE + "/threat-level").exchange()
                    .expectStatus().isOk()
                    .expectBody()
                    .jsonPath("$.level").isEqualTo("none")
                    .jsonPath("$.score").isEqualTo(0);

            client.get().uri(BASE + "/health").exchange()
                    .expectStatus().isOk()
                    .expectBody()
                    .jsonPath("$.status").isEqualTo("healthy");
        }
    }
}
