package com.example.guard.web.controller;

import com.example.guard.alert.AlertType;
import com.example.guard.alert.SecurityAlert;
import com.example.guard.alert.Severity;
import com.example.guard.common.exception.GlobalExceptionHandler;
import com.example.guard.util.EngineFixture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.test.web.reactive.server.WebTestClient;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("AlertAdminController")
class AlertAdminControllerTest {

    private static final String BASE = "/api/v1/admin/protection/alerts";

    private EngineFixture fixture;
    private AlertAdminController controller;
    private WebTestClient client;

    @BeforeEach
    void setUp() {
        fixture = EngineFixture.anEngine().withoutMonitor().build();
        controller = new AlertAdminController(fixture.engine);
        client = WebTestClient.bindToController(controller)
                .controllerAdvice(new GlobalExceptionHandler())
                .build();
    }

    private SecurityAlert alert(String identifier) {
        return new SecurityAlert(AlertType.SUSPICIOUS_ACTIVITY, Severity.MEDIUM, identifier, "/api/auth/login",
                "Repeated failed logins", fixture.clock.instant(), Map.of("failedAttempts", 2L));
    }

    @Test
    @DisplayName("should list retained alerts within the window")
    void shouldListWithinWindow() {
        fixture.alertBus.publish(alert("early"));
        fixture.clock.advance(Duration.ofMinutes(10));
        fixture.alertBus.publish(alert("late"));

        client.get().uri(BASE).exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.length()").isEqualTo(2);

        client.get().uri(BASE + "?windowMinutes=5").exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.length()").isEqualTo(1)
                .jsonPath("$[0].identifier").isEqualTo("late")
                .jsonPath("$[0].type").isEqualTo("suspicious_activity")
                .jsonPath("$[0].severity").isEqualTo("medium");
    }

    @Test
    @DisplayName("should reject windows outside one minute to one day")
    void shouldRejectWindow() {
        client.get().uri(BASE + "?windowMinutes=0").exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.error").isEqualTo("invalid_argument");

        client.get().uri(BASE + "?windowMinutes=1441").exchange()
                .expectStatus().isBadRequest();
    }

    @Test
    @DisplayName("should stream published alerts as named server-sent events")
    void shouldStreamAlerts() {
        SecurityAlert published = alert("mallory");

        StepVerifier.create(controller.stream())
                .then(() -> fixture.alertBus.publish(published))
                .assertNext(event -> {
                    assertThat(event.event()).isEqualTo("suspicious_activity");
                    assertThat(event.data()).isEqualTo(published);
                })
                .thenCancel()
                .verify(Duration.ofSeconds(5));
    }
}
