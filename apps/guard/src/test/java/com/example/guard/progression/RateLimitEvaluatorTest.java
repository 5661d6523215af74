package com.example.guard.progression;

import com.example.guard.alert.AlertType;
import com.example.guard.alert.Severity;
import com.example.guard.ledger.RequestMetadata;
import com.example.guard.rule.EndpointMatcher;
import com.example.guard.rule.RateLimitRule;
import com.example.guard.rule.RateLimitSettings;
import com.example.guard.util.EngineFixture;
import com.example.guard.util.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("RateLimitEvaluator")
class RateLimitEvaluatorTest {

    private static final String CLIENT = "198.51.100.20";
    private static final String LOGIN = "/api/auth/login";
    private static final RequestMetadata METADATA = RequestMetadata.fromAddress(CLIENT);

    private EngineFixture fixture;
    private RateLimitEvaluator rateLimits;

    @BeforeEach
    void setUp() {
        fixture = EngineFixture.anEngine()
                .withRule(new RateLimitRule("auth_login", EndpointMatcher.parse(LOGIN),
                        new RateLimitSettings(Duration.ofMinutes(15), 5, false, false, false, 0), null))
                .withRule(new RateLimitRule("search_api", EndpointMatcher.parse("regex:^/api/movies/search"),
                        new RateLimitSettings(Duration.ofMinutes(1), 3, true, false, false, 0), null))
                .withRule(new RateLimitRule("booking_create", EndpointMatcher.parse("/api/bookings"),
                        new RateLimitSettings(Duration.ofMinutes(5), 10, false, false, true, 2), null))
                .withoutMonitor()
                .build();
        rateLimits = fixture.rateLimits;
    }

    private RateDecision request(String endpoint, boolean success) {
        return rateLimits.evaluate(CLIENT, endpoint, success, METADATA);
    }

    @Nested
    @DisplayName("within the limit")
    class WithinLimit {

        @Test
        @DisplayName("should leave endpoints without a rule unrestricted")
        void shouldIgnoreUnmatchedEndpoints() {
            RateDecision decision = request("/api/movies/42", true);

            assertThat(decision.blocked()).isFalse();
            assertThat(decision.remaining()).isEqualTo(ProtectionDecision.UNLIMITED);
            assertThat(fixture.rateLedger.size()).isZero();
        }

        @Test
        @DisplayName("should count down remaining requests and report the window reset")
        void shouldCountDown() {
            RateDecision first = request(LOGIN, false);

            assertThat(first.remaining()).isEqualTo(4);
            assertThat(first.total()).isEqualTo(5);
            assertThat(first.resetAt()).isEqualTo(MutableClock.EPOCH.plus(Duration.ofMinutes(15)));
            assertThat(first.retryAfterSeconds()).isNull();
            for (int i = 0; i < 3; i++) {
                request(LOGIN, false);
            }
            assertThat(request(LOGIN, false).remaining()).isZero();
        }

        @Test
        @DisplayName("should not count skipped outcomes against the limit")
        void shouldSkipSuccessfulWhenConfigured() {
            for (int i = 0; i < 10; i++) {
                assertThat(request("/api/movies/search?q=dune", true).blocked()).isFalse();
            }
            assertThat(request("/api/movies/search?q=dune", false).remaining()).isEqualTo(2);
        }

        @Test
        @DisplayName("should shrink the limit once failures pass the adaptive threshold")
        void shouldApplyAdaptiveMultiplier() {
            request("/api/bookings", false);
            RateDecision second = request("/api/bookings", false);
            assertThat(second.adaptiveMultiplier()).isEqualTo(1.0);
            assertThat(second.total()).isEqualTo(10);

            RateDecision third = request("/api/bookings", false);

            assertThat(third.adaptiveMultiplier()).isEqualTo(1.5);
            assertThat(third.total()).isEqualTo(6);
            assertThat(third.remaining()).isEqualTo(3);
        }
    }

    @Nested
    @DisplayName("over the limit")
    class OverLimit {

        @Test
        @DisplayName("should block the identifier and raise a rate-limit alert")
        void shouldBlockOnExcess() {
            for (int i = 0; i < 5; i++) {
                request(LOGIN, false);
            }

            RateDecision decision = request(LOGIN, false);

            assertThat(decision.blocked()).isTrue();
            assertThat(decision.remaining()).isZero();
            assertThat(decision.retryAfterSeconds()).isEqualTo(1800L);
            assertThat(rateLimits.blockedUntil(CLIENT)).contains(MutableClock.EPOCH.plus(Duration.ofMinutes(30)));
            assertThat(fixture.alerts).singleElement().satisfies(alert -> {
                assertThat(alert.type()).isEqualTo(AlertType.RATE_LIMIT_EXCEEDED);
                assertThat(alert.severity()).isEqualTo(Severity.LOW);
                assertThat(alert.metadata()).containsEntry("rule", "auth_login").containsEntry("violations", 1);
            });
        }

        @Test
        @DisplayName("should block for the window alone when requests mostly succeed")
        void shouldNotDoubleBlockForSuccesses() {
            for (int i = 0; i < 6; i++) {
                request(LOGIN, true);
            }

            assertThat(rateLimits.blockedUntil(CLIENT)).contains(MutableClock.EPOCH.plus(Duration.ofMinutes(15)));
        }

        @Test
        @DisplayName("should reject every endpoint while blocked without recording")
        void shouldRejectWhileBlocked() {
            for (int i = 0; i < 6; i++) {
                request(LOGIN, false);
            }
            int recorded = fixture.rateLedger.size();
            fixture.clock.advance(Duration.ofMinutes(10));

            RateDecision decision = request("/api/movies/search?q=dune", true);

            assertThat(decision.blocked()).isTrue();
            assertThat(decision.retryAfterSeconds()).isEqualTo(1200L);
            assertThat(fixture.rateLedger.size()).isEqualTo(recorded);
        }

        @Test
        @DisplayName("should allow requests again once the block lapses")
        void shouldRecoverAfterBlock() {
            for (int i = 0; i < 6; i++) {
                request(LOGIN, false);
            }
            fixture.clock.advance(Duration.ofMinutes(31));

            assertThat(request(LOGIN, true).blocked()).isFalse();
        }

        @Test
        @DisplayName("should grade severity by violations and failure rate")
        void shouldGradeSeverity() {
            assertThat(RateLimitEvaluator.severityOf(11, 0.9, 5)).isEqualTo(Severity.CRITICAL);
            assertThat(RateLimitEvaluator.severityOf(11, 0.7, 5)).isEqualTo(Severity.HIGH);
            assertThat(RateLimitEvaluator.severityOf(6, 0.7, 5)).isEqualTo(Severity.HIGH);
            assertThat(RateLimitEvaluator.severityOf(6, 0.1, 5)).isEqualTo(Severity.MEDIUM);
            assertThat(RateLimitEvaluator.severityOf(3, 1.0, 5)).isEqualTo(Severity.MEDIUM);
            assertThat(RateLimitEvaluator.severityOf(2, 1.0, 5)).isEqualTo(Severity.LOW);
        }
    }

    @Nested
    @DisplayName("manual controls")
    class ManualControls {

        @Test
        @DisplayName("should block for one hour by default")
        void shouldBlockManually() {
            assertThat(rateLimits.block(CLIENT, null)).isEqualTo(MutableClock.EPOCH.plus(Duration.ofHours(1)));
            assertThat(request(LOGIN, true).blocked()).isTrue();
        }

        @Test
        @DisplayName("should keep the later expiry when blocks overlap")
        void shouldKeepLaterExpiry() {
            rateLimits.block(CLIENT, Duration.ofHours(2));

            assertThat(rateLimits.block(CLIENT, Duration.ofMinutes(5)))
                    .isEqualTo(MutableClock.EPOCH.plus(Duration.ofHours(2)));
        }

        @Test
        @DisplayName("should lift a block on unblock")
        void shouldUnblock() {
            rateLimits.block(CLIENT, null);

            assertThat(rateLimits.unblock(CLIENT)).isTrue();
            assertThat(rateLimits.unblock(CLIENT)).isFalse();
            assertThat(request(LOGIN, true).blocked()).isFalse();
        }

        @Test
        @DisplayName("should clear history and block on reset")
        void shouldReset() {
            for (int i = 0; i < 6; i++) {
                request(LOGIN, false);
            }

            rateLimits.reset(CLIENT);

            assertThat(rateLimits.blockedUntil(CLIENT)).isEmpty();
            assertThat(request(LOGIN, false).remaining()).isEqualTo(4);
        }
    }
}
