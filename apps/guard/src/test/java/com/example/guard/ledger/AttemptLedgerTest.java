package com.example.guard.ledger;

import com.example.guard.util.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("AttemptLedger")
class AttemptLedgerTest {

    private static final Instant T0 = MutableClock.EPOCH;
    private static final AttemptKey ALICE_LOGIN = new AttemptKey("alice", "login");

    private AttemptLedger ledger;

    @BeforeEach
    void setUp() {
        ledger = new AttemptLedger("test", 5);
    }

    private static Attempt attempt(String identifier, String endpoint, Instant at, boolean success) {
        return new Attempt(identifier, endpoint, at, success, "203.0.113.7", null);
    }

    @Test
    @DisplayName("should reject a non-positive capacity")
    void shouldRejectNonPositiveCapacity() {
        assertThatThrownBy(() -> new AttemptLedger("bad", 0))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Nested
    @DisplayName("record")
    class Record {

        @Test
        @DisplayName("should keep entries in insertion order")
        void shouldKeepInsertionOrder() {
            ledger.record(attempt("alice", "login", T0, false));
            ledger.record(attempt("alice", "login", T0.plusSeconds(1), true));

            List<Attempt> entries = ledger.entries(ALICE_LOGIN);

            assertThat(entries).extracting(Attempt::success).containsExactly(false, true);
        }

        @Test
        @DisplayName("should evict the oldest entries above the cap")
        void shouldEvictOldestAboveCap() {
            for (int i = 0; i < 8; i++) {
                ledger.record(attempt("alice", "login", T0.plusSeconds(i), false));
            }

            List<Attempt> entries = ledger.entries(ALICE_LOGIN);

            assertThat(entries).hasSize(5);
            assertThat(entries.get(0).timestamp()).isEqualTo(T0.plusSeconds(3));
            assertThat(entries.get(4).timestamp()).isEqualTo(T0.plusSeconds(7));
        }

        @Test
        @DisplayName("should keep separate histories per endpoint")
        void shouldSeparateEndpoints() {
            ledger.record(attempt("alice", "login", T0, false));
            ledger.record(attempt("alice", "payment", T0, false));

            assertThat(ledger.entries(ALICE_LOGIN)).hasSize(1);
            assertThat(ledger.keys()).hasSize(2);
            assertThat(ledger.countsByEndpoint()).containsEntry("login", 1).containsEntry("payment", 1);
        }

        @Test
        @DisplayName("should stay within the cap under concurrent appends")
        void shouldStayWithinCapConcurrently() throws InterruptedException {
            ExecutorService pool = Executors.newFixedThreadPool(8);
            CountDownLatch done = new CountDownLatch(400);
            for (int i = 0; i < 400; i++) {
                int offset = i;
                pool.execute(() -> {
                    ledger.record(attempt("alice", "login", T0.plusMillis(offset), false));
                    done.countDown();
                });
            }
            assertThat(done.await(5, TimeUnit.SECONDS)).isTrue();
            pool.shutdown();

            assertThat(ledger.entries(ALICE_LOGIN)).hasSize(5);
            assertThat(ledger.size()).isEqualTo(5);
        }
    }

    @Nested
    @DisplayName("windowed")
    class Windowed {

        @Test
        @DisplayName("should include only entries strictly newer than now minus window")
        void shouldApplyStrictCutoff() {
            ledger.record(attempt("alice", "login", T0, false));
            ledger.record(attempt("alice", "login", T0.plusSeconds(30), false));
            ledger.record(attempt("alice", "login", T0.plusSeconds(60), false));

            List<Attempt> window = ledger.windowed(ALICE_LOGIN, Duration.ofSeconds(60), T0.plusSeconds(60));

            assertThat(window).extracting(Attempt::timestamp)
                    .containsExactly(T0.plusSeconds(30), T0.plusSeconds(60));
        }

        @Test
        @DisplayName("should drop entries before the floor")
        void shouldHonourFloor() {
            ledger.record(attempt("alice", "login", T0, false));
            ledger.record(attempt("alice", "login", T0.plusSeconds(10), false));

            List<Attempt> window = ledger.windowed(ALICE_LOGIN, Duration.ofHours(1), T0.plusSeconds(20),
                    T0.plusSeconds(10));

            assertThat(window).extracting(Attempt::timestamp).containsExactly(T0.plusSeconds(10));
        }

        @Test
        @DisplayName("should return an empty list for an unknown key")
        void shouldReturnEmptyForUnknownKey() {
            assertThat(ledger.windowed(ALICE_LOGIN, Duration.ofHours(1), T0)).isEmpty();
        }
    }

    @Nested
    @DisplayName("purge and clear")
    class PurgeAndClear {

        @Test
        @DisplayName("should purge old entries and drop empty keys")
        void shouldPurgeAndDropEmptyKeys() {
            ledger.record(attempt("alice", "login", T0, false));
            ledger.record(attempt("bob", "login", T0, false));
            ledger.record(attempt("bob", "login", T0.plusSeconds(120), false));

            int removed = ledger.purgeOlderThan(T0.plusSeconds(60));

            assertThat(removed).isEqualTo(2);
            assertThat(ledger.keys()).containsExactly(new AttemptKey("bob", "login"));
            assertThat(ledger.size()).isEqualTo(1);
        }

        @Test
        @DisplayName("should clear every endpoint of an identifier")
        void shouldClearIdentifier() {
            ledger.record(attempt("alice", "login", T0, false));
            ledger.record(attempt("alice", "payment", T0, false));
            ledger.record(attempt("bob", "login", T0, false));

            assertThat(ledger.clearIdentifier("alice")).isEqualTo(2);
            assertThat(ledger.snapshot()).extracting(Attempt::identifier).containsOnly("bob");
        }
    }
}
