package com.social.tipping.resilience;

import com.social.tipping.testutil.MutableClock;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CircuitBreakerTest {

    private MutableClock clock;
    private List<CircuitState> transitions;
    private CircuitBreaker breaker;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(1_000_000L);
        transitions = Collections.synchronizedList(new ArrayList<>());
        breaker = breaker("settlement", new CircuitBreakerOptions(3, 60_000L, 60_000L, 2));
    }

    private CircuitBreaker breaker(String name, CircuitBreakerOptions options) {
        CircuitBreakerRegistry registry = CircuitBreakerRegistry.ofDefaults();
        registry.getEventPublisher().onEntryAdded(added -> added.getAddedEntry().getEventPublisher()
                .onStateTransition(event -> transitions.add(
                        CircuitBreaker.toCircuitState(event.getStateTransition().getToState()))));
        return new CircuitBreakers(registry, n -> options, clock).get(name);
    }

    @Test
    void closed_passesThroughResults() {
        assertThat(breaker.execute(() -> "ok")).isEqualTo("ok");
        assertThat(breaker.getState()).isEqualTo(CircuitState.CLOSED);
    }

    @Test
    void opensAfterThresholdFailures() {
        failTimes(3);

        assertThat(breaker.getState()).isEqualTo(CircuitState.OPEN);
        assertThat(transitions).containsExactly(CircuitState.OPEN);
    }

    @Test
    void open_rejectsWithoutInvokingOperation() {
        failTimes(3);
        AtomicInteger calls = new AtomicInteger();

        assertThatThrownBy(() -> breaker.execute(calls::incrementAndGet))
                .isInstanceOf(CircuitBreakerOpenException.class)
                .hasMessageContaining("settlement");
        assertThat(calls.get()).isZero();
    }

    @Test
    void successWhileClosed_clearsFailures() {
        failTimes(2);
        breaker.execute(() -> "ok");
        failTimes(2);

        assertThat(breaker.getState()).isEqualTo(CircuitState.CLOSED);
        assertThat(breaker.getStats().failureCount()).isEqualTo(2);
    }

    @Test
    void failuresOutsideMonitoringPeriod_doNotCount() {
        failTimes(2);
        clock.advanceMillis(60_001L);
        failTimes(1);

        assertThat(breaker.getState()).isEqualTo(CircuitState.CLOSED);
        assertThat(breaker.getStats().failureCount()).isEqualTo(1);
    }

    @Test
    void halfOpen_afterResetTimeout() {
        failTimes(3);
        clock.advanceMillis(60_000L);

        assertThat(breaker.getState()).isEqualTo(CircuitState.HALF_OPEN);
    }

    @Test
    void halfOpen_successCloses() {
        failTimes(3);
        clock.advanceMillis(60_000L);

        breaker.execute(() -> "trial");

        assertThat(breaker.getState()).isEqualTo(CircuitState.CLOSED);
        assertThat(breaker.getStats().failureCount()).isZero();
        assertThat(transitions).containsExactly(CircuitState.OPEN, CircuitState.HALF_OPEN, CircuitState.CLOSED);
    }

    @Test
    void halfOpen_failureReopensImmediately() {
        failTimes(3);
        clock.advanceMillis(60_000L);
        assertThat(breaker.getState()).isEqualTo(CircuitState.HALF_OPEN);

        failTimes(1);

        assertThat(breaker.getState()).isEqualTo(CircuitState.OPEN);
    }

    @Test
    void halfOpen_recoveringDependency_rejectsBeyondCallBudget() throws Exception {
        failTimes(3);
        // past the monitoring period too, so the old failures no longer count
        clock.advanceMillis(60_001L);

        CountDownLatch release = new CountDownLatch(1);
        CountDownLatch started = new CountDownLatch(2);
        ExecutorService pool = Executors.newFixedThreadPool(2);
        try {
            for (int i = 0; i < 2; i++) {
                pool.submit(() -> breaker.execute(() -> {
                    started.countDown();
                    try {
                        release.await(5, TimeUnit.SECONDS);
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                    }
                    return "trial";
                }));
            }
            assertThat(started.await(5, TimeUnit.SECONDS)).isTrue();

            assertThatThrownBy(() -> breaker.execute(() -> "third"))
                    .isInstanceOf(CircuitBreakerOpenException.class);
        } finally {
            release.countDown();
            pool.shutdown();
            pool.awaitTermination(5, TimeUnit.SECONDS);
        }
        assertThat(breaker.getState()).isEqualTo(CircuitState.CLOSED);
    }

    @Test
    void halfOpen_budgetSpentWhileFailing_holdsLaterCallersOut() throws Exception {
        CircuitBreaker storage = breaker("content-storage", new CircuitBreakerOptions(3, 30_000L, 60_000L, 2));
        for (int i = 0; i < 3; i++) {
            try {
                storage.execute(() -> {
                    throw new IllegalStateException("storage down");
                });
            } catch (IllegalStateException expected) {
                // counted
            }
        }
        // reset timeout passed, failures still inside the monitoring period
        clock.advanceMillis(30_000L);
        assertThat(storage.getState()).isEqualTo(CircuitState.HALF_OPEN);

        CountDownLatch release = new CountDownLatch(1);
        CountDownLatch started = new CountDownLatch(2);
        AtomicInteger invocations = new AtomicInteger();
        ExecutorService pool = Executors.newFixedThreadPool(2);
        try {
            for (int i = 0; i < 2; i++) {
                pool.submit(() -> storage.execute(() -> {
                    invocations.incrementAndGet();
                    started.countDown();
                    try {
                        release.await(5, TimeUnit.SECONDS);
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                    }
                    return "trial";
                }));
            }
            assertThat(started.await(5, TimeUnit.SECONDS)).isTrue();

            int rejected = 0;
            for (int i = 0; i < 6; i++) {
                try {
                    storage.execute(invocations::incrementAndGet);
                } catch (CircuitBreakerOpenException e) {
                    rejected++;
                }
            }

            assertThat(rejected).isEqualTo(6);
            assertThat(invocations.get()).isEqualTo(2);
            assertThat(storage.getState()).isEqualTo(CircuitState.OPEN);
        } finally {
            release.countDown();
            pool.shutdown();
            pool.awaitTermination(5, TimeUnit.SECONDS);
        }

        // the reset timeout restarts from the reopen, not from the original failures
        clock.advanceMillis(29_999L);
        assertThat(storage.getState()).isEqualTo(CircuitState.OPEN);
        clock.advanceMillis(1L);
        assertThat(storage.getState()).isEqualTo(CircuitState.HALF_OPEN);
    }

    @Test
    void reset_returnsToClosed() {
        failTimes(3);

        breaker.reset();

        assertThat(breaker.getState()).isEqualTo(CircuitState.CLOSED);
        assertThat(breaker.execute(() -> "ok")).isEqualTo("ok");
    }

    @Test
    void stats_reportLastFailure() {
        failTimes(1);

        CircuitBreakerStats stats = breaker.getStats();
        assertThat(stats.name()).isEqualTo("settlement");
        assertThat(stats.lastFailureTime()).isEqualTo(1_000_000L);
        assertThat(stats.failureCount()).isEqualTo(1);
    }

    @Test
    void concurrentFailures_openExactlyOnce() throws Exception {
        CircuitBreaker shared = breaker("database", new CircuitBreakerOptions(10, 10_000L, 60_000L, 3));
        ExecutorService pool = Executors.newFixedThreadPool(8);
        try {
            for (int i = 0; i < 50; i++) {
                pool.submit(() -> {
                    try {
                        shared.execute(() -> {
                            throw new IllegalStateException("db down");
                        });
                    } catch (RuntimeException ignored) {
                        // expected: failure or open rejection
                    }
                });
            }
        } finally {
            pool.shutdown();
            assertThat(pool.awaitTermination(5, TimeUnit.SECONDS)).isTrue();
        }

        assertThat(shared.getState()).isEqualTo(CircuitState.OPEN);
        assertThat(transitions).containsExactly(CircuitState.OPEN);
    }

    private void failTimes(int n) {
        for (int i = 0; i < n; i++) {
            try {
                breaker.execute(() -> {
                    throw new IllegalStateException("boom");
                });
            } catch (IllegalStateException expected) {
                // counted by the breaker
            }
        }
    }
}
