package com.social.tipping.resilience;

import io.github.resilience4j.circuitbreaker.CircuitBreaker.State;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;

/**
 * Guards calls to one external dependency.
 *
 * <p>The Resilience4j breaker owns the state, the permission gate (OPEN rejects, HALF_OPEN admits
 * {@code halfOpenMaxCalls}) and the transition events. This class decides when to transition: it
 * counts failures inside the rolling monitoring period, measures the reset timeout on the injected
 * clock and resolves HALF_OPEN on the first trial outcome. Resilience4j never records outcomes
 * here, so it does not transition on its own.
 */
public class CircuitBreaker {

    private static final Logger log = LoggerFactory.getLogger(CircuitBreaker.class);

    private final io.github.resilience4j.circuitbreaker.CircuitBreaker delegate;
    private final CircuitBreakerOptions options;
    private final Clock clock;
    private final AtomicReference<FailureWindow> window = new AtomicReference<>(FailureWindow.EMPTY);
    private final AtomicInteger halfOpenCalls = new AtomicInteger();

    public CircuitBreaker(io.github.resilience4j.circuitbreaker.CircuitBreaker delegate,
                          CircuitBreakerOptions options,
                          Clock clock) {
        this.delegate = delegate;
        this.options = options;
        this.clock = clock;
    }

    public String getName() {
        return delegate.getName();
    }

    public CircuitBreakerOptions getOptions() {
        return options;
    }

    /**
     * Run the operation if the circuit admits it.
     *
     * @throws CircuitBreakerOpenException when the circuit is open or the half-open budget is spent
     */
    public <T> T execute(Supplier<T> operation) {
        acquirePermission();
        try {
            T result = operation.get();
            onSuccess();
            return result;
        } catch (RuntimeException e) {
            onFailure();
            throw e;
        }
    }

    public void run(Runnable operation) {
        execute(() -> {
            operation.run();
            return null;
        });
    }

    public CircuitState getState() {
        refresh();
        return toCircuitState(delegate.getState());
    }

    public CircuitBreakerStats getStats() {
        refresh();
        FailureWindow current = window.get();
        State state = delegate.getState();
        return new CircuitBreakerStats(getName(), toCircuitState(state), current.failures().size(),
                current.lastFailureTime(), state == State.HALF_OPEN ? halfOpenCalls.get() : 0);
    }

    public synchronized void reset() {
        State previous = delegate.getState();
        delegate.reset();
        window.set(FailureWindow.EMPTY);
        halfOpenCalls.set(0);
        if (previous != State.CLOSED) {
            log.info("Circuit breaker '{}' manually reset from {}", getName(), previous);
        }
    }

    static CircuitState toCircuitState(State state) {
        if (state == State.OPEN || state == State.FORCED_OPEN) {
            return CircuitState.OPEN;
        }
        if (state == State.HALF_OPEN) {
            return CircuitState.HALF_OPEN;
        }
        return CircuitState.CLOSED;
    }

    private void acquirePermission() {
        refresh();
        if (delegate.tryAcquirePermission()) {
            if (delegate.getState() == State.HALF_OPEN) {
                halfOpenCalls.incrementAndGet();
            }
            return;
        }
        State state = delegate.getState();
        if (state == State.HALF_OPEN && !window.get().failures().isEmpty()) {
            reopen(clock.millis());
            state = delegate.getState();
        }
        throw new CircuitBreakerOpenException(getName(), toCircuitState(state));
    }

    private void onSuccess() {
        State state = delegate.getState();
        if (state == State.HALF_OPEN) {
            close();
        } else if (state == State.CLOSED) {
            window.updateAndGet(w -> w.failures().isEmpty() ? w : w.withFailures(List.of()));
        }
    }

    private void onFailure() {
        long now = clock.millis();
        FailureWindow updated = window.updateAndGet(w -> w.record(now, options.monitoringPeriodMs()));
        State state = delegate.getState();
        if (state == State.HALF_OPEN) {
            open(State.HALF_OPEN, updated.failures().size());
        } else if (state == State.CLOSED && updated.failures().size() >= options.failureThreshold()) {
            open(State.CLOSED, updated.failures().size());
        }
    }

    /**
     * Prune the failure window and apply OPEN to HALF_OPEN once the reset timeout has passed.
     */
    private void refresh() {
        long now = clock.millis();
        FailureWindow current = window.updateAndGet(w -> w.prune(now, options.monitoringPeriodMs()));
        if (delegate.getState() == State.OPEN && now - current.lastFailureTime() >= options.resetTimeoutMs()) {
            halfOpen(now);
        }
    }

    // Transitions re-check the state under the lock so concurrent callers never repeat one.

    private synchronized void open(State from, int failureCount) {
        if (delegate.getState() != from) {
            return;
        }
        delegate.transitionToOpenState();
        log.warn("Circuit breaker '{}' opened: {} -> OPEN with {} failures in window", getName(), from, failureCount);
    }

    private synchronized void reopen(long now) {
        if (delegate.getState() != State.HALF_OPEN) {
            return;
        }
        // the reset timeout restarts from now, not from the last failure
        window.updateAndGet(w -> w.withLastFailureTime(now));
        delegate.transitionToOpenState();
        log.warn("Circuit breaker '{}' reopened: half-open budget of {} spent while failures persist",
                getName(), options.halfOpenMaxCalls());
    }

    private synchronized void halfOpen(long now) {
        if (delegate.getState() != State.OPEN || now - window.get().lastFailureTime() < options.resetTimeoutMs()) {
            return;
        }
        halfOpenCalls.set(0);
        delegate.transitionToHalfOpenState();
        log.info("Circuit breaker '{}' transition: OPEN -> HALF_OPEN", getName());
    }

    private synchronized void close() {
        if (delegate.getState() != State.HALF_OPEN) {
            return;
        }
        window.set(FailureWindow.EMPTY);
        delegate.transitionToClosedState();
        log.info("Circuit breaker '{}' recovered: HALF_OPEN -> CLOSED", getName());
    }

    private record FailureWindow(List<Long> failures, long lastFailureTime) {

        static final FailureWindow EMPTY = new FailureWindow(List.of(), 0L);

        FailureWindow {
            failures = Collections.unmodifiableList(new ArrayList<>(failures));
        }

        FailureWindow withFailures(List<Long> newFailures) {
            return new FailureWindow(newFailures, lastFailureTime);
        }

        FailureWindow withLastFailureTime(long time) {
            return new FailureWindow(failures, time);
        }

        FailureWindow record(long now, long monitoringPeriodMs) {
            List<Long> next = new ArrayList<>(prune(now, monitoringPeriodMs).failures());
            next.add(now);
            return new FailureWindow(next, now);
        }

        FailureWindow prune(long now, long monitoringPeriodMs) {
            int firstLive = 0;
            while (firstLive < failures.size() && now - failures.get(firstLive) > monitoringPeriodMs) {
                firstLive++;
            }
            return firstLive == 0 ? this : withFailures(failures.subList(firstLive, failures.size()));
        }
    }
}
