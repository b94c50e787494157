package com.social.tipping.resilience;

/**
 * Tuning of a single breaker.
 *
 * @param failureThreshold   failures inside the monitoring period that open the circuit
 * @param resetTimeoutMs     time after the last failure before a half-open trial call is allowed
 * @param monitoringPeriodMs rolling window failures are counted in
 * @param halfOpenMaxCalls   calls admitted while half-open
 */
public record CircuitBreakerOptions(int failureThreshold,
                                    long resetTimeoutMs,
                                    long monitoringPeriodMs,
                                    int halfOpenMaxCalls) {

    public CircuitBreakerOptions {
        if (failureThreshold < 1) {
            throw new IllegalArgumentException("failureThreshold must be >= 1");
        }
        if (halfOpenMaxCalls < 1) {
            throw new IllegalArgumentException("halfOpenMaxCalls must be >= 1");
        }
    }

    public static CircuitBreakerOptions defaults() {
        return new CircuitBreakerOptions(5, 60_000L, 60_000L, 3);
    }
}
