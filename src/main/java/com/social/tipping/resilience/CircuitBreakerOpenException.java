package com.social.tipping.resilience;

/**
 * Thrown instead of calling a dependency whose breaker is open.
 */
public class CircuitBreakerOpenException extends RuntimeException {

    private final String breakerName;

    public CircuitBreakerOpenException(String breakerName, CircuitState state) {
        super("Service unavailable: circuit breaker '" + breakerName + "' is " + state);
        this.breakerName = breakerName;
    }

    public String getBreakerName() {
        return breakerName;
    }
}
