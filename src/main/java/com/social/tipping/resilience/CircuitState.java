package com.social.tipping.resilience;

public enum CircuitState {
    CLOSED,
    OPEN,
    HALF_OPEN
}
