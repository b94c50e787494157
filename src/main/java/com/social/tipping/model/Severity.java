package com.social.tipping.model;

/**
 * Declared from least to most severe; comparisons rely on the ordinal.
 */
public enum Severity {
    LOW,
    MEDIUM,
    HIGH,
    CRITICAL;

    public boolean isAtLeast(Severity other) {
        return compareTo(other) >= 0;
    }
}
