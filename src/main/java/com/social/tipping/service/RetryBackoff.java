package com.social.tipping.service;

/**
 * Exponential backoff for job retries: base * 2^(attempt - 1), no jitter, so delays between
 * attempts of the same job strictly increase.
 */
public final class RetryBackoff {

    private final long baseDelayMs;
    private final int maxAttempts;

    public RetryBackoff(long baseDelayMs, int maxAttempts) {
        this.baseDelayMs = baseDelayMs;
        this.maxAttempts = maxAttempts;
    }

    /**
     * Delay before the next attempt, given how many attempts have been made (1-based).
     */
    public long delayMs(int attemptsMade) {
        int exponent = Math.max(0, Math.min(attemptsMade - 1, 20));
        return baseDelayMs * (1L << exponent);
    }

    public boolean hasAttemptsLeft(int attemptsMade) {
        return attemptsMade < maxAttempts;
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }
}
