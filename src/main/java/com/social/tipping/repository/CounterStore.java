package com.social.tipping.repository;

import java.util.List;

/**
 * Shared store of short-lived counters, timestamps and flags used by the rate limiter and the
 * abuse checks. Records are addressed by a logical set and a key; every write that creates a
 * record gives it its own time-to-live.
 */
public interface CounterStore {

    /**
     * Drop window entries at or before {@code cutoffInclusive} and return the surviving
     * timestamps in ascending order. Returns an empty list when the window does not exist.
     */
    List<Long> pruneWindow(String set, String key, long cutoffInclusive);

    /**
     * Read a window without modifying it, ascending.
     */
    List<Long> readWindow(String set, String key);

    void appendToWindow(String set, String key, long timestamp, int ttlSeconds);

    /**
     * Add {@code delta} and return the new value. The time-to-live starts when the counter is
     * created and is not extended by later increments.
     */
    long increment(String set, String key, long delta, int ttlSeconds);

    Long getLong(String set, String key);

    void putLong(String set, String key, long value, int ttlSeconds);

    Double getDouble(String set, String key);

    void putDouble(String set, String key, double value, int ttlSeconds);

    /**
     * Most recent first.
     */
    List<Long> getRecent(String set, String key);

    /**
     * Prepend a value, keep at most {@code maxSize} entries and refresh the time-to-live.
     */
    void pushRecent(String set, String key, long value, int maxSize, int ttlSeconds);

    void delete(String set, String key);
}
