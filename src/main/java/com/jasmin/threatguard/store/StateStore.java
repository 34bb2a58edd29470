package com.jasmin.threatguard.store;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Shared, atomically incrementing key-value store with per-key TTL. This is the only synchronization
 * point between concurrent requests.
 */
public interface StateStore {

    long increment(String key);

    long decrement(String key);

    boolean expire(String key, Duration ttl);

    Optional<String> get(String key);

    /** Stores the value; a {@code null} ttl keeps the key until deleted. */
    void set(String key, String value, Duration ttl);

    boolean setIfAbsent(String key, String value, Duration ttl);

    boolean delete(String key);

    boolean exists(String key);

    /** Returns the number of members actually added. */
    long addToSet(String key, String member);

    long setSize(String key);

    /** Remaining TTL in seconds; negative when the key has no expiry or does not exist. */
    long ttlSeconds(String key);

    Set<String> scanKeys(String pattern);

    /**
     * Fixed-window counter. The TTL is only set when this call created the key, so the window starts at the
     * first increment. Two concurrent first increments may both set the TTL, which is harmless.
     */
    default long incrementWithin(String key, Duration window) {
        long count = increment(key);
        if (count == 1) {
            expire(key, window);
        }
        return count;
    }

    default long getLong(String key) {
        return get(key).map(v -> {
            try {
                return Long.parseLong(v);
            } catch (NumberFormatException e) {
                return 0L;
            }
        }).orElse(0L);
    }

    /** Sum of the integer values of the keys; missing or non-numeric keys count as zero. */
    default long sum(List<String> keys) {
        long total = 0;
        for (String key : keys) total += getLong(key);
        return total;
    }
}
