package com.bookedbarber.ratelimit.store;

import java.time.Duration;

/**
 * One counter taking part in an atomic check-and-increment.
 *
 * @param key   store key of the counter
 * @param limit the call is denied when adding {@code delta} would take the count above this value
 * @param ttl   expiry applied when the counter is created
 * @param delta amount added to the counter when the call is allowed
 */
public record CounterSpec(String key, long limit, Duration ttl, long delta) {

    public CounterSpec {
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("key must not be blank");
        }
        if (ttl == null || ttl.isNegative() || ttl.isZero()) {
            throw new IllegalArgumentException("ttl must be positive");
        }
        if (delta < 1) {
            throw new IllegalArgumentException("delta must be positive");
        }
    }

    public CounterSpec(String key, long limit, Duration ttl) {
        this(key, limit, ttl, 1L);
    }
}
