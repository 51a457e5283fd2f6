package com.bookedbarber.ratelimit.store;

import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Atomic key/value counter store shared by every gate instance.
 *
 * All operations are atomic at the store level, so no in-process locking is needed by callers.
 * Expiry passed to the counting operations is applied only when a key is created; later
 * increments never extend a key's lifetime. Implementations report failures through
 * {@link StoreResult} and must not emit errors.
 */
public interface CounterStore {

    /**
     * Checks every counter against its limit and, only if each of them can take its delta
     * without exceeding the limit, adds the deltas to all of them in one atomic step.
     */
    Mono<StoreResult<CounterOutcome>> incrementAllIfBelow(List<CounterSpec> counters);

    /**
     * Adds {@code delta} to a counter, creating it with {@code ttl} if absent.
     */
    Mono<StoreResult<Long>> increment(String key, long delta, Duration ttl);

    /**
     * Current counter value, zero when the key does not exist.
     */
    Mono<StoreResult<Long>> get(String key);

    Mono<StoreResult<Optional<String>>> getValue(String key);

    Mono<StoreResult<Boolean>> setValue(String key, String value, Duration ttl);

    /**
     * Prepends a value to a list, trims it to {@code maxLength} entries and refreshes its expiry.
     *
     * @return list length after trimming
     */
    Mono<StoreResult<Long>> pushBounded(String key, String value, int maxLength, Duration ttl);

    /**
     * Up to {@code count} list entries, most recent first.
     */
    Mono<StoreResult<List<String>>> range(String key, int count);

    /**
     * Adds a member to a set, creating it with {@code ttl} if absent.
     *
     * @return set cardinality after the add
     */
    Mono<StoreResult<Long>> addToSet(String key, String member, Duration ttl);

    Mono<StoreResult<Boolean>> delete(String key);
}
