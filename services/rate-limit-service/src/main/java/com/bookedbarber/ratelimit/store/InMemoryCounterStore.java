package com.bookedbarber.ratelimit.store;

import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Supplier;

/**
 * Single-process counter store for the {@code local} profile and tests.
 *
 * Expiry is evaluated against the injected {@link Clock}, so tests can move time forward
 * without sleeping. Expired entries are dropped when read and swept from the whole map at
 * most once per {@link #SWEEP_INTERVAL}. All operations hold the store monitor, which makes
 * each of them atomic within this process only.
 */
@Slf4j
public class InMemoryCounterStore implements CounterStore {

    static final Duration SWEEP_INTERVAL = Duration.ofMinutes(1);

    private final Clock clock;
    private final Map<String, Entry> entries = new HashMap<>();
    private Instant nextSweep;

    public InMemoryCounterStore(Clock clock) {
        this.clock = clock;
        this.nextSweep = clock.instant().plus(SWEEP_INTERVAL);
    }

    @Override
    public Mono<StoreResult<CounterOutcome>> incrementAllIfBelow(List<CounterSpec> counters) {
        return atomically("incrementAllIfBelow", () -> checkAndIncrementAll(counters));
    }

    @Override
    public Mono<StoreResult<Long>> increment(String key, long delta, Duration ttl) {
        return atomically("increment", () -> {
            Entry entry = live(key);
            if (entry == null) {
                entry = new Entry(0L, expiryFrom(ttl));
                entries.put(key, entry);
            }
            long updated = asLong(entry.value) + delta;
            entry.value = updated;
            return updated;
        });
    }

    @Override
    public Mono<StoreResult<Long>> get(String key) {
        return atomically("get", () -> {
            Entry entry = live(key);
            return entry == null ? 0L : asLong(entry.value);
        });
    }

    @Override
    public Mono<StoreResult<Optional<String>>> getValue(String key) {
        return atomically("getValue", () -> {
            Entry entry = live(key);
            return entry == null ? Optional.<String>empty() : Optional.of(String.valueOf(entry.value));
        });
    }

    @Override
    public Mono<StoreResult<Boolean>> setValue(String key, String value, Duration ttl) {
        return atomically("setValue", () -> {
            entries.put(key, new Entry(value, expiryFrom(ttl)));
            return Boolean.TRUE;
        });
    }

    @Override
    @SuppressWarnings("unchecked")
    public Mono<StoreResult<Long>> pushBounded(String key, String value, int maxLength, Duration ttl) {
        return atomically("pushBounded", () -> {
            Entry entry = live(key);
            if (entry == null) {
                entry = new Entry(new ArrayDeque<String>(), null);
                entries.put(key, entry);
            }
            Deque<String> list = (Deque<String>) entry.value;
            list.addFirst(value);
            while (list.size() > maxLength) {
                list.removeLast();
            }
            entry.expiresAt = expiryFrom(ttl);
            return (long) list.size();
        });
    }

    @Override
    @SuppressWarnings("unchecked")
    public Mono<StoreResult<List<String>>> range(String key, int count) {
        return atomically("range", () -> {
            Entry entry = live(key);
            if (entry == null) {
                return List.<String>of();
            }
            List<String> values = new ArrayList<>(count);
            Iterator<String> it = ((Deque<String>) entry.value).iterator();
            while (it.hasNext() && values.size() < count) {
                values.add(it.next());
            }
            return List.copyOf(values);
        });
    }

    @Override
    @SuppressWarnings("unchecked")
    public Mono<StoreResult<Long>> addToSet(String key, String member, Duration ttl) {
        return atomically("addToSet", () -> {
            Entry entry = live(key);
            if (entry == null) {
                entry = new Entry(new HashSet<String>(), expiryFrom(ttl));
                entries.put(key, entry);
            }
            Set<String> set = (Set<String>) entry.value;
            set.add(member);
            return (long) set.size();
        });
    }

    @Override
    public Mono<StoreResult<Boolean>> delete(String key) {
        return atomically("delete", () -> live(key) != null && entries.remove(key) != null);
    }

    /**
     * Number of entries held, expired ones included until the next sweep.
     */
    synchronized int size() {
        return entries.size();
    }

    /**
     * Runs one operation under the store monitor. A key holding a value of the wrong shape
     * comes back as {@link StoreFailure#ERROR}.
     */
    private <T> Mono<StoreResult<T>> atomically(String operation, Supplier<T> work) {
        return Mono.fromSupplier(() -> {
            synchronized (this) {
                sweepIfDue();
                try {
                    return StoreResult.ok(work.get());
                } catch (NumberFormatException | ClassCastException e) {
                    log.warn("STORE_ENTRY_INVALID: operation={}, error={}", operation, e.toString());
                    return StoreResult.unavailable(StoreFailure.ERROR, operation + ": " + e.getMessage());
                }
            }
        });
    }

    private CounterOutcome checkAndIncrementAll(List<CounterSpec> counters) {
        List<Long> current = new ArrayList<>(counters.size());
        for (CounterSpec counter : counters) {
            Entry entry = live(counter.key());
            current.add(entry == null ? 0L : asLong(entry.value));
        }
        for (int i = 0; i < counters.size(); i++) {
            CounterSpec counter = counters.get(i);
            if (current.get(i) + counter.delta() > counter.limit()) {
                return new CounterOutcome(i, current);
            }
        }
        List<Long> updated = new ArrayList<>(counters.size());
        for (CounterSpec counter : counters) {
            Entry entry = live(counter.key());
            if (entry == null) {
                entry = new Entry(0L, expiryFrom(counter.ttl()));
                entries.put(counter.key(), entry);
            }
            long next = asLong(entry.value) + counter.delta();
            entry.value = next;
            updated.add(next);
        }
        return new CounterOutcome(-1, updated);
    }

    private void sweepIfDue() {
        Instant now = clock.instant();
        if (now.isBefore(nextSweep)) {
            return;
        }
        int before = entries.size();
        entries.values().removeIf(entry -> entry.expiresAt != null && !now.isBefore(entry.expiresAt));
        nextSweep = now.plus(SWEEP_INTERVAL);
        if (before != entries.size()) {
            log.debug("Swept {} expired entries, {} remaining", before - entries.size(), entries.size());
        }
    }

    private Entry live(String key) {
        Entry entry = entries.get(key);
        if (entry != null && entry.expiresAt != null && !clock.instant().isBefore(entry.expiresAt)) {
            entries.remove(key);
            return null;
        }
        return entry;
    }

    private Instant expiryFrom(Duration ttl) {
        return clock.instant().plus(ttl);
    }

    private static long asLong(Object value) {
        if (value instanceof Long) {
            return (Long) value;
        }
        if (value instanceof String) {
            return Long.parseLong((String) value);
        }
        throw new ClassCastException("Entry holds a " + value.getClass().getSimpleName() + ", not a counter");
    }

    private static final class Entry {
        private Object value;
        private Instant expiresAt;

        private Entry(Object value, Instant expiresAt) {
            this.value = value;
            this.expiresAt = expiresAt;
        }
    }
}
