package com.bookedbarber.ratelimit.store;

import com.bookedbarber.ratelimit.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("InMemoryCounterStore")
class InMemoryCounterStoreTest {

    private MutableClock clock;
    private InMemoryCounterStore store;

    @BeforeEach
    void setUp() {
        clock = MutableClock.at("2026-03-01T10:15:00Z");
        store = new InMemoryCounterStore(clock);
    }

    @Nested
    @DisplayName("incrementAllIfBelow")
    class IncrementAllIfBelow {

        @Test
        @DisplayName("Should increment every counter when all are below their limits")
        void shouldIncrementAll() {
            List<CounterSpec> counters = List.of(
                    new CounterSpec("a", 2, Duration.ofMinutes(1)),
                    new CounterSpec("b", 5, Duration.ofMinutes(1)));

            CounterOutcome first = store.incrementAllIfBelow(counters).block().getValue();
            CounterOutcome second = store.incrementAllIfBelow(counters).block().getValue();

            assertThat(first.allowed()).isTrue();
            assertThat(first.counts()).containsExactly(1L, 1L);
            assertThat(second.counts()).containsExactly(2L, 2L);
        }

        @Test
        @DisplayName("Should leave every counter untouched when one is at its limit")
        void shouldNotIncrementOnDenial() {
            List<CounterSpec> counters = List.of(
                    new CounterSpec("a", 10, Duration.ofMinutes(1)),
                    new CounterSpec("b", 1, Duration.ofMinutes(1)));
            store.incrementAllIfBelow(counters).block();

            CounterOutcome denied = store.incrementAllIfBelow(counters).block().getValue();

            assertThat(denied.allowed()).isFalse();
            assertThat(denied.deniedIndex()).isEqualTo(1);
            assertThat(denied.counts()).containsExactly(1L, 1L);
            assertThat(store.get("a").block().getValue()).isEqualTo(1L);
        }

        @Test
        @DisplayName("Should deny a weighted increment that would overshoot the limit")
        void shouldDenyOvershootingDelta() {
            CounterSpec cents = new CounterSpec("amount", 10_000, Duration.ofMinutes(10), 9_000);
            store.incrementAllIfBelow(List.of(cents)).block();

            CounterOutcome denied = store.incrementAllIfBelow(List.of(cents)).block().getValue();
            CounterOutcome fits = store.incrementAllIfBelow(
                    List.of(new CounterSpec("amount", 10_000, Duration.ofMinutes(10), 1_000))).block().getValue();

            assertThat(denied.allowed()).isFalse();
            assertThat(denied.counts()).containsExactly(9_000L);
            assertThat(fits.allowed()).isTrue();
            assertThat(fits.counts()).containsExactly(10_000L);
        }

        @Test
        @DisplayName("Should never let concurrent callers exceed the limit")
        void shouldHoldLimitUnderConcurrency() throws InterruptedException {
            List<CounterSpec> counters = List.of(new CounterSpec("shared", 50, Duration.ofMinutes(1)));
            ExecutorService executor = Executors.newFixedThreadPool(8);
            CountDownLatch done = new CountDownLatch(200);
            AtomicInteger allowed = new AtomicInteger();

            for (int i = 0; i < 200; i++) {
                executor.submit(() -> {
                    if (store.incrementAllIfBelow(counters).block().getValue().allowed()) {
                        allowed.incrementAndGet();
                    }
                    done.countDown();
                });
            }
            assertThat(done.await(10, TimeUnit.SECONDS)).isTrue();
            executor.shutdown();

            assertThat(allowed.get()).isEqualTo(50);
            assertThat(store.get("shared").block().getValue()).isEqualTo(50L);
        }
    }

    @Nested
    @DisplayName("expiry")
    class Expiry {

        @Test
        @DisplayName("Should drop a counter once its ttl has elapsed")
        void shouldExpireCounter() {
            store.increment("k", 3, Duration.ofSeconds(30)).block();

            clock.advance(Duration.ofSeconds(30));

            assertThat(store.get("k").block().getValue()).isZero();
        }

        @Test
        @DisplayName("Should not extend a counter's lifetime on later increments")
        void shouldKeepOriginalExpiry() {
            store.increment("k", 1, Duration.ofSeconds(30)).block();
            clock.advance(Duration.ofSeconds(20));
            store.increment("k", 1, Duration.ofSeconds(30)).block();

            clock.advance(Duration.ofSeconds(10));

            assertThat(store.get("k").block().getValue()).isZero();
        }
    }

    @Nested
    @DisplayName("housekeeping")
    class Housekeeping {

        @Test
        @DisplayName("Should sweep expired keys that are never read again")
        void shouldSweepAbandonedKeys() {
            for (int i = 0; i < 100; i++) {
                store.increment("abandoned:" + i, 1, Duration.ofSeconds(30)).block();
            }
            assertThat(store.size()).isEqualTo(100);

            clock.advance(InMemoryCounterStore.SWEEP_INTERVAL);
            store.increment("fresh", 1, Duration.ofMinutes(5)).block();

            assertThat(store.size()).isEqualTo(1);
        }

        @Test
        @DisplayName("Should report a non-numeric entry as a store error instead of throwing")
        void shouldReportUnparseableCounter() {
            store.setValue("k", "abc", Duration.ofMinutes(1)).block();

            StepVerifier.create(store.increment("k", 1, Duration.ofMinutes(1)))
                    .assertNext(result -> {
                        assertThat(result.isAvailable()).isFalse();
                        assertThat(result.getFailure()).isEqualTo(StoreFailure.ERROR);
                    })
                    .verifyComplete();
            assertThat(store.incrementAllIfBelow(List.of(new CounterSpec("k", 5, Duration.ofMinutes(1))))
                    .block().isAvailable()).isFalse();
        }

        @Test
        @DisplayName("Should report a list read as a counter as a store error")
        void shouldReportWrongShape() {
            store.pushBounded("list", "v1", 3, Duration.ofHours(1)).block();

            assertThat(store.get("list").block().getFailure()).isEqualTo(StoreFailure.ERROR);
        }
    }

    @Test
    @DisplayName("Should keep bounded lists newest first and trimmed")
    void shouldKeepBoundedList() {
        for (int i = 1; i <= 5; i++) {
            store.pushBounded("list", "v" + i, 3, Duration.ofHours(1)).block();
        }

        assertThat(store.range("list", 10).block().getValue()).containsExactly("v5", "v4", "v3");
        assertThat(store.range("list", 2).block().getValue()).containsExactly("v5", "v4");
    }

    @Test
    @DisplayName("Should report set cardinality after each add")
    void shouldCountSetMembers() {
        store.addToSet("set", "x", Duration.ofHours(1)).block();
        store.addToSet("set", "x", Duration.ofHours(1)).block();

        assertThat(store.addToSet("set", "y", Duration.ofHours(1)).block().getValue()).isEqualTo(2L);
    }

    @Test
    @DisplayName("Should store, read and delete plain values")
    void shouldHandlePlainValues() {
        store.setValue("v", "hello", Duration.ofMinutes(1)).block();

        assertThat(store.getValue("v").block().getValue()).contains("hello");
        assertThat(store.delete("v").block().getValue()).isTrue();
        assertThat(store.getValue("v").block().getValue()).isEqualTo(Optional.empty());
    }
}
