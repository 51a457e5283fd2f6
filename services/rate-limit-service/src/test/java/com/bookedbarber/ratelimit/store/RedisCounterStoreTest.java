package com.bookedbarber.ratelimit.store;

import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.data.redis.connection.RedisStandaloneConfiguration;
import org.springframework.data.redis.connection.lettuce.LettuceConnectionFactory;
import org.springframework.data.redis.core.ReactiveStringRedisTemplate;
import org.testcontainers.containers.GenericContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;
import org.testcontainers.utility.DockerImageName;

import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Runs the Lua scripts against a real Redis.
 */
@Testcontainers(disabledWithoutDocker = true)
@DisplayName("RedisCounterStore Integration Tests")
class RedisCounterStoreTest {

    @Container
    static GenericContainer<?> redis = new GenericContainer<>(DockerImageName.parse("redis:7-alpine"))
            .withExposedPorts(6379);

    private static LettuceConnectionFactory connectionFactory;
    private static ReactiveStringRedisTemplate template;

    private RedisCounterStore store;

    @BeforeAll
    static void connect() {
        connectionFactory = new LettuceConnectionFactory(
                new RedisStandaloneConfiguration(redis.getHost(), redis.getMappedPort(6379)));
        connectionFactory.afterPropertiesSet();
        connectionFactory.start();
        template = new ReactiveStringRedisTemplate(connectionFactory);
    }

    @AfterAll
    static void disconnect() {
        connectionFactory.destroy();
    }

    @BeforeEach
    void setUp() {
        template.getConnectionFactory().getReactiveConnection().serverCommands().flushAll().block();
        store = new RedisCounterStore(template, CircuitBreaker.ofDefaults("test"), Duration.ofSeconds(2));
    }

    @Test
    @DisplayName("Should increment all counters and set their expiry")
    void shouldIncrementAllAndExpire() {
        List<CounterSpec> counters = List.of(
                new CounterSpec("rl:hourly:ip:1", 3, Duration.ofSeconds(120)),
                new CounterSpec("rl:daily:ip:1", 10, Duration.ofSeconds(600)));

        CounterOutcome outcome = store.incrementAllIfBelow(counters).block().getValue();

        assertThat(outcome.allowed()).isTrue();
        assertThat(outcome.counts()).containsExactly(1L, 1L);
        assertThat(template.getExpire("rl:hourly:ip:1").block()).isBetween(Duration.ofSeconds(1), Duration.ofSeconds(120));
        assertThat(template.getExpire("rl:daily:ip:1").block()).isBetween(Duration.ofSeconds(121), Duration.ofSeconds(600));
    }

    @Test
    @DisplayName("Should deny without incrementing once a counter reaches its limit")
    void shouldDenyAtLimit() {
        List<CounterSpec> counters = List.of(
                new CounterSpec("h", 2, Duration.ofSeconds(60)),
                new CounterSpec("d", 10, Duration.ofSeconds(60)));
        store.incrementAllIfBelow(counters).block();
        store.incrementAllIfBelow(counters).block();

        CounterOutcome denied = store.incrementAllIfBelow(counters).block().getValue();

        assertThat(denied.deniedIndex()).isZero();
        assertThat(denied.counts()).containsExactly(2L, 2L);
        assertThat(store.get("d").block().getValue()).isEqualTo(2L);
    }

    @Test
    @DisplayName("Should add weighted deltas and deny one that would overshoot the limit")
    void shouldApplyWeightedDeltas() {
        CounterSpec large = new CounterSpec("rl:amount", 10_000, Duration.ofMinutes(10), 9_000);
        CounterSpec small = new CounterSpec("rl:amount", 10_000, Duration.ofMinutes(10), 1_000);

        CounterOutcome first = store.incrementAllIfBelow(List.of(large)).block().getValue();
        CounterOutcome overshoot = store.incrementAllIfBelow(List.of(large)).block().getValue();
        CounterOutcome fits = store.incrementAllIfBelow(List.of(small)).block().getValue();

        assertThat(first.counts()).containsExactly(9_000L);
        assertThat(overshoot.allowed()).isFalse();
        assertThat(overshoot.counts()).containsExactly(9_000L);
        assertThat(fits.allowed()).isTrue();
        assertThat(fits.counts()).containsExactly(10_000L);
        assertThat(template.getExpire("rl:amount").block()).isBetween(Duration.ofSeconds(1), Duration.ofMinutes(10));
    }

    @Test
    @DisplayName("Should trim bounded lists and count set members")
    void shouldHandleListsAndSets() {
        for (int i = 0; i < 4; i++) {
            store.pushBounded("list", "e" + i, 2, Duration.ofMinutes(5)).block();
        }
        store.addToSet("set", "a", Duration.ofMinutes(5)).block();

        assertThat(store.range("list", 10).block().getValue()).containsExactly("e3", "e2");
        assertThat(store.addToSet("set", "b", Duration.ofMinutes(5)).block().getValue()).isEqualTo(2L);
    }

    @Test
    @DisplayName("Should report the store as unavailable instead of failing when Redis is unreachable")
    void shouldReportUnavailable() {
        LettuceConnectionFactory deadFactory = new LettuceConnectionFactory(
                new RedisStandaloneConfiguration("localhost", 1));
        deadFactory.afterPropertiesSet();
        deadFactory.start();
        try {
            CircuitBreaker breaker = CircuitBreaker.of("dead", CircuitBreakerConfig.custom()
                    .slidingWindowType(CircuitBreakerConfig.SlidingWindowType.COUNT_BASED)
                    .slidingWindowSize(2)
                    .minimumNumberOfCalls(2)
                    .build());
            RedisCounterStore deadStore = new RedisCounterStore(
                    new ReactiveStringRedisTemplate(deadFactory), breaker, Duration.ofMillis(200));

            StoreResult<Long> first = deadStore.increment("k", 1, Duration.ofSeconds(10)).block();
            deadStore.increment("k", 1, Duration.ofSeconds(10)).block();
            StoreResult<Long> afterTrip = deadStore.increment("k", 1, Duration.ofSeconds(10)).block();

            assertThat(first.isAvailable()).isFalse();
            assertThat(afterTrip.getFailure()).isEqualTo(StoreFailure.CIRCUIT_OPEN);
        } finally {
            deadFactory.destroy();
        }
    }
}
