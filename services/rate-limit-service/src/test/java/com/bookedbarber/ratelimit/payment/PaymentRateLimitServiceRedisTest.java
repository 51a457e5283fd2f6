package com.bookedbarber.ratelimit.payment;

import com.bookedbarber.ratelimit.MutableClock;
import com.bookedbarber.ratelimit.audit.AuditRecorder;
import com.bookedbarber.ratelimit.audit.AuditSink;
import com.bookedbarber.ratelimit.config.RateLimitProperties;
import com.bookedbarber.ratelimit.cooldown.CooldownTracker;
import com.bookedbarber.ratelimit.identity.Identity;
import com.bookedbarber.ratelimit.metrics.RateLimitMetrics;
import com.bookedbarber.ratelimit.store.RedisCounterStore;
import com.bookedbarber.ratelimit.tier.ConfiguredSubscriptionClient;
import com.bookedbarber.ratelimit.tier.TierResolver;
import com.bookedbarber.ratelimit.tier.TierTable;
import com.bookedbarber.ratelimit.window.WindowRateLimiter;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.data.redis.connection.RedisStandaloneConfiguration;
import org.springframework.data.redis.connection.lettuce.LettuceConnectionFactory;
import org.springframework.data.redis.core.ReactiveStringRedisTemplate;
import org.springframework.http.converter.json.Jackson2ObjectMapperBuilder;
import org.testcontainers.containers.GenericContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;
import org.testcontainers.utility.DockerImageName;
import reactor.core.scheduler.Schedulers;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;

/**
 * Payment protection against a real Redis, with callers arriving at the same instant.
 */
@Testcontainers(disabledWithoutDocker = true)
@DisplayName("PaymentRateLimitService Redis Integration Tests")
class PaymentRateLimitServiceRedisTest {

    private static final PaymentMethodInfo VISA = new PaymentMethodInfo("card", "4242", "visa", "12", "2028");

    @Container
    static GenericContainer<?> redis = new GenericContainer<>(DockerImageName.parse("redis:7-alpine"))
            .withExposedPorts(6379);

    private static LettuceConnectionFactory connectionFactory;
    private static ReactiveStringRedisTemplate template;

    private final Identity customer = Identity.ofUser("customer-1", "203.0.113.10");

    private PaymentActivityLedger ledger;
    private PaymentRateLimitService service;

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

        MutableClock clock = MutableClock.at("2026-03-01T12:00:00Z");
        RateLimitProperties properties = new RateLimitProperties();
        RateLimitMetrics metrics = new RateLimitMetrics(new SimpleMeterRegistry());
        ObjectMapper objectMapper = Jackson2ObjectMapperBuilder.json().build();
        RedisCounterStore store = new RedisCounterStore(template, CircuitBreaker.ofDefaults("payments"),
                Duration.ofSeconds(2));

        ledger = new PaymentActivityLedger(store, objectMapper, "rl", 50, Duration.ofHours(24));
        service = new PaymentRateLimitService(store, ledger,
                new ViolationClassifier(properties.getPayment()),
                new CooldownTracker(store, clock, properties.getCooldowns(), "rl"),
                new AuditRecorder(mock(AuditSink.class), store, Schedulers.immediate(), metrics, objectMapper,
                        "rl", 100, Duration.ofDays(30)),
                new WindowRateLimiter(store, clock, "rl", 10_000, metrics),
                new TierResolver(TierTable.from(properties.getTiers()), new ConfiguredSubscriptionClient(Map.of()),
                        Duration.ofMinutes(5), 100),
                metrics, clock, properties);
    }

    @Test
    @DisplayName("Should allow no more than the per-minute maximum when attempts arrive together")
    void shouldHoldAttemptLimitAcrossConcurrentCallers() throws Exception {
        List<PaymentDecision> decisions = ConcurrentCalls.run(40, caller ->
                service.checkPaymentIntentRateLimit(customer, new BigDecimal("900.00"), VISA, null).block());

        assertThat(decisions).noneMatch(PaymentDecision::degraded);
        assertThat(decisions).filteredOn(PaymentDecision::allowed).hasSize(10);
        assertThat(ledger.recent(customer).block().getValue()).hasSize(10);
    }

    @Test
    @DisplayName("Should keep the window total under the rolling ceiling when large attempts arrive together")
    void shouldHoldAmountCeilingAcrossConcurrentCallers() throws Exception {
        List<PaymentDecision> decisions = ConcurrentCalls.run(40, caller ->
                service.checkPaymentIntentRateLimit(customer, new BigDecimal("4000.00"), VISA, null).block());

        assertThat(decisions).filteredOn(PaymentDecision::allowed).hasSize(2);
        assertThat(template.opsForValue().get("rl:pay:amount:user:customer-1:window:" + 1772366400L / 600).block())
                .isEqualTo("800000");
    }

    @Test
    @DisplayName("Should allow three confirmations of one intent when they arrive together")
    void shouldHoldConfirmationLimitAcrossConcurrentCallers() throws Exception {
        List<PaymentDecision> decisions = ConcurrentCalls.run(20, caller ->
                service.checkPaymentConfirmationRateLimit(customer, "pi_race").block());

        assertThat(decisions).filteredOn(PaymentDecision::allowed).hasSize(3);
    }
}
