package com.bookedbarber.ratelimit.gate;

import com.bookedbarber.ratelimit.MutableClock;
import com.bookedbarber.ratelimit.audit.AuditRecorder;
import com.bookedbarber.ratelimit.audit.AuditSink;
import com.bookedbarber.ratelimit.config.RateLimitProperties;
import com.bookedbarber.ratelimit.cooldown.CooldownTracker;
import com.bookedbarber.ratelimit.identity.HeaderIdentityProvider;
import com.bookedbarber.ratelimit.identity.IdentityResolver;
import com.bookedbarber.ratelimit.metrics.RateLimitMetrics;
import com.bookedbarber.ratelimit.payment.PaymentActivityLedger;
import com.bookedbarber.ratelimit.payment.PaymentRateLimitService;
import com.bookedbarber.ratelimit.payment.ViolationClassifier;
import com.bookedbarber.ratelimit.store.CounterStore;
import com.bookedbarber.ratelimit.store.InMemoryCounterStore;
import com.bookedbarber.ratelimit.store.StoreFailure;
import com.bookedbarber.ratelimit.store.StoreResult;
import com.bookedbarber.ratelimit.tier.ConfiguredSubscriptionClient;
import com.bookedbarber.ratelimit.tier.TierName;
import com.bookedbarber.ratelimit.tier.TierResolver;
import com.bookedbarber.ratelimit.tier.TierTable;
import com.bookedbarber.ratelimit.window.WindowRateLimiter;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.converter.json.Jackson2ObjectMapperBuilder;
import org.springframework.test.web.reactive.server.WebTestClient;
import org.springframework.util.unit.DataSize;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.RETURNS_DEFAULTS;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Drives the gate in front of a stub controller through the WebFlux test client.
 */
@DisplayName("RequestGateFilter")
class RequestGateFilterTest {

    private static final String API_KEY = "bb_live_partner_key";

    private MutableClock clock;
    private RateLimitProperties properties;
    private AuditSink auditSink;
    private SimpleMeterRegistry meterRegistry;
    private WebTestClient client;

    @BeforeEach
    void setUp() {
        clock = MutableClock.at("2026-03-01T10:15:00Z");
        properties = new RateLimitProperties();
        auditSink = mock(AuditSink.class);
        meterRegistry = new SimpleMeterRegistry();
        client = clientFor(new InMemoryCounterStore(clock), null);
    }

    private WebTestClient clientFor(CounterStore store, WindowRateLimiter windowOverride) {
        return clientFor(store, windowOverride, null);
    }

    private WebTestClient clientFor(CounterStore store, WindowRateLimiter windowOverride,
                                    PaymentRateLimitService paymentOverride) {
        ObjectMapper objectMapper = Jackson2ObjectMapperBuilder.json().build();
        RateLimitMetrics metrics = new RateLimitMetrics(meterRegistry);
        TierResolver tierResolver = new TierResolver(TierTable.from(properties.getTiers()),
                new ConfiguredSubscriptionClient(Map.of("user:premium-user", TierName.PREMIUM)),
                Duration.ofMinutes(5), 100);
        WindowRateLimiter windowRateLimiter = windowOverride != null
                ? windowOverride
                : new WindowRateLimiter(store, clock, "rl", properties.getFailOpenLimit(), metrics);
        AuditRecorder auditRecorder = new AuditRecorder(auditSink, store, Schedulers.immediate(), metrics,
                objectMapper, "rl", 100, Duration.ofDays(30));
        PaymentRateLimitService paymentService = paymentOverride != null
                ? paymentOverride
                : new PaymentRateLimitService(store,
                        new PaymentActivityLedger(store, objectMapper, "rl", 50, Duration.ofHours(24)),
                        new ViolationClassifier(properties.getPayment()),
                        new CooldownTracker(store, clock, properties.getCooldowns(), "rl"),
                        auditRecorder, windowRateLimiter, tierResolver, metrics, clock, properties);
        IdentityResolver identityResolver = new IdentityResolver(
                new HeaderIdentityProvider(properties.getIdentity()), properties.getIdentity());

        PaymentRequestBodyReader bodyReader = new PaymentRequestBodyReader(objectMapper,
                Math.toIntExact(properties.getPaymentBodyLimit().toBytes()));
        RequestGateFilter filter = new RequestGateFilter(properties, new ProtectedPathMatcher(properties),
                identityResolver, tierResolver, windowRateLimiter, paymentService, bodyReader, auditRecorder,
                metrics, objectMapper, clock);
        return WebTestClient.bindToController(new BookingController())
                .webFilter(filter)
                .build();
    }

    @Nested
    @DisplayName("Window limits")
    class WindowLimits {

        @Test
        @DisplayName("Should count down the free tier and answer the 101st request with 429")
        void shouldEnforceFreeTier() {
            for (int i = 1; i <= 100; i++) {
                client.get().uri("/api/v2/public/shops")
                        .header("X-API-Key", API_KEY)
                        .exchange()
                        .expectStatus().isOk()
                        .expectHeader().valueEquals(RateLimitHeaders.LIMIT, "100")
                        .expectHeader().valueEquals(RateLimitHeaders.REMAINING, String.valueOf(100 - i))
                        .expectHeader().valueEquals(RateLimitHeaders.TIER, "free");
            }

            client.get().uri("/api/v2/public/shops")
                    .header("X-API-Key", API_KEY)
                    .exchange()
                    .expectStatus().isEqualTo(429)
                    .expectHeader().valueEquals(RateLimitHeaders.REMAINING, "0")
                    .expectHeader().valueEquals(HttpHeaders.RETRY_AFTER, "2700")
                    .expectHeader().valueEquals(RateLimitHeaders.RESET,
                            String.valueOf(Instant.parse("2026-03-01T11:00:00Z").getEpochSecond()))
                    .expectBody()
                    .jsonPath("$.error").isEqualTo("rate_limit_exceeded")
                    .jsonPath("$.details.limit").isEqualTo(100)
                    .jsonPath("$.details.current_usage").isEqualTo(100)
                    .jsonPath("$.details.window_seconds").isEqualTo(3600)
                    .jsonPath("$.details.tier").isEqualTo("free")
                    .jsonPath("$.details.retry_after").isEqualTo(2700)
                    .jsonPath("$.details.reset_time").isEqualTo("2026-03-01T11:00:00Z");

            verify(auditSink).recordViolation(any());
        }

        @Test
        @DisplayName("Should apply the subscriber's tier")
        void shouldApplySubscriberTier() {
            client.get().uri("/api/v2/public/shops")
                    .header("X-User-Id", "premium-user")
                    .exchange()
                    .expectStatus().isOk()
                    .expectHeader().valueEquals(RateLimitHeaders.LIMIT, "5000")
                    .expectHeader().valueEquals(RateLimitHeaders.TIER, "premium");
        }

        @Test
        @DisplayName("Should leave unprotected paths alone")
        void shouldIgnoreUnprotectedPaths() {
            client.get().uri("/internal/ping")
                    .exchange()
                    .expectStatus().isOk()
                    .expectHeader().doesNotExist(RateLimitHeaders.LIMIT);
        }

        @Test
        @DisplayName("Should fail open with the fail-open limit when the store is down")
        void shouldFailOpen() {
            CounterStore deadStore = mock(CounterStore.class, invocation ->
                    invocation.getMethod().getReturnType() == Mono.class
                            ? Mono.just(StoreResult.unavailable(StoreFailure.TIMEOUT, "redis timeout"))
                            : RETURNS_DEFAULTS.answer(invocation));
            WebTestClient degraded = clientFor(deadStore, null);

            degraded.get().uri("/api/v2/public/shops")
                    .header("X-Forwarded-For", "198.51.100.7")
                    .exchange()
                    .expectStatus().isOk()
                    .expectHeader().valueEquals(RateLimitHeaders.LIMIT, "10000");

            assertThat(meterRegistry.counter("rate_limit_decisions", "outcome", "fail_open", "tier", "free").count())
                    .isEqualTo(1.0);
        }

        @Test
        @DisplayName("Should let the request through when the gate itself fails")
        void shouldAllowOnGateError() {
            WindowRateLimiter broken = mock(WindowRateLimiter.class);
            when(broken.checkAndIncrement(any(), any(), any()))
                    .thenThrow(new IllegalStateException("bug"));
            WebTestClient guarded = clientFor(new InMemoryCounterStore(clock), broken);

            guarded.get().uri("/api/v2/public/shops")
                    .exchange()
                    .expectStatus().isOk()
                    .expectHeader().doesNotExist(RateLimitHeaders.LIMIT);

            assertThat(meterRegistry.counter("rate_limit_gate_errors").count()).isEqualTo(1.0);
        }
    }

    @Nested
    @DisplayName("Payment actions")
    class PaymentActions {

        @Test
        @DisplayName("Should replay the classified body to the handler")
        void shouldReplayBody() {
            client.post().uri("/api/v2/payments/intents")
                    .header("X-API-Key", API_KEY)
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue("{\"amount\": 45.50, \"payment_method\": {\"type\": \"card\", \"last4\": \"4242\"}}")
                    .exchange()
                    .expectStatus().isOk()
                    .expectHeader().exists(RateLimitHeaders.REMAINING)
                    .expectBody()
                    .jsonPath("$.received").isEqualTo(45.5);
        }

        @Test
        @DisplayName("Should answer a payment body above the size limit with 413 without calling the handler")
        void shouldRejectOversizedBody() {
            properties.setPaymentBodyLimit(DataSize.ofBytes(64));
            WebTestClient limited = clientFor(new InMemoryCounterStore(clock), null);
            String padding = "x".repeat(200);

            limited.post().uri("/api/v2/payments/intents")
                    .header("X-API-Key", API_KEY)
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue("{\"amount\": 45.50, \"note\": \"" + padding + "\"}")
                    .exchange()
                    .expectStatus().isEqualTo(413)
                    .expectHeader().exists(RateLimitHeaders.REMAINING)
                    .expectBody()
                    .jsonPath("$.error").isEqualTo("payload_too_large")
                    .jsonPath("$.message").isEqualTo("Payment request body exceeds 64 bytes")
                    .jsonPath("$.received").doesNotExist();

            assertThat(meterRegistry.counter("rate_limit_decisions", "outcome", "too_large", "tier", "free").count())
                    .isEqualTo(1.0);
        }

        @Test
        @DisplayName("Should still hand the buffered body to the handler when payment checks fail")
        void shouldReplayBodyAfterPaymentCheckError() {
            PaymentRateLimitService broken = mock(PaymentRateLimitService.class);
            when(broken.checkPaymentIntentRateLimit(any(), any(), any(), any(), any(), any()))
                    .thenReturn(Mono.error(new IllegalStateException("bug")));
            WebTestClient guarded = clientFor(new InMemoryCounterStore(clock), null, broken);

            guarded.post().uri("/api/v2/payments/intents")
                    .header("X-API-Key", API_KEY)
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue("{\"amount\": 45.50}")
                    .exchange()
                    .expectStatus().isOk()
                    .expectBody()
                    .jsonPath("$.received").isEqualTo(45.5);

            assertThat(meterRegistry.counter("rate_limit_gate_errors").count()).isEqualTo(1.0);
        }

        @Test
        @DisplayName("Should answer an over-ceiling amount with a retryable 429")
        void shouldRejectLargeAmount() {
            client.post().uri("/api/v2/payments/intents")
                    .header("X-API-Key", API_KEY)
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue("{\"amount\": 6000.00}")
                    .exchange()
                    .expectStatus().isEqualTo(429)
                    .expectHeader().valueEquals(HttpHeaders.RETRY_AFTER, "600")
                    .expectBody()
                    .jsonPath("$.error").isEqualTo("rate_limit_exceeded")
                    .jsonPath("$.details.violation_type").isEqualTo("amount_exceeded");
        }

        @Test
        @DisplayName("Should answer a doubling amount chain with 403 for review")
        void shouldRejectEscalation() {
            for (String amount : new String[]{"10.00", "20.00", "40.00"}) {
                postIntent(amount).expectStatus().isOk();
            }

            postIntent("80.00")
                    .expectStatus().isForbidden()
                    .expectBody()
                    .jsonPath("$.error").isEqualTo("payment_review_required")
                    .jsonPath("$.details.violation_type").isEqualTo("velocity_anomaly");
        }

        @Test
        @DisplayName("Should pass payment bodies without an amount straight to the handler")
        void shouldSkipUnreadableBody() {
            client.post().uri("/api/v2/payments/intents")
                    .header("X-API-Key", API_KEY)
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue("{\"currency\": \"usd\"}")
                    .exchange()
                    .expectStatus().isOk();
        }

        @Test
        @DisplayName("Should limit confirmations of one intent")
        void shouldLimitConfirmations() {
            for (int i = 0; i < 3; i++) {
                confirm("pi_123").expectStatus().isOk();
            }

            confirm("pi_123")
                    .expectStatus().isEqualTo(429)
                    .expectBody()
                    .jsonPath("$.details.violation_type").isEqualTo("frequency_exceeded");
        }

        private WebTestClient.ResponseSpec postIntent(String amount) {
            return client.post().uri("/api/v2/payments/intents")
                    .header("X-API-Key", API_KEY)
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue("{\"amount\": " + amount + "}")
                    .exchange();
        }

        private WebTestClient.ResponseSpec confirm(String intentId) {
            return client.post().uri("/api/v2/payments/intents/{id}/confirm", intentId)
                    .header("X-API-Key", API_KEY)
                    .exchange();
        }
    }

    @RestController
    static class BookingController {

        @GetMapping("/api/v2/public/shops")
        Mono<Map<String, Object>> shops() {
            return Mono.just(Map.of("shops", 3));
        }

        @GetMapping("/internal/ping")
        Mono<String> ping() {
            return Mono.just("pong");
        }

        @PostMapping("/api/v2/payments/intents")
        Mono<Map<String, Object>> createIntent(@RequestBody Map<String, Object> body) {
            return Mono.just(Map.of("received", body.getOrDefault("amount", "none")));
        }

        @PostMapping("/api/v2/payments/intents/{id}/confirm")
        Mono<Map<String, Object>> confirm(@PathVariable("id") String id) {
            return Mono.just(Map.of("confirmed", id));
        }
    }
}
