package com.bookedbarber.ratelimit.config;

import com.bookedbarber.ratelimit.audit.AuditRecorder;
import com.bookedbarber.ratelimit.audit.AuditSink;
import com.bookedbarber.ratelimit.audit.LoggingAuditSink;
import com.bookedbarber.ratelimit.cooldown.CooldownTracker;
import com.bookedbarber.ratelimit.exception.RateLimitConfigurationException;
import com.bookedbarber.ratelimit.gate.PaymentRequestBodyReader;
import com.bookedbarber.ratelimit.gate.ProtectedPathMatcher;
import com.bookedbarber.ratelimit.gate.RequestGateFilter;
import com.bookedbarber.ratelimit.identity.HeaderIdentityProvider;
import com.bookedbarber.ratelimit.identity.IdentityProvider;
import com.bookedbarber.ratelimit.identity.IdentityResolver;
import com.bookedbarber.ratelimit.metrics.RateLimitMetrics;
import com.bookedbarber.ratelimit.payment.PaymentActivityLedger;
import com.bookedbarber.ratelimit.payment.PaymentRateLimitService;
import com.bookedbarber.ratelimit.payment.ViolationClassifier;
import com.bookedbarber.ratelimit.store.CounterStore;
import com.bookedbarber.ratelimit.store.InMemoryCounterStore;
import com.bookedbarber.ratelimit.store.RedisCounterStore;
import com.bookedbarber.ratelimit.tier.BillingSubscriptionClient;
import com.bookedbarber.ratelimit.tier.ConfiguredSubscriptionClient;
import com.bookedbarber.ratelimit.tier.SubscriptionClient;
import com.bookedbarber.ratelimit.tier.TierResolver;
import com.bookedbarber.ratelimit.tier.TierTable;
import com.bookedbarber.ratelimit.window.WindowRateLimiter;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.ReactiveStringRedisTemplate;
import org.springframework.util.StringUtils;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.time.Clock;
import java.time.Duration;

/**
 * Wires the rate limiting components from {@link RateLimitProperties}.
 *
 * Invalid tier tables and an unreachable Redis store fail startup with a
 * {@link RateLimitConfigurationException}.
 */
@Configuration
@EnableConfigurationProperties(RateLimitProperties.class)
@Slf4j
public class RateLimitConfiguration {

    public static final String STORE_CIRCUIT_BREAKER = "rate-limit-store";

    @Bean
    public Clock rateLimitClock() {
        return Clock.systemUTC();
    }

    @Bean
    public RateLimitMetrics rateLimitMetrics(MeterRegistry meterRegistry) {
        return new RateLimitMetrics(meterRegistry);
    }

    @Bean
    public TierTable tierTable(RateLimitProperties properties) {
        TierTable table = TierTable.from(properties.getTiers());
        table.asMap().values().forEach(tier -> log.info("Rate limit tier {}: {}/hour, {}/day",
                tier.label(), tier.hourlyLimit(), tier.dailyLimit()));
        return table;
    }

    @Bean
    public CircuitBreakerRegistry rateLimitCircuitBreakerRegistry(RateLimitProperties properties) {
        RateLimitProperties.CircuitBreaker config = properties.getCircuitBreaker();
        return CircuitBreakerRegistry.of(CircuitBreakerConfig.custom()
                .slidingWindowType(CircuitBreakerConfig.SlidingWindowType.COUNT_BASED)
                .slidingWindowSize(config.getSlidingWindowSize())
                .minimumNumberOfCalls(config.getMinimumNumberOfCalls())
                .failureRateThreshold(config.getFailureRateThreshold())
                .waitDurationInOpenState(config.getWaitDurationInOpenState())
                .permittedNumberOfCallsInHalfOpenState(3)
                .build());
    }

    @Bean
    public CounterStore counterStore(RateLimitProperties properties,
                                     ObjectProvider<ReactiveStringRedisTemplate> redisTemplate,
                                     CircuitBreakerRegistry rateLimitCircuitBreakerRegistry,
                                     Clock rateLimitClock) {
        if (properties.getStore() == RateLimitProperties.StoreType.MEMORY) {
            log.warn("Rate limit counters are held in process memory; limits are not shared between instances");
            return new InMemoryCounterStore(rateLimitClock);
        }

        ReactiveStringRedisTemplate template = redisTemplate.getIfAvailable();
        if (template == null) {
            throw new RateLimitConfigurationException(
                    "Redis store selected but no ReactiveStringRedisTemplate is configured");
        }
        if (properties.isVerifyStoreOnStartup()) {
            verifyRedis(template);
        }
        CircuitBreaker circuitBreaker = rateLimitCircuitBreakerRegistry.circuitBreaker(STORE_CIRCUIT_BREAKER);
        circuitBreaker.getEventPublisher().onStateTransition(event ->
                log.warn("RATE_LIMIT_STORE_CIRCUIT: {}", event.getStateTransition()));
        return new RedisCounterStore(template, circuitBreaker, properties.getStoreTimeout());
    }

    @Bean
    public SubscriptionClient subscriptionClient(RateLimitProperties properties, WebClient.Builder webClientBuilder) {
        RateLimitProperties.Billing billing = properties.getBilling();
        if (StringUtils.hasText(billing.getBaseUrl())) {
            log.info("Resolving subscription tiers from billing at {}", billing.getBaseUrl());
            return new BillingSubscriptionClient(webClientBuilder.baseUrl(billing.getBaseUrl()).build(),
                    billing.getTimeout());
        }
        log.info("Resolving subscription tiers from {} configured assignments", billing.getSubscriptions().size());
        return new ConfiguredSubscriptionClient(billing.getSubscriptions());
    }

    @Bean
    public TierResolver tierResolver(TierTable tierTable, SubscriptionClient subscriptionClient,
                                     RateLimitProperties properties) {
        return new TierResolver(tierTable, subscriptionClient, properties.getTierCache().getTtl(),
                properties.getTierCache().getMaximumSize());
    }

    @Bean
    public IdentityProvider identityProvider(RateLimitProperties properties) {
        return new HeaderIdentityProvider(properties.getIdentity());
    }

    @Bean
    public IdentityResolver identityResolver(IdentityProvider identityProvider, RateLimitProperties properties) {
        return new IdentityResolver(identityProvider, properties.getIdentity());
    }

    @Bean
    public WindowRateLimiter windowRateLimiter(CounterStore counterStore, Clock rateLimitClock,
                                               RateLimitProperties properties, RateLimitMetrics metrics) {
        return new WindowRateLimiter(counterStore, rateLimitClock, properties.getKeyPrefix(),
                properties.getFailOpenLimit(), metrics);
    }

    @Bean
    public CooldownTracker cooldownTracker(CounterStore counterStore, Clock rateLimitClock,
                                           RateLimitProperties properties) {
        return new CooldownTracker(counterStore, rateLimitClock, properties.getCooldowns(),
                properties.getKeyPrefix());
    }

    @Bean(destroyMethod = "dispose")
    public Scheduler auditScheduler(RateLimitProperties properties) {
        return Schedulers.newBoundedElastic(properties.getAudit().getThreads(),
                properties.getAudit().getQueueCapacity(), "rate-limit-audit");
    }

    @Bean
    public AuditSink auditSink(ObjectMapper objectMapper) {
        return new LoggingAuditSink(objectMapper);
    }

    @Bean
    public AuditRecorder auditRecorder(AuditSink auditSink, CounterStore counterStore, Scheduler auditScheduler,
                                       RateLimitMetrics metrics, ObjectMapper objectMapper,
                                       RateLimitProperties properties) {
        return new AuditRecorder(auditSink, counterStore, auditScheduler, metrics, objectMapper,
                properties.getKeyPrefix(), properties.getUsage().getRecentLimit(),
                properties.getUsage().getRetention());
    }

    @Bean
    public PaymentActivityLedger paymentActivityLedger(CounterStore counterStore, ObjectMapper objectMapper,
                                                       RateLimitProperties properties) {
        return new PaymentActivityLedger(counterStore, objectMapper, properties.getKeyPrefix(),
                properties.getPayment().getLedgerSize(), properties.getPayment().getLedgerRetention());
    }

    @Bean
    public ViolationClassifier violationClassifier(RateLimitProperties properties) {
        return new ViolationClassifier(properties.getPayment());
    }

    @Bean
    public PaymentRateLimitService paymentRateLimitService(CounterStore counterStore, PaymentActivityLedger ledger,
                                                           ViolationClassifier classifier,
                                                           CooldownTracker cooldownTracker,
                                                           AuditRecorder auditRecorder,
                                                           WindowRateLimiter windowRateLimiter,
                                                           TierResolver tierResolver, RateLimitMetrics metrics,
                                                           Clock rateLimitClock, RateLimitProperties properties) {
        return new PaymentRateLimitService(counterStore, ledger, classifier, cooldownTracker, auditRecorder,
                windowRateLimiter, tierResolver, metrics, rateLimitClock, properties);
    }

    @Bean
    public RequestGateFilter requestGateFilter(RateLimitProperties properties, IdentityResolver identityResolver,
                                               TierResolver tierResolver, WindowRateLimiter windowRateLimiter,
                                               PaymentRateLimitService paymentRateLimitService,
                                               AuditRecorder auditRecorder, RateLimitMetrics metrics,
                                               ObjectMapper objectMapper, Clock rateLimitClock) {
        PaymentRequestBodyReader bodyReader = new PaymentRequestBodyReader(objectMapper,
                Math.toIntExact(properties.getPaymentBodyLimit().toBytes()));
        return new RequestGateFilter(properties, new ProtectedPathMatcher(properties), identityResolver,
                tierResolver, windowRateLimiter, paymentRateLimitService, bodyReader, auditRecorder, metrics,
                objectMapper, rateLimitClock);
    }

    private static void verifyRedis(ReactiveStringRedisTemplate template) {
        try {
            String pong = template.getConnectionFactory().getReactiveConnection()
                    .ping()
                    .block(Duration.ofSeconds(5));
            if (!"PONG".equalsIgnoreCase(pong)) {
                throw new RateLimitConfigurationException("Unexpected Redis ping reply: " + pong);
            }
            log.info("Redis rate limit store reachable");
        } catch (RateLimitConfigurationException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new RateLimitConfigurationException("Redis rate limit store is not reachable", e);
        }
    }
}
