package com.bookedbarber.ratelimit.gate;

import com.bookedbarber.ratelimit.audit.AuditRecorder;
import com.bookedbarber.ratelimit.audit.EndpointNormalizer;
import com.bookedbarber.ratelimit.audit.UsageRecord;
import com.bookedbarber.ratelimit.audit.ViolationEvent;
import com.bookedbarber.ratelimit.config.FailurePolicy;
import com.bookedbarber.ratelimit.config.RateLimitProperties;
import com.bookedbarber.ratelimit.identity.Identity;
import com.bookedbarber.ratelimit.identity.IdentityResolver;
import com.bookedbarber.ratelimit.metrics.RateLimitMetrics;
import com.bookedbarber.ratelimit.payment.PaymentDecision;
import com.bookedbarber.ratelimit.payment.PaymentRateLimitService;
import com.bookedbarber.ratelimit.payment.Violation;
import com.bookedbarber.ratelimit.tier.TierResolver;
import com.bookedbarber.ratelimit.window.WindowDecision;
import com.bookedbarber.ratelimit.window.WindowRateLimiter;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.Ordered;
import org.springframework.core.io.buffer.DataBuffer;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.server.reactive.ServerHttpResponse;
import org.springframework.web.server.ServerWebExchange;
import org.springframework.web.server.WebFilter;
import org.springframework.web.server.WebFilterChain;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Request Gate
 *
 * Runs every protected request through identity resolution, tier lookup and the window limiter,
 * and payment actions additionally through the payment checks. A denial is answered here with a
 * structured 429 or 403 and the handler never runs. A payment intent body above the configured
 * size is answered with a 413 before it is buffered. An allowed request continues with the rate
 * limit headers attached just before the response commits.
 *
 * Counting happens before the handler runs and is not rolled back if the client goes away.
 * Usage is recorded after the response, off the request path. An unexpected failure inside the
 * gate is logged with the stage it happened in and the request is let through.
 *
 * @author BookedBarber Platform Engineering
 * @since 1.0
 */
@Slf4j
public class RequestGateFilter implements WebFilter, Ordered {

    private final RateLimitProperties properties;
    private final ProtectedPathMatcher pathMatcher;
    private final IdentityResolver identityResolver;
    private final TierResolver tierResolver;
    private final WindowRateLimiter windowRateLimiter;
    private final PaymentRateLimitService paymentRateLimitService;
    private final PaymentRequestBodyReader bodyReader;
    private final AuditRecorder auditRecorder;
    private final RateLimitMetrics metrics;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public RequestGateFilter(RateLimitProperties properties, ProtectedPathMatcher pathMatcher,
                             IdentityResolver identityResolver, TierResolver tierResolver,
                             WindowRateLimiter windowRateLimiter, PaymentRateLimitService paymentRateLimitService,
                             PaymentRequestBodyReader bodyReader, AuditRecorder auditRecorder,
                             RateLimitMetrics metrics, ObjectMapper objectMapper, Clock clock) {
        this.properties = properties;
        this.pathMatcher = pathMatcher;
        this.identityResolver = identityResolver;
        this.tierResolver = tierResolver;
        this.windowRateLimiter = windowRateLimiter;
        this.paymentRateLimitService = paymentRateLimitService;
        this.bodyReader = bodyReader;
        this.auditRecorder = auditRecorder;
        this.metrics = metrics;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    @Override
    public Mono<Void> filter(ServerWebExchange exchange, WebFilterChain chain) {
        String path = exchange.getRequest().getPath().pathWithinApplication().value();
        if (!properties.isEnabled() || !pathMatcher.isProtected(path)) {
            return chain.filter(exchange);
        }

        HttpMethod method = exchange.getRequest().getMethod();
        Instant startedAt = clock.instant();
        long startNanos = System.nanoTime();
        GateContext context = new GateContext(path, method, exchange);

        return evaluate(exchange, context)
                .onErrorResume(e -> {
                    metrics.recordGateError();
                    log.error("RATE_LIMIT_GATE_ERROR: stage={}, path={}, error={} - allowing request",
                            context.stage.get(), path, e.getMessage(), e);
                    return Mono.just(GateOutcome.passThrough(context.exchange.get()));
                })
                .switchIfEmpty(Mono.fromSupplier(() -> GateOutcome.passThrough(context.exchange.get())))
                .flatMap(outcome -> {
                    context.stage.set(GateStage.DECIDED);
                    return outcome.denied
                            ? writeDenial(outcome)
                            : proceed(outcome, chain);
                })
                .doFinally(signal -> recordUsage(exchange, context, startedAt, startNanos));
    }

    private Mono<GateOutcome> evaluate(ServerWebExchange exchange, GateContext context) {
        return identityResolver.resolve(exchange)
                .flatMap(identity -> {
                    context.identity.set(identity);
                    context.stage.set(GateStage.IDENTITY_RESOLVED);
                    return tierResolver.getTier(identity);
                })
                .flatMap(tier -> {
                    context.stage.set(GateStage.TIER_RESOLVED);
                    FailurePolicy policy = pathMatcher.isPaymentAction(context.method, context.path)
                            ? properties.getFailurePolicy().getPayment()
                            : properties.getFailurePolicy().getApi();
                    return windowRateLimiter.checkAndIncrement(context.identity.get(), tier, policy);
                })
                .flatMap(window -> {
                    context.stage.set(GateStage.WINDOW_CHECKED);
                    if (window.degraded()) {
                        metrics.recordFailOpen("gate");
                    }
                    if (!window.allowed()) {
                        recordWindowViolation(context, window);
                        metrics.recordDecision("denied", window.tier().label());
                        return Mono.just(GateOutcome.windowDenied(exchange, window));
                    }
                    return classify(exchange, context, window);
                });
    }

    private Mono<GateOutcome> classify(ServerWebExchange exchange, GateContext context, WindowDecision window) {
        Identity identity = context.identity.get();
        String endpoint = EndpointNormalizer.normalize(context.path);

        if (pathMatcher.isPaymentIntent(context.method, context.path)) {
            return bodyReader.read(exchange)
                    .flatMap(cached -> {
                        context.exchange.set(cached.exchange());
                        if (cached.oversized()) {
                            metrics.recordDecision("too_large", window.tier().label());
                            return Mono.just(GateOutcome.bodyTooLarge(cached.exchange(), window));
                        }
                        if (cached.payload().isEmpty()) {
                            return Mono.just(allowed(cached.exchange(), window));
                        }
                        PaymentRequestBodyReader.PaymentIntentPayload payload = cached.payload().get();
                        return paymentRateLimitService.checkPaymentIntentRateLimit(identity, window.tier(),
                                        payload.amount(), payload.paymentMethod(),
                                        identityResolver.country(exchange), endpoint)
                                .map(payment -> decide(cached.exchange(), context, window, payment));
                    });
        }

        Optional<String> intentId = pathMatcher.paymentIntentId(context.method, context.path);
        if (intentId.isPresent()) {
            return paymentRateLimitService.checkPaymentConfirmationRateLimit(identity, intentId.get(), endpoint)
                    .map(payment -> decide(exchange, context, window, payment));
        }
        return Mono.just(allowed(exchange, window));
    }

    private GateOutcome decide(ServerWebExchange exchange, GateContext context, WindowDecision window,
                               PaymentDecision payment) {
        context.stage.set(GateStage.CLASSIFIED);
        if (payment.allowed()) {
            return allowed(exchange, window);
        }
        metrics.recordDecision("denied", window.tier().label());
        return GateOutcome.paymentDenied(exchange, window, payment);
    }

    private GateOutcome allowed(ServerWebExchange exchange, WindowDecision window) {
        metrics.recordDecision(window.degraded() ? "fail_open" : "allowed", window.tier().label());
        return GateOutcome.allowed(exchange, window);
    }

    private Mono<Void> proceed(GateOutcome outcome, WebFilterChain chain) {
        if (outcome.window != null) {
            ServerHttpResponse response = outcome.exchange.getResponse();
            response.beforeCommit(() -> {
                RateLimitHeaders.apply(response.getHeaders(), outcome.window);
                return Mono.empty();
            });
        }
        return chain.filter(outcome.exchange);
    }

    private Mono<Void> writeDenial(GateOutcome outcome) {
        if (outcome.bodyTooLarge) {
            return writeBodyTooLarge(outcome);
        }
        Instant now = clock.instant();
        WindowDecision window = outcome.window;
        HttpStatus status;
        String message;
        String violationType = null;
        long retryAfter;

        if (outcome.payment == null) {
            status = HttpStatus.TOO_MANY_REQUESTS;
            message = "Rate limit exceeded for " + window.window().code() + " window";
            retryAfter = window.retryAfterSeconds(now);
        } else if (outcome.payment.violation() == null) {
            status = HttpStatus.TOO_MANY_REQUESTS;
            message = "Payment protection is temporarily unavailable";
            retryAfter = outcome.payment.retryAfterSeconds();
        } else {
            Violation violation = outcome.payment.violation();
            status = violation.type().getStatus();
            message = violation.message();
            violationType = violation.type().code();
            retryAfter = outcome.payment.retryAfterSeconds();
        }

        RateLimitErrorResponse body = RateLimitErrorResponse.of(status, message,
                new RateLimitErrorResponse.Details(window.limit(), window.window().windowSeconds(),
                        window.currentUsage(), window.resetTime(), window.tier().label(), retryAfter,
                        violationType));

        ServerHttpResponse response = outcome.exchange.getResponse();
        response.setStatusCode(status);
        response.getHeaders().setContentType(MediaType.APPLICATION_JSON);
        RateLimitHeaders.apply(response.getHeaders(), window);
        if (outcome.payment == null) {
            response.getHeaders().set(RateLimitHeaders.REMAINING, "0");
        }
        RateLimitHeaders.retryAfter(response.getHeaders(), retryAfter);

        return writeBody(response, body);
    }

    private Mono<Void> writeBodyTooLarge(GateOutcome outcome) {
        ServerHttpResponse response = outcome.exchange.getResponse();
        response.setStatusCode(HttpStatus.PAYLOAD_TOO_LARGE);
        response.getHeaders().setContentType(MediaType.APPLICATION_JSON);
        RateLimitHeaders.apply(response.getHeaders(), outcome.window);
        return writeBody(response, RateLimitErrorResponse.of(HttpStatus.PAYLOAD_TOO_LARGE,
                "Payment request body exceeds " + bodyReader.getMaxBytes() + " bytes", null));
    }

    private Mono<Void> writeBody(ServerHttpResponse response, RateLimitErrorResponse body) {
        byte[] bytes;
        try {
            bytes = objectMapper.writeValueAsBytes(body);
        } catch (JsonProcessingException e) {
            return Mono.error(new IllegalStateException("Cannot serialize rate limit response", e));
        }
        DataBuffer buffer = response.bufferFactory().wrap(bytes);
        return response.writeWith(Mono.just(buffer));
    }

    private void recordWindowViolation(GateContext context, WindowDecision window) {
        Identity identity = context.identity.get();
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("window", window.window().code());
        details.put("limit", window.limit());
        details.put("current_usage", window.currentUsage());
        details.put("tier", window.tier().label());
        auditRecorder.recordViolation(new ViolationEvent(identity.subjectKey(), identity.ipAddress(),
                RateLimitErrorResponse.RATE_LIMIT_EXCEEDED, "low",
                "Rate limit exceeded for " + window.window().code() + " window", null,
                EndpointNormalizer.normalize(context.path), details, clock.instant()));
    }

    private void recordUsage(ServerWebExchange exchange, GateContext context, Instant startedAt, long startNanos) {
        try {
            Identity identity = context.identity.get();
            int status = exchange.getResponse().getStatusCode() != null
                    ? exchange.getResponse().getStatusCode().value()
                    : HttpStatus.OK.value();
            auditRecorder.recordUsage(new UsageRecord(
                    identity != null ? identity.subjectKey() : "ip:unknown",
                    EndpointNormalizer.normalize(context.path),
                    context.method != null ? context.method.name() : "UNKNOWN",
                    startedAt,
                    status,
                    (System.nanoTime() - startNanos) / 1_000_000));
        } catch (RuntimeException e) {
            metrics.recordAuditFailure();
            log.warn("USAGE_NOT_RECORDED: path={}, error={}", context.path, e.getMessage());
        }
    }

    @Override
    public int getOrder() {
        return -99; // after the security filter chain
    }

    private static final class GateContext {
        private final String path;
        private final HttpMethod method;
        private final AtomicReference<GateStage> stage = new AtomicReference<>(GateStage.ENTRY);
        private final AtomicReference<Identity> identity = new AtomicReference<>();
        // replaces the original once the body has been buffered
        private final AtomicReference<ServerWebExchange> exchange;

        private GateContext(String path, HttpMethod method, ServerWebExchange exchange) {
            this.path = path;
            this.method = method;
            this.exchange = new AtomicReference<>(exchange);
        }
    }

    private static final class GateOutcome {
        private final ServerWebExchange exchange;
        private final WindowDecision window;
        private final PaymentDecision payment;
        private final boolean denied;
        private final boolean bodyTooLarge;

        private GateOutcome(ServerWebExchange exchange, WindowDecision window, PaymentDecision payment,
                            boolean denied, boolean bodyTooLarge) {
            this.exchange = exchange;
            this.window = window;
            this.payment = payment;
            this.denied = denied;
            this.bodyTooLarge = bodyTooLarge;
        }

        static GateOutcome passThrough(ServerWebExchange exchange) {
            return new GateOutcome(exchange, null, null, false, false);
        }

        static GateOutcome allowed(ServerWebExchange exchange, WindowDecision window) {
            return new GateOutcome(exchange, window, null, false, false);
        }

        static GateOutcome windowDenied(ServerWebExchange exchange, WindowDecision window) {
            return new GateOutcome(exchange, window, null, true, false);
        }

        static GateOutcome paymentDenied(ServerWebExchange exchange, WindowDecision window, PaymentDecision payment) {
            return new GateOutcome(exchange, window, payment, true, false);
        }

        static GateOutcome bodyTooLarge(ServerWebExchange exchange, WindowDecision window) {
            return new GateOutcome(exchange, window, null, true, true);
        }
    }
}
