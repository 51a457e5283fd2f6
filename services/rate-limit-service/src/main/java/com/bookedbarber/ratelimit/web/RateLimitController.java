package com.bookedbarber.ratelimit.web;

import com.bookedbarber.ratelimit.config.RateLimitProperties;
import com.bookedbarber.ratelimit.cooldown.CooldownEntry;
import com.bookedbarber.ratelimit.cooldown.CooldownTracker;
import com.bookedbarber.ratelimit.cooldown.TriggerType;
import com.bookedbarber.ratelimit.dto.PaymentCheckRequest;
import com.bookedbarber.ratelimit.dto.PaymentCheckResponse;
import com.bookedbarber.ratelimit.dto.PaymentResultRequest;
import com.bookedbarber.ratelimit.dto.PaymentResultResponse;
import com.bookedbarber.ratelimit.dto.TriggerResponse;
import com.bookedbarber.ratelimit.dto.WindowCheckRequest;
import com.bookedbarber.ratelimit.dto.WindowCheckResponse;
import com.bookedbarber.ratelimit.exception.PaymentViolationException;
import com.bookedbarber.ratelimit.exception.RateLimitExceededException;
import com.bookedbarber.ratelimit.gate.RateLimitHeaders;
import com.bookedbarber.ratelimit.identity.Identity;
import com.bookedbarber.ratelimit.identity.IdentityResolver;
import com.bookedbarber.ratelimit.payment.PaymentDecision;
import com.bookedbarber.ratelimit.payment.PaymentRateLimitService;
import com.bookedbarber.ratelimit.payment.PaymentResultStatus;
import com.bookedbarber.ratelimit.payment.RateLimitStatus;
import com.bookedbarber.ratelimit.tier.Tier;
import com.bookedbarber.ratelimit.tier.TierResolver;
import com.bookedbarber.ratelimit.window.WindowRateLimiter;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ServerWebExchange;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Instant;
import java.util.Locale;

/**
 * Rate limit operations for other services and support tooling.
 */
@RestController
@RequestMapping("/api/v2/rate-limits")
@RequiredArgsConstructor
@Slf4j
@Tag(name = "Rate Limits", description = "Rate limit status, payment checks and cooldown triggers")
public class RateLimitController {

    private final IdentityResolver identityResolver;
    private final TierResolver tierResolver;
    private final WindowRateLimiter windowRateLimiter;
    private final PaymentRateLimitService paymentRateLimitService;
    private final CooldownTracker cooldownTracker;
    private final RateLimitProperties properties;
    private final Clock clock;

    @GetMapping("/status")
    @Operation(summary = "Current usage", description = "Usage and limits for the calling identity")
    public Mono<ResponseEntity<RateLimitStatus>> getStatus(ServerWebExchange exchange) {
        return identityResolver.resolve(exchange)
                .flatMap(paymentRateLimitService::getRateLimitStatus)
                .map(ResponseEntity::ok);
    }

    @PostMapping("/check")
    @Operation(summary = "Count a request", description = "Counts one request against the subject's windows")
    public Mono<ResponseEntity<WindowCheckResponse>> checkWindow(@Valid @RequestBody WindowCheckRequest request) {
        Identity identity = request.toIdentity();
        return tierResolver.getTier(identity)
                .flatMap(tier -> windowRateLimiter.checkAndIncrement(identity, tier,
                        properties.getFailurePolicy().getApi()))
                .flatMap(decision -> {
                    if (!decision.allowed()) {
                        return Mono.error(new RateLimitExceededException(
                                "Rate limit exceeded for " + decision.window().code() + " window",
                                decision.limit(), decision.currentUsage(), decision.window().windowSeconds(),
                                decision.resetTime(), decision.tier().label(),
                                decision.retryAfterSeconds(clock.instant())));
                    }
                    HttpHeaders headers = new HttpHeaders();
                    RateLimitHeaders.apply(headers, decision);
                    WindowCheckResponse body = WindowCheckResponse.builder()
                            .subject(identity.subjectKey())
                            .tier(decision.tier().label())
                            .window(decision.window().code())
                            .limit(decision.limit())
                            .remaining(decision.remaining())
                            .resetTime(decision.resetTime())
                            .degraded(decision.degraded())
                            .build();
                    return Mono.just(ResponseEntity.ok().headers(headers).body(body));
                });
    }

    @PostMapping("/payments/check")
    @Operation(summary = "Check a payment intent", description = "Classifies a payment intent before it is created")
    public Mono<ResponseEntity<PaymentCheckResponse>> checkPayment(@Valid @RequestBody PaymentCheckRequest request) {
        Identity identity = request.toIdentity();
        String country = request.getCountry() != null ? request.getCountry().toUpperCase(Locale.ROOT) : null;
        return tierResolver.getTier(identity)
                .flatMap(tier -> paymentRateLimitService.checkPaymentIntentRateLimit(identity, tier,
                                request.getAmount(), request.getPaymentMethod(), country, null)
                        .flatMap(decision -> toResponse(decision, tier)));
    }

    @PostMapping("/payments/intents/{intentId}/confirmations/check")
    @Operation(summary = "Check a payment confirmation")
    public Mono<ResponseEntity<PaymentCheckResponse>> checkConfirmation(@PathVariable String intentId,
                                                                        @Valid @RequestBody WindowCheckRequest request) {
        Identity identity = request.toIdentity();
        return tierResolver.getTier(identity)
                .flatMap(tier -> paymentRateLimitService.checkPaymentConfirmationRateLimit(identity, intentId)
                        .flatMap(decision -> toResponse(decision, tier)));
    }

    @PostMapping("/payments/results")
    @Operation(summary = "Report a payment result", description = "Feeds the failure streak used by the pattern checks")
    public Mono<ResponseEntity<PaymentResultResponse>> recordPaymentResult(
            @Valid @RequestBody PaymentResultRequest request) {
        Identity identity = request.toIdentity();
        PaymentResultStatus status = PaymentResultStatus.fromCode(request.getStatus());
        log.info("Recording payment result: subject={}, status={}", identity.subjectKey(), status);
        return paymentRateLimitService.recordPaymentResult(identity, request.getAmount(), status,
                        request.getFailureReason())
                .map(failures -> ResponseEntity.status(HttpStatus.ACCEPTED).body(PaymentResultResponse.builder()
                        .subject(identity.subjectKey())
                        .status(status.code())
                        .recentFailures(failures)
                        .build()));
    }

    @DeleteMapping("/tiers/cache/{subject}")
    @Operation(summary = "Evict a cached tier", description = "Called by billing when a subscription changes")
    public Mono<ResponseEntity<Void>> evictTier(@PathVariable String subject) {
        tierResolver.evict(subject);
        return Mono.just(ResponseEntity.noContent().build());
    }

    @PostMapping("/triggers/{type}")
    @Operation(summary = "Fire a trigger", description = "Fires only when the trigger's cooldown has elapsed")
    public Mono<ResponseEntity<TriggerResponse>> trigger(@PathVariable String type,
                                                         @RequestParam(required = false) String scope) {
        TriggerType triggerType = TriggerType.fromCode(type);
        return cooldownTracker.tryTrigger(triggerType, scope)
                .map(triggered -> ResponseEntity.ok(TriggerResponse.builder()
                        .triggerType(triggerType.code())
                        .triggered(triggered)
                        .cooldownMinutes(cooldownTracker.cooldownMinutes(triggerType))
                        .build()));
    }

    @GetMapping("/triggers/{type}")
    @Operation(summary = "Cooldown state of a trigger")
    public Mono<ResponseEntity<TriggerResponse>> getTrigger(@PathVariable String type,
                                                            @RequestParam(required = false) String scope) {
        TriggerType triggerType = TriggerType.fromCode(type);
        return cooldownTracker.lastEntry(triggerType, scope)
                .map(entry -> {
                    TriggerResponse.TriggerResponseBuilder body = TriggerResponse.builder()
                            .triggerType(triggerType.code())
                            .cooldownMinutes(cooldownTracker.cooldownMinutes(triggerType));
                    if (entry.isPresent()) {
                        CooldownEntry last = entry.get();
                        body.cooldownMinutes(last.cooldownMinutes())
                                .lastTriggeredAt(last.lastTriggeredAt())
                                .availableAt(last.availableAt());
                    }
                    return ResponseEntity.ok(body.build());
                });
    }

    private Mono<ResponseEntity<PaymentCheckResponse>> toResponse(PaymentDecision decision, Tier tier) {
        if (decision.allowed()) {
            return Mono.just(ResponseEntity.ok(PaymentCheckResponse.builder()
                    .allowed(true)
                    .degraded(decision.degraded())
                    .build()));
        }
        if (decision.violation() != null) {
            return Mono.error(new PaymentViolationException(decision.violation(), tier.label(),
                    decision.retryAfterSeconds()));
        }
        Instant now = clock.instant();
        return Mono.error(new RateLimitExceededException("Payment protection is temporarily unavailable",
                0L, 0L, decision.retryAfterSeconds(), now.plusSeconds(decision.retryAfterSeconds()),
                tier.label(), decision.retryAfterSeconds()));
    }
}
