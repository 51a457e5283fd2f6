package com.bookedbarber.ratelimit.payment;

import com.bookedbarber.ratelimit.audit.AuditRecorder;
import com.bookedbarber.ratelimit.audit.SecurityAlert;
import com.bookedbarber.ratelimit.audit.ViolationEvent;
import com.bookedbarber.ratelimit.config.FailurePolicy;
import com.bookedbarber.ratelimit.config.RateLimitProperties;
import com.bookedbarber.ratelimit.cooldown.CooldownTracker;
import com.bookedbarber.ratelimit.cooldown.TriggerType;
import com.bookedbarber.ratelimit.identity.Identity;
import com.bookedbarber.ratelimit.metrics.RateLimitMetrics;
import com.bookedbarber.ratelimit.store.CounterOutcome;
import com.bookedbarber.ratelimit.store.CounterSpec;
import com.bookedbarber.ratelimit.store.CounterStore;
import com.bookedbarber.ratelimit.store.StoreResult;
import com.bookedbarber.ratelimit.tier.Tier;
import com.bookedbarber.ratelimit.tier.TierResolver;
import com.bookedbarber.ratelimit.window.WindowDecision;
import com.bookedbarber.ratelimit.window.WindowRateLimiter;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Payment Rate Limit Service
 *
 * Entry point for payment-specific protection:
 * <ul>
 *   <li>payment intent checks, classified against the identity's recent activity ledger</li>
 *   <li>payment confirmation checks, per minute and per intent</li>
 *   <li>payment results reported by the payment execution side, feeding the failure streak</li>
 *   <li>status snapshots for support tooling</li>
 * </ul>
 *
 * Violations are audited and the serious ones raise a security alert, at most once per
 * cooldown interval per subject. When the store cannot answer, the payment failure policy
 * decides between allowing and denying.
 *
 * @author BookedBarber Platform Engineering
 * @since 1.0
 */
@Slf4j
public class PaymentRateLimitService {

    private final CounterStore counterStore;
    private final PaymentActivityLedger ledger;
    private final ViolationClassifier classifier;
    private final CooldownTracker cooldownTracker;
    private final AuditRecorder auditRecorder;
    private final WindowRateLimiter windowRateLimiter;
    private final TierResolver tierResolver;
    private final RateLimitMetrics metrics;
    private final Clock clock;
    private final RateLimitProperties.Payment policy;
    private final FailurePolicy failurePolicy;
    private final String keyPrefix;

    public PaymentRateLimitService(CounterStore counterStore, PaymentActivityLedger ledger,
                                   ViolationClassifier classifier, CooldownTracker cooldownTracker,
                                   AuditRecorder auditRecorder, WindowRateLimiter windowRateLimiter,
                                   TierResolver tierResolver, RateLimitMetrics metrics, Clock clock,
                                   RateLimitProperties properties) {
        this.counterStore = counterStore;
        this.ledger = ledger;
        this.classifier = classifier;
        this.cooldownTracker = cooldownTracker;
        this.auditRecorder = auditRecorder;
        this.windowRateLimiter = windowRateLimiter;
        this.tierResolver = tierResolver;
        this.metrics = metrics;
        this.clock = clock;
        this.policy = properties.getPayment();
        this.failurePolicy = properties.getFailurePolicy().getPayment();
        this.keyPrefix = properties.getKeyPrefix();
    }

    public Mono<PaymentDecision> checkPaymentIntentRateLimit(Identity identity, BigDecimal amount,
                                                             PaymentMethodInfo paymentMethod, String country) {
        return tierResolver.getTier(identity)
                .flatMap(tier -> checkPaymentIntentRateLimit(identity, tier, amount, paymentMethod, country, null));
    }

    public Mono<PaymentDecision> checkPaymentIntentRateLimit(Identity identity, Tier tier, BigDecimal amount,
                                                             PaymentMethodInfo paymentMethod, String country,
                                                             String endpoint) {
        Instant now = clock.instant();
        PaymentMethodInfo method = paymentMethod != null ? paymentMethod : PaymentMethodInfo.unknown();
        PaymentAttempt attempt = new PaymentAttempt(identity, tier, amount, method.fingerprint(), country, now);

        return loadActivity(identity, attempt.paymentMethodFingerprint())
                .flatMap(loaded -> {
                    if (loaded.isEmpty()) {
                        return Mono.just(degraded(identity, "payment_intent"));
                    }
                    RecentPaymentActivity recent = loaded.get();
                    Optional<Violation> violation = classifier.classify(attempt, recent);
                    if (violation.isPresent()) {
                        return onViolation(violation.get(), amount, endpoint,
                                retryAfterSeconds(violation.get(), recent, now));
                    }
                    return reserve(attempt, endpoint);
                })
                .onErrorResume(e -> {
                    log.error("PAYMENT_CHECK_ERROR: subject={}, error={}", identity.subjectKey(), e.getMessage(), e);
                    return Mono.just(degraded(identity, "payment_intent"));
                });
    }

    public Mono<PaymentDecision> checkPaymentConfirmationRateLimit(Identity identity, String paymentIntentId) {
        return checkPaymentConfirmationRateLimit(identity, paymentIntentId, null);
    }

    public Mono<PaymentDecision> checkPaymentConfirmationRateLimit(Identity identity, String paymentIntentId,
                                                                   String endpoint) {
        Instant now = clock.instant();
        Instant nextMinute = now.truncatedTo(ChronoUnit.MINUTES).plus(1, ChronoUnit.MINUTES);
        List<CounterSpec> counters = List.of(
                new CounterSpec(keyPrefix + ":pay:confirm:" + identity.subjectKey() + ":" + now.getEpochSecond() / 60,
                        policy.getConfirmationsPerMinute(), Duration.between(now, nextMinute).plusSeconds(1)),
                new CounterSpec(keyPrefix + ":pay:confirm:intent:" + paymentIntentId,
                        policy.getMaxConfirmationsPerIntent(), policy.getLedgerRetention()));

        return blockedUntil(identity)
                .flatMap(blocked -> {
                    if (blocked.isEmpty()) {
                        return Mono.just(degraded(identity, "payment_confirmation"));
                    }
                    if (blocked.get().isPresent() && now.isBefore(blocked.get().get())) {
                        Instant until = blocked.get().get();
                        Violation violation = Violation.of(ViolationType.PATTERN_SUSPICIOUS, identity,
                                "Temporarily blocked due to suspicious activity",
                                Map.<String, Object>of("rule", "blocked", "blocked_until", until.toString()), now);
                        return Mono.just(deny(violation, null, endpoint,
                                Math.max(1L, Duration.between(now, until).toSeconds())));
                    }
                    return counterStore.incrementAllIfBelow(counters)
                            .map(result -> confirmationDecision(identity, paymentIntentId, endpoint, now,
                                    nextMinute, result));
                })
                .onErrorResume(e -> {
                    log.error("PAYMENT_CONFIRMATION_CHECK_ERROR: subject={}, intent={}, error={}",
                            identity.subjectKey(), paymentIntentId, e.getMessage(), e);
                    return Mono.just(degraded(identity, "payment_confirmation"));
                });
    }

    /**
     * Records the outcome of a payment. A pending result is not recorded.
     *
     * @return the identity's current failure streak (zero after a success)
     */
    public Mono<Long> recordPaymentResult(Identity identity, BigDecimal amount, PaymentResultStatus status,
                                          String failureReason) {
        Instant now = clock.instant();
        if (status == PaymentResultStatus.PENDING) {
            log.debug("Payment result pending for subject={}; ledger unchanged", identity.subjectKey());
            return ledger.recent(identity)
                    .map(recent -> ViolationClassifier.failureStreak(recent.orElse(List.of()), now,
                            policy.getFailureWindow()));
        }
        PaymentActivity.Kind kind = status == PaymentResultStatus.SUCCEEDED
                ? PaymentActivity.Kind.SUCCEEDED
                : PaymentActivity.Kind.FAILED;
        PaymentActivity entry = new PaymentActivity(now, kind, amount, null, null,
                status == PaymentResultStatus.FAILED ? failureReason : null);

        return ledger.append(identity, entry)
                .flatMap(appended -> {
                    if (!appended.isAvailable()) {
                        log.warn("PAYMENT_RESULT_NOT_RECORDED: subject={}, status={}, failure={}",
                                identity.subjectKey(), status, appended.getFailure());
                        metrics.recordFailOpen("payment_result");
                        return Mono.just(0L);
                    }
                    if (status == PaymentResultStatus.SUCCEEDED) {
                        return counterStore.delete(blockKey(identity))
                                .doOnNext(deleted -> {
                                    if (deleted.orElse(false)) {
                                        log.info("PAYMENT_BLOCK_CLEARED: subject={}", identity.subjectKey());
                                    }
                                })
                                .thenReturn(0L);
                    }
                    return onPaymentFailure(identity, amount, failureReason, now);
                });
    }

    public Mono<RateLimitStatus> getRateLimitStatus(Identity identity) {
        return tierResolver.getTier(identity)
                .flatMap(tier -> Mono.zip(windowRateLimiter.peek(identity, tier), ledger.recent(identity),
                                blockedUntil(identity))
                        .map(tuple -> toStatus(identity, tier, tuple.getT1(), tuple.getT2(), tuple.getT3())));
    }

    private Mono<Optional<RecentPaymentActivity>> loadActivity(Identity identity, String fingerprint) {
        return Mono.zip(
                        ledger.recent(identity),
                        blockedUntil(identity),
                        counterStore.addToSet(methodIdentitiesKey(fingerprint), identity.subjectKey(),
                                policy.getMethodWindow()),
                        counterStore.get(methodTransactionsKey(fingerprint)))
                .map(tuple -> {
                    if (!tuple.getT1().isAvailable() || tuple.getT2().isEmpty()
                            || !tuple.getT3().isAvailable() || !tuple.getT4().isAvailable()) {
                        return Optional.empty();
                    }
                    return Optional.of(new RecentPaymentActivity(tuple.getT1().getValue(),
                            tuple.getT2().get().orElse(null), tuple.getT3().getValue(), tuple.getT4().getValue()));
                });
    }

    /**
     * Outer empty: the store could not answer. Inner empty: no block on record.
     */
    private Mono<Optional<Optional<Instant>>> blockedUntil(Identity identity) {
        return counterStore.getValue(blockKey(identity))
                .map(result -> {
                    if (!result.isAvailable()) {
                        return Optional.empty();
                    }
                    return Optional.of(result.getValue().flatMap(PaymentRateLimitService::parseInstant));
                });
    }

    /**
     * Counts the attempt and its amount against every attempt and amount bucket in one atomic
     * store call. Concurrent attempts that all passed classification on the same ledger snapshot
     * cannot overshoot a limit together, because only the ones that fit are counted.
     */
    private Mono<PaymentDecision> reserve(PaymentAttempt attempt, String endpoint) {
        List<Reservation> reservations = reservationsFor(attempt);
        List<CounterSpec> counters = reservations.stream().map(Reservation::counter).toList();
        return counterStore.incrementAllIfBelow(counters)
                .flatMap(result -> {
                    if (!result.isAvailable()) {
                        return Mono.just(degraded(attempt.identity(), "payment_intent"));
                    }
                    CounterOutcome outcome = result.getValue();
                    if (outcome.allowed()) {
                        return onAllowed(attempt);
                    }
                    Reservation denied = reservations.get(outcome.deniedIndex());
                    Violation violation = denied.toViolation(attempt, outcome.count(outcome.deniedIndex()));
                    long retryAfter = Math.max(1L, Duration.between(attempt.timestamp(), denied.resetAt()).toSeconds());
                    return onViolation(violation, attempt.amount(), endpoint, retryAfter);
                });
    }

    private List<Reservation> reservationsFor(PaymentAttempt attempt) {
        Instant now = attempt.timestamp();
        String subject = attempt.identity().subjectKey();
        RateLimitProperties.AmountCeiling ceiling = classifier.ceilingFor(attempt.tier().name());
        long cents = Math.max(1L, toCents(attempt.amount(), RoundingMode.CEILING));

        List<Reservation> reservations = new ArrayList<>(6);
        reservations.add(attempts(subject, "window", policy.getFrequencyWindow(), policy.getMaxAttemptsPerWindow(), now));
        reservations.add(attempts(subject, "hour", Duration.ofHours(1), policy.getMaxAttemptsPerHour(), now));
        reservations.add(attempts(subject, "day", Duration.ofDays(1), policy.getMaxAttemptsPerDay(), now));
        reservations.add(amount(subject, "window", policy.getAmountWindow(), ceiling.getRolling(), cents, now));
        reservations.add(amount(subject, "hour", Duration.ofHours(1), ceiling.getHourly(), cents, now));
        reservations.add(amount(subject, "day", Duration.ofDays(1), ceiling.getDaily(), cents, now));
        return reservations;
    }

    private Reservation attempts(String subject, String bucket, Duration length, long limit, Instant now) {
        long index = now.getEpochSecond() / length.toSeconds();
        Instant resetAt = Instant.ofEpochSecond((index + 1) * length.toSeconds());
        CounterSpec counter = new CounterSpec(keyPrefix + ":pay:attempts:" + subject + ":" + bucket + ":" + index,
                limit, Duration.between(now, resetAt).plusSeconds(1));
        return new Reservation(counter, ViolationType.FREQUENCY_EXCEEDED, "attempts_per_" + bucket, length, resetAt);
    }

    private Reservation amount(String subject, String bucket, Duration length, BigDecimal ceiling, long cents,
                               Instant now) {
        long index = now.getEpochSecond() / length.toSeconds();
        Instant resetAt = Instant.ofEpochSecond((index + 1) * length.toSeconds());
        CounterSpec counter = new CounterSpec(keyPrefix + ":pay:amount:" + subject + ":" + bucket + ":" + index,
                toCents(ceiling, RoundingMode.FLOOR), Duration.between(now, resetAt).plusSeconds(1), cents);
        return new Reservation(counter, ViolationType.AMOUNT_EXCEEDED, "amount_per_" + bucket, length, resetAt);
    }

    private static long toCents(BigDecimal amount, RoundingMode rounding) {
        return amount.movePointRight(2).setScale(0, rounding).longValue();
    }

    private Mono<PaymentDecision> onViolation(Violation violation, BigDecimal amount, String endpoint,
                                              long retryAfter) {
        Instant now = violation.timestamp();
        PaymentDecision decision = deny(violation, amount, endpoint, retryAfter);

        Mono<?> sideEffects = Mono.empty();
        if (ViolationClassifier.RULE_FAILURE_THRESHOLD.equals(violation.rule())) {
            Instant until = now.plus(policy.getFailureBlockDuration());
            sideEffects = counterStore.setValue(blockKey(violation.identity()), String.valueOf(until.toEpochMilli()),
                            policy.getFailureBlockDuration())
                    .doOnNext(stored -> log.warn("PAYMENT_BLOCK_APPLIED: subject={}, until={}, stored={}",
                            violation.identity().subjectKey(), until, stored.isAvailable()));
        }
        if (violation.type().isAlerting()) {
            Map<String, Object> details = new LinkedHashMap<>(violation.context());
            details.put("violation_type", violation.type().code());
            details.put("ip_address", violation.identity().ipAddress());
            if (amount != null) {
                details.put("amount", amount);
            }
            SecurityAlert alert = new SecurityAlert("payment_security_violation", Severity.HIGH,
                    violation.identity().subjectKey(), "Payment security violation: " + violation.message(),
                    details, now);
            sideEffects = sideEffects.then(alertIfDue(TriggerType.CRITICAL_SECURITY, alert));
        }
        return sideEffects.thenReturn(decision);
    }

    private PaymentDecision deny(Violation violation, BigDecimal amount, String endpoint, long retryAfter) {
        metrics.recordViolation(violation.type().code());
        log.warn("PAYMENT_VIOLATION: subject={}, type={}, rule={}, message={}",
                violation.identity().subjectKey(), violation.type().code(), violation.rule(), violation.message());
        auditRecorder.recordViolation(ViolationEvent.from(violation, amount, endpoint));
        return PaymentDecision.deny(violation, retryAfter);
    }

    private Mono<PaymentDecision> onAllowed(PaymentAttempt attempt) {
        return ledger.append(attempt.identity(), PaymentActivity.attempt(attempt))
                .then(counterStore.increment(methodTransactionsKey(attempt.paymentMethodFingerprint()), 1,
                        policy.getMethodWindow()))
                .map(counted -> {
                    if (!counted.isAvailable()) {
                        log.debug("Payment attempt not fully recorded for subject={}: {}",
                                attempt.identity().subjectKey(), counted.getFailure());
                    }
                    return PaymentDecision.allow();
                });
    }

    private PaymentDecision confirmationDecision(Identity identity, String paymentIntentId, String endpoint,
                                                 Instant now, Instant nextMinute, StoreResult<CounterOutcome> result) {
        if (!result.isAvailable()) {
            return degraded(identity, "payment_confirmation");
        }
        CounterOutcome outcome = result.getValue();
        if (outcome.allowed()) {
            return PaymentDecision.allow();
        }
        boolean perMinute = outcome.deniedIndex() == 0;
        Map<String, Object> context = new LinkedHashMap<>();
        context.put("rule", perMinute ? "confirmations_per_minute" : "confirmations_per_intent");
        context.put("payment_intent_id", paymentIntentId);
        context.put("confirmations", outcome.count(outcome.deniedIndex()));
        context.put("limit", perMinute ? policy.getConfirmationsPerMinute() : policy.getMaxConfirmationsPerIntent());
        Violation violation = Violation.of(ViolationType.FREQUENCY_EXCEEDED, identity,
                perMinute
                        ? "Exceeded " + policy.getConfirmationsPerMinute() + " payment confirmations per minute"
                        : "Exceeded " + policy.getMaxConfirmationsPerIntent() + " confirmations for this payment",
                context, now);
        long retryAfter = perMinute
                ? Math.max(1L, Duration.between(now, nextMinute).toSeconds())
                : policy.getLedgerRetention().toSeconds();
        return deny(violation, null, endpoint, retryAfter);
    }

    private Mono<Long> onPaymentFailure(Identity identity, BigDecimal amount, String failureReason, Instant now) {
        return ledger.recent(identity)
                .flatMap(recent -> {
                    long failures = ViolationClassifier.failureStreak(recent.orElse(List.of()), now,
                            policy.getFailureWindow());
                    log.info("PAYMENT_FAILURE_RECORDED: subject={}, failures={}, reason={}",
                            identity.subjectKey(), failures, failureReason);
                    if (failures < Math.max(1, policy.getFailureThreshold() / 2)) {
                        return Mono.just(failures);
                    }
                    Map<String, Object> details = new LinkedHashMap<>();
                    details.put("ip_address", identity.ipAddress());
                    details.put("failure_count", failures);
                    if (amount != null) {
                        details.put("amount", amount);
                    }
                    if (failureReason != null) {
                        details.put("failure_reason", failureReason);
                    }
                    SecurityAlert alert = new SecurityAlert("payment_failure_pattern", Severity.MEDIUM,
                            identity.subjectKey(), "High payment failure rate detected for " + identity.subjectKey(),
                            details, now);
                    return alertIfDue(TriggerType.PAYMENT_CHANGE, alert).thenReturn(failures);
                });
    }

    private Mono<Boolean> alertIfDue(TriggerType trigger, SecurityAlert alert) {
        return cooldownTracker.tryTrigger(trigger, alert.subject())
                .doOnNext(fire -> {
                    if (fire) {
                        auditRecorder.raiseAlert(alert);
                    }
                });
    }

    private PaymentDecision degraded(Identity identity, String check) {
        metrics.recordFailOpen(check);
        if (failurePolicy == FailurePolicy.CLOSED) {
            log.warn("PAYMENT_STORE_UNAVAILABLE: subject={}, check={}, policy=CLOSED - denying",
                    identity.subjectKey(), check);
            return PaymentDecision.failClosed(policy.getFrequencyWindow().toSeconds());
        }
        log.warn("PAYMENT_FAIL_OPEN: subject={}, check={}", identity.subjectKey(), check);
        return PaymentDecision.failOpen();
    }

    private long retryAfterSeconds(Violation violation, RecentPaymentActivity recent, Instant now) {
        Duration retry;
        switch (violation.type()) {
            case FREQUENCY_EXCEEDED:
                retry = policy.getFrequencyWindow();
                break;
            case AMOUNT_EXCEEDED:
                retry = policy.getAmountWindow();
                break;
            case VELOCITY_ANOMALY:
                retry = policy.getVelocityWindow();
                break;
            case PATTERN_SUSPICIOUS:
                if ("blocked".equals(violation.rule()) && recent.blockedUntil() != null) {
                    retry = Duration.between(now, recent.blockedUntil());
                } else if (ViolationClassifier.RULE_FAILURE_THRESHOLD.equals(violation.rule())) {
                    retry = policy.getFailureBlockDuration();
                } else {
                    retry = policy.getPatternWindow();
                }
                break;
            case GEOGRAPHIC_ANOMALY:
                retry = policy.getGeoTravelWindow();
                break;
            default:
                retry = policy.getMethodWindow();
                break;
        }
        return Math.max(1L, retry.toSeconds());
    }

    private RateLimitStatus toStatus(Identity identity, Tier tier, List<WindowDecision> windows,
                                     StoreResult<List<PaymentActivity>> ledgerResult,
                                     Optional<Optional<Instant>> blocked) {
        Instant now = clock.instant();
        List<RateLimitStatus.WindowStatus> windowStatuses = windows.stream()
                .map(w -> new RateLimitStatus.WindowStatus(w.window().code(), w.limit(), w.currentUsage(),
                        w.remaining(), w.resetTime()))
                .toList();

        RecentPaymentActivity recent = RecentPaymentActivity.of(ledgerResult.orElse(List.of()));
        List<PaymentActivity> frequency = ViolationClassifier.attemptsWithin(recent, now, policy.getFrequencyWindow());
        BigDecimal rolling = ViolationClassifier.attemptsWithin(recent, now, policy.getAmountWindow()).stream()
                .map(PaymentActivity::amount)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
        RateLimitProperties.AmountCeiling ceiling = classifier.ceilingFor(tier.name());
        Instant blockedUntil = blocked.flatMap(inner -> inner).filter(now::isBefore).orElse(null);

        RateLimitStatus.PaymentStatus payments = new RateLimitStatus.PaymentStatus(
                frequency.size(), policy.getMaxAttemptsPerWindow(),
                rolling, ceiling.getRolling(), ceiling.getSingleTransaction(),
                ViolationClassifier.failureStreak(recent.entries(), now, policy.getFailureWindow()),
                policy.getFailureThreshold(), blockedUntil);

        boolean storeAvailable = ledgerResult.isAvailable() && blocked.isPresent()
                && windows.stream().noneMatch(WindowDecision::degraded);
        return new RateLimitStatus(identity.subjectKey(), tier.label(), windowStatuses, payments, storeAvailable);
    }

    private String blockKey(Identity identity) {
        return keyPrefix + ":pay:block:" + identity.subjectKey();
    }

    private String methodIdentitiesKey(String fingerprint) {
        return keyPrefix + ":pay:method:" + fingerprint + ":identities";
    }

    private String methodTransactionsKey(String fingerprint) {
        return keyPrefix + ":pay:method:" + fingerprint + ":transactions";
    }

    /**
     * One attempt or amount bucket taking part in {@link #reserve}. Amount counters hold cents.
     */
    private record Reservation(CounterSpec counter, ViolationType type, String rule, Duration length,
                               Instant resetAt) {

        Violation toViolation(PaymentAttempt attempt, long current) {
            boolean amount = type == ViolationType.AMOUNT_EXCEEDED;
            Map<String, Object> context = new LinkedHashMap<>();
            context.put("rule", rule);
            if (amount) {
                context.put("amount", attempt.amount());
                context.put("window_amount", BigDecimal.valueOf(current, 2));
                context.put("limit", BigDecimal.valueOf(counter.limit(), 2));
            } else {
                context.put("attempts", current);
                context.put("limit", counter.limit());
            }
            context.put("window_seconds", length.toSeconds());
            context.put("reset_at", resetAt.toString());
            String message = amount
                    ? "Exceeded " + BigDecimal.valueOf(counter.limit(), 2).toPlainString() + " per "
                            + length.toSeconds() + " seconds"
                    : "Exceeded " + counter.limit() + " payment attempts per " + length.toSeconds() + " seconds";
            return Violation.of(type, attempt.identity(), message, context, attempt.timestamp());
        }
    }

    private static Optional<Instant> parseInstant(String epochMillis) {
        try {
            return Optional.of(Instant.ofEpochMilli(Long.parseLong(epochMillis)));
        } catch (NumberFormatException e) {
            log.warn("PAYMENT_BLOCK_ENTRY_INVALID: value={}", epochMillis);
            return Optional.empty();
        }
    }
}
