package com.bookedbarber.ratelimit.payment;

import com.bookedbarber.ratelimit.config.RateLimitProperties;
import com.bookedbarber.ratelimit.exception.RateLimitConfigurationException;
import com.bookedbarber.ratelimit.tier.TierName;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Payment Violation Classifier
 *
 * Evaluates a payment attempt against the identity's recent activity and returns at most one
 * violation. Signals are evaluated in a fixed order and the first match wins:
 * <ol>
 *   <li>Frequency: attempts in the frequency window</li>
 *   <li>Amount: single-transaction and rolling ceilings of the tier</li>
 *   <li>Velocity: burst rate against baseline, amount escalation, amount outliers</li>
 *   <li>Pattern: active block, failure streak, payment-method cycling, amount probing</li>
 *   <li>Geography: unseen country shortly after activity elsewhere</li>
 *   <li>Payment-method reuse across identities or beyond a daily count</li>
 * </ol>
 *
 * Pure and synchronous: all state comes in through {@link RecentPaymentActivity}.
 *
 * @author BookedBarber Platform Engineering
 * @since 1.0
 */
public class ViolationClassifier {

    public static final String RULE_FAILURE_THRESHOLD = "failure_threshold";

    private final RateLimitProperties.Payment policy;

    public ViolationClassifier(RateLimitProperties.Payment policy) {
        validateCeilings(policy.getAmountCeilings());
        this.policy = policy;
    }

    private static void validateCeilings(Map<TierName, RateLimitProperties.AmountCeiling> ceilings) {
        for (TierName name : TierName.values()) {
            RateLimitProperties.AmountCeiling ceiling = ceilings.get(name);
            if (ceiling == null) {
                throw new RateLimitConfigurationException("No amount ceilings configured for tier " + name.label());
            }
            BigDecimal single = ceiling.getSingleTransaction();
            for (BigDecimal limit : new BigDecimal[]{single, ceiling.getRolling(), ceiling.getHourly(),
                    ceiling.getDaily()}) {
                if (limit == null || limit.signum() <= 0) {
                    throw new RateLimitConfigurationException("Tier " + name.label()
                            + " amount ceilings must all be set and positive");
                }
            }
            if (single.compareTo(ceiling.getRolling()) > 0 || single.compareTo(ceiling.getHourly()) > 0
                    || single.compareTo(ceiling.getDaily()) > 0) {
                throw new RateLimitConfigurationException("Tier " + name.label()
                        + " single transaction ceiling " + single.toPlainString()
                        + " exceeds one of its window ceilings");
            }
        }
    }

    public Optional<Violation> classify(PaymentAttempt attempt, RecentPaymentActivity recent) {
        return checkFrequency(attempt, recent)
                .or(() -> checkAmount(attempt, recent))
                .or(() -> checkVelocity(attempt, recent))
                .or(() -> checkPattern(attempt, recent))
                .or(() -> checkGeography(attempt, recent))
                .or(() -> checkPaymentMethod(attempt, recent));
    }

    private Optional<Violation> checkFrequency(PaymentAttempt attempt, RecentPaymentActivity recent) {
        long attempts = attemptsWithin(recent, attempt.timestamp(), policy.getFrequencyWindow()).size();
        if (attempts < policy.getMaxAttemptsPerWindow()) {
            return Optional.empty();
        }
        return violation(ViolationType.FREQUENCY_EXCEEDED, attempt,
                "Exceeded " + policy.getMaxAttemptsPerWindow() + " payment attempts per "
                        + policy.getFrequencyWindow().toSeconds() + " seconds",
                context("frequency",
                        "attempts", attempts,
                        "limit", policy.getMaxAttemptsPerWindow(),
                        "window_seconds", policy.getFrequencyWindow().toSeconds()));
    }

    private Optional<Violation> checkAmount(PaymentAttempt attempt, RecentPaymentActivity recent) {
        RateLimitProperties.AmountCeiling ceiling = ceilingFor(attempt.tier().name());
        BigDecimal amount = attempt.amount();

        if (amount.compareTo(ceiling.getSingleTransaction()) > 0) {
            return violation(ViolationType.AMOUNT_EXCEEDED, attempt,
                    "Amount exceeds the " + ceiling.getSingleTransaction().toPlainString() + " per transaction limit",
                    context("single_transaction",
                            "amount", amount,
                            "limit", ceiling.getSingleTransaction()));
        }

        BigDecimal rolling = attemptsWithin(recent, attempt.timestamp(), policy.getAmountWindow()).stream()
                .map(PaymentActivity::amount)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
        if (rolling.add(amount).compareTo(ceiling.getRolling()) > 0) {
            return violation(ViolationType.AMOUNT_EXCEEDED, attempt,
                    "Exceeded " + ceiling.getRolling().toPlainString() + " per "
                            + policy.getAmountWindow().toMinutes() + " minutes",
                    context("rolling_amount",
                            "amount", amount,
                            "rolling_amount", rolling,
                            "limit", ceiling.getRolling(),
                            "window_seconds", policy.getAmountWindow().toSeconds()));
        }
        return Optional.empty();
    }

    private Optional<Violation> checkVelocity(PaymentAttempt attempt, RecentPaymentActivity recent) {
        Instant now = attempt.timestamp();
        Duration window = policy.getVelocityWindow();
        List<PaymentActivity> allAttempts = attemptsWithin(recent, now, policy.getLedgerRetention());

        long burst = attemptsWithin(recent, now, window).size() + 1L;
        long older = allAttempts.stream().filter(a -> !a.timestamp().isAfter(now.minus(window))).count();
        double periods = Math.max(1.0, (double) (policy.getLedgerRetention().toSeconds() - window.toSeconds())
                / window.toSeconds());
        double baseline = older / periods;
        if (burst >= policy.getVelocityMinAttempts() && burst >= policy.getVelocityMultiplier() * baseline) {
            return violation(ViolationType.VELOCITY_ANOMALY, attempt,
                    "Suspicious rapid payment pattern detected",
                    context("burst",
                            "attempts", burst,
                            "baseline", BigDecimal.valueOf(baseline).setScale(2, RoundingMode.HALF_UP),
                            "window_seconds", window.toSeconds()));
        }

        // oldest first from here on
        List<BigDecimal> amounts = new ArrayList<>(allAttempts.stream().map(PaymentActivity::amount).toList());
        Collections.reverse(amounts);

        if (isEscalating(amounts, attempt.amount())) {
            return violation(ViolationType.VELOCITY_ANOMALY, attempt,
                    "Suspicious amount escalation pattern detected",
                    context("escalation",
                            "amount", attempt.amount(),
                            "previous_amount", amounts.get(amounts.size() - 1),
                            "factor", policy.getEscalationFactor()));
        }

        if (amounts.size() >= policy.getVelocityMinSamples()) {
            double mean = amounts.stream().mapToDouble(BigDecimal::doubleValue).average().orElse(0.0);
            double variance = amounts.stream()
                    .mapToDouble(a -> Math.pow(a.doubleValue() - mean, 2))
                    .average().orElse(0.0);
            double stdDev = Math.sqrt(variance);
            if (stdDev > 0.0) {
                double z = (attempt.amount().doubleValue() - mean) / stdDev;
                if (z > policy.getVelocityZScore()) {
                    return violation(ViolationType.VELOCITY_ANOMALY, attempt,
                            "Payment amount is far outside this account's usual range",
                            context("amount_outlier",
                                    "amount", attempt.amount(),
                                    "mean", BigDecimal.valueOf(mean).setScale(2, RoundingMode.HALF_UP),
                                    "z_score", BigDecimal.valueOf(z).setScale(2, RoundingMode.HALF_UP)));
                }
            }
        }
        return Optional.empty();
    }

    private boolean isEscalating(List<BigDecimal> amountsOldestFirst, BigDecimal amount) {
        int chain = policy.getEscalationChain();
        if (amountsOldestFirst.size() < chain) {
            return false;
        }
        BigDecimal factor = BigDecimal.valueOf(policy.getEscalationFactor());
        List<BigDecimal> tail = amountsOldestFirst.subList(amountsOldestFirst.size() - chain, amountsOldestFirst.size());
        for (int i = 1; i < tail.size(); i++) {
            if (tail.get(i).compareTo(tail.get(i - 1).multiply(factor)) < 0) {
                return false;
            }
        }
        return amount.compareTo(tail.get(tail.size() - 1).multiply(factor)) >= 0;
    }

    private Optional<Violation> checkPattern(PaymentAttempt attempt, RecentPaymentActivity recent) {
        Instant now = attempt.timestamp();

        if (recent.isBlocked(now)) {
            return violation(ViolationType.PATTERN_SUSPICIOUS, attempt,
                    "Temporarily blocked due to suspicious activity",
                    context("blocked",
                            "blocked_until", recent.blockedUntil().toString()));
        }

        long failures = failureStreak(recent.entries(), now, policy.getFailureWindow());
        if (failures >= policy.getFailureThreshold()) {
            return violation(ViolationType.PATTERN_SUSPICIOUS, attempt,
                    "Too many failed attempts. Blocked for " + policy.getFailureBlockDuration().toSeconds() + " seconds",
                    context(RULE_FAILURE_THRESHOLD,
                            "failures", failures,
                            "threshold", policy.getFailureThreshold(),
                            "block_seconds", policy.getFailureBlockDuration().toSeconds()));
        }

        List<PaymentActivity> windowed = attemptsWithin(recent, now, policy.getPatternWindow());

        Set<String> methods = windowed.stream()
                .map(PaymentActivity::paymentMethodFingerprint)
                .filter(fingerprint -> fingerprint != null)
                .collect(Collectors.toCollection(HashSet::new));
        methods.add(attempt.paymentMethodFingerprint());
        if (methods.size() >= policy.getMaxDistinctMethods()) {
            return violation(ViolationType.PATTERN_SUSPICIOUS, attempt,
                    "Too many different payment methods in a short period",
                    context("method_cycling",
                            "distinct_methods", methods.size(),
                            "limit", policy.getMaxDistinctMethods()));
        }

        if (isWholeAmount(attempt.amount())) {
            Set<BigDecimal> wholeAmounts = new HashSet<>();
            wholeAmounts.add(attempt.amount().stripTrailingZeros());
            boolean distinct = true;
            for (PaymentActivity activity : windowed) {
                if (isWholeAmount(activity.amount())) {
                    distinct &= wholeAmounts.add(activity.amount().stripTrailingZeros());
                }
            }
            if (distinct && wholeAmounts.size() >= policy.getWholeAmountThreshold()) {
                return violation(ViolationType.PATTERN_SUSPICIOUS, attempt,
                        "Suspicious amount probing pattern detected",
                        context("amount_probing",
                                "whole_amounts", wholeAmounts.size(),
                                "threshold", policy.getWholeAmountThreshold()));
            }
        }
        return Optional.empty();
    }

    private Optional<Violation> checkGeography(PaymentAttempt attempt, RecentPaymentActivity recent) {
        String country = attempt.country();
        if (country == null) {
            return Optional.empty();
        }
        List<PaymentActivity> located = recent.entries().stream()
                .filter(entry -> entry.country() != null)
                .toList();
        if (located.size() < policy.getGeoMinHistory()) {
            return Optional.empty();
        }
        Set<String> known = located.stream().map(PaymentActivity::country).collect(Collectors.toSet());
        if (known.contains(country)) {
            return Optional.empty();
        }
        PaymentActivity last = located.get(0);
        Duration sinceLast = Duration.between(last.timestamp(), attempt.timestamp());
        if (sinceLast.compareTo(policy.getGeoTravelWindow()) >= 0) {
            return Optional.empty();
        }
        return violation(ViolationType.GEOGRAPHIC_ANOMALY, attempt,
                "Payment from an unusual location",
                context("impossible_travel",
                        "country", country,
                        "previous_country", last.country(),
                        "minutes_since_previous", sinceLast.toMinutes()));
    }

    private Optional<Violation> checkPaymentMethod(PaymentAttempt attempt, RecentPaymentActivity recent) {
        if (recent.methodIdentityCount() > policy.getMaxIdentitiesPerMethod()) {
            return violation(ViolationType.PAYMENT_METHOD_ABUSE, attempt,
                    "Payment method used by too many accounts",
                    context("shared_method",
                            "identities", recent.methodIdentityCount(),
                            "limit", policy.getMaxIdentitiesPerMethod()));
        }
        long transactions = recent.methodTransactionCount() + 1;
        if (transactions > policy.getMaxTransactionsPerMethod()) {
            return violation(ViolationType.PAYMENT_METHOD_ABUSE, attempt,
                    "Exceeded " + policy.getMaxTransactionsPerMethod() + " transactions per payment method per day",
                    context("method_transactions",
                            "transactions", transactions,
                            "limit", policy.getMaxTransactionsPerMethod()));
        }
        return Optional.empty();
    }

    /**
     * FAILED entries inside the window that are newer than the most recent success.
     */
    static long failureStreak(List<PaymentActivity> entriesNewestFirst, Instant now, Duration window) {
        Instant cutoff = now.minus(window);
        long failures = 0;
        for (PaymentActivity entry : entriesNewestFirst) {
            if (!entry.timestamp().isAfter(cutoff) || entry.kind() == PaymentActivity.Kind.SUCCEEDED) {
                break;
            }
            if (entry.kind() == PaymentActivity.Kind.FAILED) {
                failures++;
            }
        }
        return failures;
    }

    static List<PaymentActivity> attemptsWithin(RecentPaymentActivity recent, Instant now, Duration window) {
        Instant cutoff = now.minus(window);
        return recent.entries().stream()
                .filter(PaymentActivity::isAttempt)
                .filter(entry -> entry.amount() != null && entry.timestamp().isAfter(cutoff))
                .toList();
    }

    RateLimitProperties.AmountCeiling ceilingFor(TierName tier) {
        return policy.getAmountCeilings().get(tier);
    }

    private static boolean isWholeAmount(BigDecimal amount) {
        return amount != null && amount.signum() > 0 && amount.stripTrailingZeros().scale() <= 0;
    }

    private static Optional<Violation> violation(ViolationType type, PaymentAttempt attempt, String message,
                                                 Map<String, Object> context) {
        return Optional.of(Violation.of(type, attempt.identity(), message, context, attempt.timestamp()));
    }

    private static Map<String, Object> context(String rule, Object... pairs) {
        Map<String, Object> context = new LinkedHashMap<>();
        context.put("rule", rule);
        for (int i = 0; i + 1 < pairs.length; i += 2) {
            context.put((String) pairs[i], pairs[i + 1]);
        }
        return context;
    }
}
