package com.bookedbarber.ratelimit.config;

import com.bookedbarber.ratelimit.cooldown.TriggerType;
import com.bookedbarber.ratelimit.tier.TierName;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.util.unit.DataSize;
import org.springframework.validation.annotation.Validated;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Rate limiting configuration, bound once at startup from {@code bookedbarber.rate-limit.*}.
 *
 * Defaults below are the production policy; every value can be overridden per environment.
 */
@Data
@Validated
@ConfigurationProperties(prefix = "bookedbarber.rate-limit")
public class RateLimitProperties {

    /**
     * Master switch for the request gate.
     */
    private boolean enabled = true;

    /**
     * Counter store backend.
     */
    @NotNull
    private StoreType store = StoreType.REDIS;

    /**
     * Upper bound for a single counter store call.
     */
    @NotNull
    private Duration storeTimeout = Duration.ofMillis(50);

    /**
     * Limit reported to clients when the store cannot be reached and the request fails open.
     */
    @Min(1)
    private long failOpenLimit = 10_000;

    /**
     * Fail startup when the Redis store does not answer a ping.
     */
    private boolean verifyStoreOnStartup = true;

    @NotBlank
    private String keyPrefix = "rl";

    /**
     * Path prefixes gated by the limiter. Anything else passes through untouched.
     */
    @NotEmpty
    private List<String> protectedPaths = new ArrayList<>(List.of("/api/v2/public/", "/api/v2/payments/"));

    /**
     * Ant patterns of payment-intent creation endpoints whose POST body is classified.
     */
    private List<String> paymentIntentPaths = new ArrayList<>(List.of("/api/v2/payments/intents"));

    /**
     * Ant patterns of payment confirmation endpoints; {@code {intentId}} names the intent segment.
     */
    private List<String> paymentConfirmationPaths =
            new ArrayList<>(List.of("/api/v2/payments/intents/{intentId}/confirm"));

    /**
     * Largest payment-intent body the gate buffers for classification; bigger bodies get a 413.
     */
    @NotNull
    private DataSize paymentBodyLimit = DataSize.ofKilobytes(64);

    @Valid
    private FailurePolicies failurePolicy = new FailurePolicies();

    @Valid
    private Map<TierName, TierLimits> tiers = defaultTiers();

    @Valid
    private TierCache tierCache = new TierCache();

    @Valid
    private Identity identity = new Identity();

    @Valid
    private Billing billing = new Billing();

    @Valid
    private Payment payment = new Payment();

    private Map<TriggerType, Integer> cooldowns = defaultCooldowns();

    @Valid
    private Usage usage = new Usage();

    @Valid
    private Audit audit = new Audit();

    @Valid
    private CircuitBreaker circuitBreaker = new CircuitBreaker();

    public enum StoreType {
        REDIS,
        MEMORY
    }

    @Data
    public static class FailurePolicies {
        @NotNull
        private FailurePolicy api = FailurePolicy.OPEN;
        @NotNull
        private FailurePolicy payment = FailurePolicy.OPEN;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class TierLimits {
        @Min(1)
        private long hourlyLimit;
        @Min(1)
        private long dailyLimit;
    }

    @Data
    public static class TierCache {
        @NotNull
        private Duration ttl = Duration.ofMinutes(5);
        @Min(1)
        private long maximumSize = 50_000;
    }

    @Data
    public static class Identity {
        @NotBlank
        private String apiKeyHeader = "X-API-Key";
        @NotBlank
        private String userIdHeader = "X-User-Id";
        @NotBlank
        private String countryHeader = "X-Geo-Country";
        private boolean trustForwardedFor = true;
    }

    @Data
    public static class Billing {
        /**
         * Base URL of the billing service. When empty, tiers come from {@link #subscriptions}.
         */
        private String baseUrl;
        @NotNull
        private Duration timeout = Duration.ofMillis(200);
        /**
         * Static subject-key to tier assignments, e.g. {@code "api:3f2a...": enterprise}.
         */
        private Map<String, TierName> subscriptions = new HashMap<>();
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class AmountCeiling {
        @NotNull
        @DecimalMin("0.01")
        private BigDecimal singleTransaction;
        @NotNull
        @DecimalMin("0.01")
        private BigDecimal rolling;
        @NotNull
        @DecimalMin("0.01")
        private BigDecimal hourly;
        @NotNull
        @DecimalMin("0.01")
        private BigDecimal daily;
    }

    @Data
    public static class Payment {
        @NotNull
        private Duration frequencyWindow = Duration.ofSeconds(60);
        @Min(1)
        private int maxAttemptsPerWindow = 10;
        @Min(1)
        private int maxAttemptsPerHour = 50;
        @Min(1)
        private int maxAttemptsPerDay = 200;

        @NotNull
        private Duration amountWindow = Duration.ofMinutes(10);
        @Valid
        private Map<TierName, AmountCeiling> amountCeilings = defaultAmountCeilings();

        @NotNull
        private Duration velocityWindow = Duration.ofMinutes(5);
        @Min(1)
        private int velocityMinAttempts = 15;
        @DecimalMin("1.0")
        private double velocityMultiplier = 3.0;
        @DecimalMin("0.5")
        private double velocityZScore = 3.0;
        @Min(2)
        private int velocityMinSamples = 5;
        @DecimalMin("1.1")
        private double escalationFactor = 2.0;
        @Min(2)
        private int escalationChain = 3;

        @NotNull
        private Duration failureWindow = Duration.ofHours(1);
        @Min(1)
        private int failureThreshold = 5;
        @NotNull
        private Duration failureBlockDuration = Duration.ofMinutes(5);

        @NotNull
        private Duration patternWindow = Duration.ofMinutes(10);
        @Min(2)
        private int maxDistinctMethods = 4;
        @Min(2)
        private int wholeAmountThreshold = 4;

        @Min(1)
        private int geoMinHistory = 3;
        @NotNull
        private Duration geoTravelWindow = Duration.ofHours(1);

        @NotNull
        private Duration methodWindow = Duration.ofHours(24);
        @Min(1)
        private int maxIdentitiesPerMethod = 3;
        @Min(1)
        private int maxTransactionsPerMethod = 20;

        @Min(1)
        private int confirmationsPerMinute = 5;
        @Min(1)
        private int maxConfirmationsPerIntent = 3;

        @Min(10)
        private int ledgerSize = 50;
        @NotNull
        private Duration ledgerRetention = Duration.ofHours(24);
    }

    @Data
    public static class Usage {
        @Min(1)
        private int recentLimit = 100;
        @NotNull
        private Duration retention = Duration.ofDays(30);
    }

    @Data
    public static class Audit {
        @Min(1)
        private int threads = 4;
        @Min(1)
        private int queueCapacity = 10_000;
    }

    @Data
    public static class CircuitBreaker {
        @DecimalMin("1.0")
        private float failureRateThreshold = 50f;
        @Min(2)
        private int slidingWindowSize = 20;
        @Min(1)
        private int minimumNumberOfCalls = 10;
        @NotNull
        private Duration waitDurationInOpenState = Duration.ofSeconds(10);
    }

    private static Map<TierName, TierLimits> defaultTiers() {
        Map<TierName, TierLimits> tiers = new EnumMap<>(TierName.class);
        tiers.put(TierName.FREE, new TierLimits(100, 1_000));
        tiers.put(TierName.BASIC, new TierLimits(1_000, 10_000));
        tiers.put(TierName.PREMIUM, new TierLimits(5_000, 50_000));
        tiers.put(TierName.ENTERPRISE, new TierLimits(20_000, 200_000));
        return tiers;
    }

    private static Map<TierName, AmountCeiling> defaultAmountCeilings() {
        Map<TierName, AmountCeiling> ceilings = new EnumMap<>(TierName.class);
        ceilings.put(TierName.FREE, ceiling("5000.00", "10000.00", "10000.00", "25000.00"));
        ceilings.put(TierName.BASIC, ceiling("10000.00", "25000.00", "25000.00", "100000.00"));
        ceilings.put(TierName.PREMIUM, ceiling("25000.00", "50000.00", "50000.00", "250000.00"));
        ceilings.put(TierName.ENTERPRISE, ceiling("100000.00", "200000.00", "200000.00", "1000000.00"));
        return ceilings;
    }

    private static AmountCeiling ceiling(String single, String rolling, String hourly, String daily) {
        return new AmountCeiling(new BigDecimal(single), new BigDecimal(rolling), new BigDecimal(hourly),
                new BigDecimal(daily));
    }

    private static Map<TriggerType, Integer> defaultCooldowns() {
        Map<TriggerType, Integer> cooldowns = new EnumMap<>(TriggerType.class);
        for (TriggerType type : TriggerType.values()) {
            cooldowns.put(type, type.getDefaultCooldownMinutes());
        }
        return cooldowns;
    }
}
