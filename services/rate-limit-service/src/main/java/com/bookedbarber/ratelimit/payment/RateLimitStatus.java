package com.bookedbarber.ratelimit.payment;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

/**
 * Snapshot of an identity's current usage against its limits, for support and monitoring.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record RateLimitStatus(@JsonProperty("subject") String subject,
                              @JsonProperty("tier") String tier,
                              @JsonProperty("windows") List<WindowStatus> windows,
                              @JsonProperty("payments") PaymentStatus payments,
                              @JsonProperty("store_available") boolean storeAvailable) {

    public record WindowStatus(@JsonProperty("window") String window,
                               @JsonProperty("limit") long limit,
                               @JsonProperty("current_usage") long currentUsage,
                               @JsonProperty("remaining") long remaining,
                               @JsonProperty("reset_time") Instant resetTime) {
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record PaymentStatus(@JsonProperty("attempts_in_window") long attemptsInWindow,
                                @JsonProperty("max_attempts_per_window") int maxAttemptsPerWindow,
                                @JsonProperty("rolling_amount") BigDecimal rollingAmount,
                                @JsonProperty("rolling_amount_limit") BigDecimal rollingAmountLimit,
                                @JsonProperty("single_transaction_limit") BigDecimal singleTransactionLimit,
                                @JsonProperty("recent_failures") long recentFailures,
                                @JsonProperty("failure_threshold") int failureThreshold,
                                @JsonProperty("blocked_until") Instant blockedUntil) {
    }
}
