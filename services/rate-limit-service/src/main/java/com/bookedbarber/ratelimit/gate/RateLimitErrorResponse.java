package com.bookedbarber.ratelimit.gate;

import com.bookedbarber.ratelimit.payment.ViolationType;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.springframework.http.HttpStatus;

import java.time.Instant;

/**
 * Body of every 429, 413 and 403 produced by the limiter.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record RateLimitErrorResponse(@JsonProperty("error") String error,
                                     @JsonProperty("message") String message,
                                     @JsonProperty("details") Details details) {

    public static final String RATE_LIMIT_EXCEEDED = "rate_limit_exceeded";
    public static final String PAYMENT_REVIEW_REQUIRED = "payment_review_required";
    public static final String PAYLOAD_TOO_LARGE = "payload_too_large";

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record Details(@JsonProperty("limit") long limit,
                          @JsonProperty("window_seconds") long windowSeconds,
                          @JsonProperty("current_usage") long currentUsage,
                          @JsonProperty("reset_time") Instant resetTime,
                          @JsonProperty("tier") String tier,
                          @JsonProperty("retry_after") long retryAfter,
                          @JsonProperty("violation_type") String violationType) {
    }

    public static RateLimitErrorResponse of(HttpStatus status, String message, Details details) {
        return new RateLimitErrorResponse(errorCode(status), message, details);
    }

    public static String errorCode(HttpStatus status) {
        if (status == HttpStatus.FORBIDDEN) {
            return PAYMENT_REVIEW_REQUIRED;
        }
        return status == HttpStatus.PAYLOAD_TOO_LARGE ? PAYLOAD_TOO_LARGE : RATE_LIMIT_EXCEEDED;
    }

    public static String errorCode(ViolationType type) {
        return errorCode(type.getStatus());
    }
}
