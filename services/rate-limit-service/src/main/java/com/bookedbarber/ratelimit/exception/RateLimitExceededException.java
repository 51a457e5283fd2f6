package com.bookedbarber.ratelimit.exception;

import lombok.Getter;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

import java.time.Instant;

/**
 * Exception thrown when a request window limit is exceeded
 */
@Getter
@ResponseStatus(HttpStatus.TOO_MANY_REQUESTS)
public class RateLimitExceededException extends RuntimeException {

    private final long limit;
    private final long currentUsage;
    private final long windowSeconds;
    private final Instant resetTime;
    private final String tier;
    private final long retryAfterSeconds;

    public RateLimitExceededException(String message, long limit, long currentUsage, long windowSeconds,
                                      Instant resetTime, String tier, long retryAfterSeconds) {
        super(message);
        this.limit = limit;
        this.currentUsage = currentUsage;
        this.windowSeconds = windowSeconds;
        this.resetTime = resetTime;
        this.tier = tier;
        this.retryAfterSeconds = retryAfterSeconds;
    }

    public long getRemaining() {
        return Math.max(0L, limit - currentUsage);
    }
}
