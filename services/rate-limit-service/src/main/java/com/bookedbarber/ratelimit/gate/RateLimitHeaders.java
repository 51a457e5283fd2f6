package com.bookedbarber.ratelimit.gate;

import com.bookedbarber.ratelimit.window.WindowDecision;
import org.springframework.http.HttpHeaders;

/**
 * Standard rate limit response headers.
 */
public final class RateLimitHeaders {

    public static final String LIMIT = "X-RateLimit-Limit";
    public static final String REMAINING = "X-RateLimit-Remaining";
    public static final String RESET = "X-RateLimit-Reset";
    public static final String TIER = "X-RateLimit-Tier";

    private RateLimitHeaders() {
    }

    public static void apply(HttpHeaders headers, WindowDecision decision) {
        headers.set(LIMIT, String.valueOf(decision.limit()));
        headers.set(REMAINING, String.valueOf(decision.allowed() ? decision.remaining() : 0L));
        headers.set(RESET, String.valueOf(decision.resetTime().getEpochSecond()));
        headers.set(TIER, decision.tier().label());
    }

    public static void retryAfter(HttpHeaders headers, long seconds) {
        headers.set(HttpHeaders.RETRY_AFTER, String.valueOf(Math.max(1L, seconds)));
    }
}
