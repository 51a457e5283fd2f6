package com.bookedbarber.ratelimit.window;

import com.bookedbarber.ratelimit.tier.Tier;

import java.time.Instant;

/**
 * Outcome of a window check.
 *
 * @param allowed      whether the request may proceed
 * @param currentUsage count in the reported window after this request (before it, when denied)
 * @param limit        limit of the reported window
 * @param resetTime    start of the reported window's next bucket
 * @param window       the binding window: the denying one, or the one with fewest remaining requests
 * @param tier         tier the limits came from
 * @param degraded     the counter store could not answer and the failure policy decided
 */
public record WindowDecision(boolean allowed,
                             long currentUsage,
                             long limit,
                             Instant resetTime,
                             WindowType window,
                             Tier tier,
                             boolean degraded) {

    public long remaining() {
        return Math.max(0L, limit - currentUsage);
    }

    public long retryAfterSeconds(Instant now) {
        return Math.max(1L, resetTime.getEpochSecond() - now.getEpochSecond());
    }
}
