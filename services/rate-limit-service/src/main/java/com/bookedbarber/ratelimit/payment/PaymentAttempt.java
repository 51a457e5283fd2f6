package com.bookedbarber.ratelimit.payment;

import com.bookedbarber.ratelimit.identity.Identity;
import com.bookedbarber.ratelimit.tier.Tier;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * A payment intent under evaluation.
 *
 * @param country ISO country of the request, {@code null} when the edge could not locate it
 */
public record PaymentAttempt(Identity identity,
                             Tier tier,
                             BigDecimal amount,
                             String paymentMethodFingerprint,
                             String country,
                             Instant timestamp) {
}
