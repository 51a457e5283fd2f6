package com.bookedbarber.ratelimit.payment;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * One entry of an identity's recent payment ledger.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record PaymentActivity(Instant timestamp,
                              Kind kind,
                              BigDecimal amount,
                              String paymentMethodFingerprint,
                              String country,
                              String failureReason) {

    public enum Kind {
        ATTEMPT,
        SUCCEEDED,
        FAILED
    }

    public static PaymentActivity attempt(PaymentAttempt attempt) {
        return new PaymentActivity(attempt.timestamp(), Kind.ATTEMPT, attempt.amount(),
                attempt.paymentMethodFingerprint(), attempt.country(), null);
    }

    public boolean isAttempt() {
        return kind == Kind.ATTEMPT;
    }
}
