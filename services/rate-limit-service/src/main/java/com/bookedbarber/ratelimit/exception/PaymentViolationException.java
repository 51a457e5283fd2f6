package com.bookedbarber.ratelimit.exception;

import com.bookedbarber.ratelimit.payment.Violation;
import lombok.Getter;

/**
 * A payment request was denied by the violation classifier. The HTTP status follows the
 * violation type.
 */
@Getter
public class PaymentViolationException extends RuntimeException {

    private final Violation violation;
    private final String tier;
    private final long retryAfterSeconds;

    public PaymentViolationException(Violation violation, String tier, long retryAfterSeconds) {
        super(violation.message());
        this.violation = violation;
        this.tier = tier;
        this.retryAfterSeconds = retryAfterSeconds;
    }
}
