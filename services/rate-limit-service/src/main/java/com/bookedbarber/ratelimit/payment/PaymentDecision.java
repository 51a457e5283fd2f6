package com.bookedbarber.ratelimit.payment;

/**
 * Result of a payment check.
 *
 * @param violation         the reason for a denial; {@code null} when allowed, or when a closed
 *                          failure policy denied because the store could not answer
 * @param retryAfterSeconds when a retry may succeed; zero when allowed
 * @param degraded          the store could not answer and the failure policy decided
 */
public record PaymentDecision(boolean allowed, Violation violation, long retryAfterSeconds, boolean degraded) {

    private static final PaymentDecision ALLOWED = new PaymentDecision(true, null, 0L, false);

    public static PaymentDecision allow() {
        return ALLOWED;
    }

    public static PaymentDecision deny(Violation violation, long retryAfterSeconds) {
        return new PaymentDecision(false, violation, retryAfterSeconds, false);
    }

    public static PaymentDecision failOpen() {
        return new PaymentDecision(true, null, 0L, true);
    }

    public static PaymentDecision failClosed(long retryAfterSeconds) {
        return new PaymentDecision(false, null, retryAfterSeconds, true);
    }
}
