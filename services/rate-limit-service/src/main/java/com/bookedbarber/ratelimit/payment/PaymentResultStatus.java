package com.bookedbarber.ratelimit.payment;

import java.util.Locale;

/**
 * Outcome of a payment reported back by the payment execution collaborator.
 *
 * {@link #PENDING} is accepted so that collaborators can report every state change, but it
 * leaves the activity ledger and the failure streak untouched.
 */
public enum PaymentResultStatus {
    SUCCEEDED,
    FAILED,
    PENDING;

    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Accepts {@code success}, {@code succeeded}, {@code failed}, {@code failure} and {@code pending} in any case.
     */
    public static PaymentResultStatus fromCode(String code) {
        if (code == null) {
            throw new IllegalArgumentException("Payment status is required");
        }
        switch (code.trim().toLowerCase(Locale.ROOT)) {
            case "success":
            case "succeeded":
                return SUCCEEDED;
            case "failed":
            case "failure":
                return FAILED;
            case "pending":
                return PENDING;
            default:
                throw new IllegalArgumentException("Unknown payment status: " + code);
        }
    }
}
