package com.bookedbarber.ratelimit.payment;

import java.time.Instant;
import java.util.List;

/**
 * Everything the classifier knows about an identity's recent payments.
 *
 * @param entries                ledger entries, most recent first
 * @param blockedUntil           end of an active suspicious-activity block, or {@code null}
 * @param methodIdentityCount    distinct identities seen on the attempt's payment method, this one included
 * @param methodTransactionCount allowed attempts already made with the payment method
 */
public record RecentPaymentActivity(List<PaymentActivity> entries,
                                    Instant blockedUntil,
                                    long methodIdentityCount,
                                    long methodTransactionCount) {

    public RecentPaymentActivity {
        entries = List.copyOf(entries);
    }

    public static RecentPaymentActivity empty() {
        return new RecentPaymentActivity(List.of(), null, 0, 0);
    }

    public static RecentPaymentActivity of(List<PaymentActivity> entries) {
        return new RecentPaymentActivity(entries, null, 0, 0);
    }

    public boolean isBlocked(Instant now) {
        return blockedUntil != null && now.isBefore(blockedUntil);
    }
}
