package com.bookedbarber.ratelimit.payment;

import com.bookedbarber.ratelimit.identity.Identity;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * The single reason a payment request was denied.
 *
 * @param context rule name and the figures that tripped it, for the audit trail and the response body
 */
public record Violation(ViolationType type,
                        Severity severity,
                        Identity identity,
                        String message,
                        Map<String, Object> context,
                        Instant timestamp) {

    public Violation {
        context = Collections.unmodifiableMap(new LinkedHashMap<>(context));
    }

    public static Violation of(ViolationType type, Identity identity, String message,
                               Map<String, Object> context, Instant timestamp) {
        return new Violation(type, type.getSeverity(), identity, message, context, timestamp);
    }

    public String rule() {
        Object rule = context.get("rule");
        return rule == null ? type.code() : rule.toString();
    }
}
