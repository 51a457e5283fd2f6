package com.bookedbarber.ratelimit.payment;

import org.springframework.http.HttpStatus;

import java.util.Locale;

/**
 * Payment abuse categories, declared in classification precedence order.
 *
 * Retryable types are quota overruns answered with 429; the others need manual review and are
 * answered with 403.
 */
public enum ViolationType {
    FREQUENCY_EXCEEDED(HttpStatus.TOO_MANY_REQUESTS, Severity.MEDIUM),
    AMOUNT_EXCEEDED(HttpStatus.TOO_MANY_REQUESTS, Severity.MEDIUM),
    VELOCITY_ANOMALY(HttpStatus.FORBIDDEN, Severity.HIGH),
    PATTERN_SUSPICIOUS(HttpStatus.FORBIDDEN, Severity.HIGH),
    GEOGRAPHIC_ANOMALY(HttpStatus.FORBIDDEN, Severity.MEDIUM),
    PAYMENT_METHOD_ABUSE(HttpStatus.TOO_MANY_REQUESTS, Severity.HIGH);

    private final HttpStatus status;
    private final Severity severity;

    ViolationType(HttpStatus status, Severity severity) {
        this.status = status;
        this.severity = severity;
    }

    public HttpStatus getStatus() {
        return status;
    }

    public Severity getSeverity() {
        return severity;
    }

    public boolean isRetryable() {
        return status == HttpStatus.TOO_MANY_REQUESTS;
    }

    /**
     * Violations that page the security on-call in addition to being audited.
     */
    public boolean isAlerting() {
        return this == VELOCITY_ANOMALY || this == PATTERN_SUSPICIOUS;
    }

    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }
}
