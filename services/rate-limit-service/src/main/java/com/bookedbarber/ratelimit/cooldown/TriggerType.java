package com.bookedbarber.ratelimit.cooldown;

import java.util.Locale;

/**
 * Downstream trigger kinds subject to cooldown suppression, with their default intervals.
 */
public enum TriggerType {
    FILE_CHANGE(15),
    AUTH_CHANGE(5),
    PAYMENT_CHANGE(10),
    CRITICAL_SECURITY(30),
    COMPLIANCE_CHECK(60),
    MANUAL_TRIGGER(0);

    private final int defaultCooldownMinutes;

    TriggerType(int defaultCooldownMinutes) {
        this.defaultCooldownMinutes = defaultCooldownMinutes;
    }

    public int getDefaultCooldownMinutes() {
        return defaultCooldownMinutes;
    }

    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Accepts both {@code payment_change} and {@code PAYMENT_CHANGE}.
     */
    public static TriggerType fromCode(String code) {
        return TriggerType.valueOf(code.trim().toUpperCase(Locale.ROOT).replace('-', '_'));
    }
}
