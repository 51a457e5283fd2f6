package com.bookedbarber.ratelimit.tier;

import java.util.Locale;

/**
 * Quota tiers, lowest first.
 */
public enum TierName {
    FREE,
    BASIC,
    PREMIUM,
    ENTERPRISE;

    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static TierName fromLabel(String label) {
        if (label == null || label.isBlank()) {
            return FREE;
        }
        try {
            return TierName.valueOf(label.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return FREE;
        }
    }
}
