package com.bookedbarber.ratelimit.tier;

/**
 * Named quota profile.
 */
public record Tier(TierName name, long hourlyLimit, long dailyLimit) {

    public String label() {
        return name.label();
    }
}
