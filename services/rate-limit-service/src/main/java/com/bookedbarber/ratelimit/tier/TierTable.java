package com.bookedbarber.ratelimit.tier;

import com.bookedbarber.ratelimit.config.RateLimitProperties;
import com.bookedbarber.ratelimit.exception.RateLimitConfigurationException;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Immutable tier lookup table, validated when built.
 */
public final class TierTable {

    private final Map<TierName, Tier> tiers;

    private TierTable(Map<TierName, Tier> tiers) {
        this.tiers = Collections.unmodifiableMap(tiers);
    }

    public static TierTable from(Map<TierName, RateLimitProperties.TierLimits> limits) {
        Map<TierName, Tier> tiers = new EnumMap<>(TierName.class);
        for (TierName name : TierName.values()) {
            RateLimitProperties.TierLimits tierLimits = limits.get(name);
            if (tierLimits == null) {
                throw new RateLimitConfigurationException("No limits configured for tier " + name.label());
            }
            if (tierLimits.getHourlyLimit() <= 0 || tierLimits.getDailyLimit() <= 0) {
                throw new RateLimitConfigurationException("Tier " + name.label() + " limits must be positive");
            }
            if (tierLimits.getHourlyLimit() > tierLimits.getDailyLimit()) {
                throw new RateLimitConfigurationException("Tier " + name.label()
                        + " hourly limit " + tierLimits.getHourlyLimit()
                        + " exceeds daily limit " + tierLimits.getDailyLimit());
            }
            tiers.put(name, new Tier(name, tierLimits.getHourlyLimit(), tierLimits.getDailyLimit()));
        }
        return new TierTable(tiers);
    }

    public Tier get(TierName name) {
        return tiers.get(name);
    }

    public Tier lowest() {
        return tiers.get(TierName.FREE);
    }

    public Map<TierName, Tier> asMap() {
        return tiers;
    }
}
