package com.bookedbarber.ratelimit.tier;

import com.bookedbarber.ratelimit.identity.Identity;
import reactor.core.publisher.Mono;

import java.util.Map;

/**
 * Subscription lookup from a static subject-key to tier map, used when no billing service URL
 * is configured (local runs, internal partners with contractual tiers).
 */
public class ConfiguredSubscriptionClient implements SubscriptionClient {

    private final Map<String, TierName> assignments;

    public ConfiguredSubscriptionClient(Map<String, TierName> assignments) {
        this.assignments = Map.copyOf(assignments);
    }

    @Override
    public Mono<TierName> findTier(Identity identity) {
        return Mono.justOrEmpty(assignments.get(identity.subjectKey()));
    }
}
