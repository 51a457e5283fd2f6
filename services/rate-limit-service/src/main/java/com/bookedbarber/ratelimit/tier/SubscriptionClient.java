package com.bookedbarber.ratelimit.tier;

import com.bookedbarber.ratelimit.identity.Identity;
import reactor.core.publisher.Mono;

/**
 * Billing/subscription collaborator that knows which tier an identity pays for.
 */
public interface SubscriptionClient {

    /**
     * Tier membership of the identity, or empty when billing has no record of it.
     */
    Mono<TierName> findTier(Identity identity);
}
