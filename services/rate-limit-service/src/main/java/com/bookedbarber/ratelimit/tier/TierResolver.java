package com.bookedbarber.ratelimit.tier;

import com.bookedbarber.ratelimit.identity.Identity;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Ticker;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

import java.time.Duration;

/**
 * Maps an identity to its quota tier.
 *
 * Tiers are cached per subject for a short TTL; a billing downgrade takes effect when the entry
 * expires unless billing calls {@link #evict(String)} first. Unknown identities and billing
 * failures resolve to the lowest tier. Failures are not cached so the next request retries.
 */
@Slf4j
public class TierResolver {

    private final TierTable tierTable;
    private final SubscriptionClient subscriptionClient;
    private final Cache<String, Tier> cache;

    public TierResolver(TierTable tierTable, SubscriptionClient subscriptionClient,
                        Duration ttl, long maximumSize) {
        this(tierTable, subscriptionClient, ttl, maximumSize, Ticker.systemTicker());
    }

    TierResolver(TierTable tierTable, SubscriptionClient subscriptionClient,
                 Duration ttl, long maximumSize, Ticker ticker) {
        this.tierTable = tierTable;
        this.subscriptionClient = subscriptionClient;
        this.cache = Caffeine.newBuilder()
                .maximumSize(maximumSize)
                .expireAfterWrite(ttl)
                .ticker(ticker)
                .build();
    }

    public Mono<Tier> getTier(Identity identity) {
        String subject = identity.subjectKey();
        Tier cached = cache.getIfPresent(subject);
        if (cached != null) {
            return Mono.just(cached);
        }
        if (!identity.isAuthenticated()) {
            // anonymous traffic never has a subscription
            return Mono.just(tierTable.lowest());
        }

        return subscriptionClient.findTier(identity)
                .map(tierTable::get)
                .defaultIfEmpty(tierTable.lowest())
                .doOnNext(tier -> cache.put(subject, tier))
                .onErrorResume(e -> {
                    log.warn("TIER_LOOKUP_FAILED: subject={}, error={} - using {}",
                            subject, e.getMessage(), tierTable.lowest().label());
                    return Mono.just(tierTable.lowest());
                });
    }

    /**
     * Drops the cached tier for a subject, e.g. on a billing change event.
     */
    public void evict(String subjectKey) {
        cache.invalidate(subjectKey);
        log.info("TIER_CACHE_EVICTED: subject={}", subjectKey);
    }

    public TierTable getTierTable() {
        return tierTable;
    }
}
