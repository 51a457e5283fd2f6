package com.bookedbarber.ratelimit.window;

import com.bookedbarber.ratelimit.config.FailurePolicy;
import com.bookedbarber.ratelimit.identity.Identity;
import com.bookedbarber.ratelimit.metrics.RateLimitMetrics;
import com.bookedbarber.ratelimit.store.CounterOutcome;
import com.bookedbarber.ratelimit.store.CounterSpec;
import com.bookedbarber.ratelimit.store.CounterStore;
import com.bookedbarber.ratelimit.store.StoreFailure;
import com.bookedbarber.ratelimit.store.StoreResult;
import com.bookedbarber.ratelimit.tier.Tier;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

/**
 * Hourly and daily fixed-window request counting.
 *
 * Both windows are checked and incremented by a single atomic store call, hourly first.
 * A denied request increments nothing. When the store cannot answer, the configured
 * {@link FailurePolicy} decides; failing open reports the fail-open limit to the client.
 *
 * @author BookedBarber Platform Engineering
 * @since 1.0
 */
@Slf4j
public class WindowRateLimiter {

    private static final List<WindowType> WINDOWS = List.of(WindowType.HOURLY, WindowType.DAILY);

    private final CounterStore counterStore;
    private final Clock clock;
    private final String keyPrefix;
    private final long failOpenLimit;
    private final RateLimitMetrics metrics;

    public WindowRateLimiter(CounterStore counterStore, Clock clock, String keyPrefix,
                             long failOpenLimit, RateLimitMetrics metrics) {
        this.counterStore = counterStore;
        this.clock = clock;
        this.keyPrefix = keyPrefix;
        this.failOpenLimit = failOpenLimit;
        this.metrics = metrics;
    }

    public Mono<WindowDecision> checkAndIncrement(Identity identity, Tier tier) {
        return checkAndIncrement(identity, tier, FailurePolicy.OPEN);
    }

    public Mono<WindowDecision> checkAndIncrement(Identity identity, Tier tier, FailurePolicy failurePolicy) {
        Instant now = clock.instant();
        List<CounterSpec> counters = WINDOWS.stream()
                .map(window -> new CounterSpec(key(window, identity, now), limitOf(tier, window), window.untilReset(now)))
                .toList();

        return counterStore.incrementAllIfBelow(counters)
                .onErrorResume(e -> Mono.just(StoreResult.<CounterOutcome>unavailable(
                        StoreFailure.ERROR, e.getMessage())))
                .map(result -> {
                    if (!result.isAvailable()) {
                        return degraded(identity, tier, now, failurePolicy, result);
                    }
                    return decide(identity, tier, now, result.getValue());
                });
    }

    /**
     * Current usage in both windows without counting a request.
     */
    public Mono<List<WindowDecision>> peek(Identity identity, Tier tier) {
        Instant now = clock.instant();
        return Flux.fromIterable(WINDOWS)
                .concatMap(window -> counterStore.get(key(window, identity, now))
                        .map(result -> {
                            long used = result.orElse(0L);
                            long limit = limitOf(tier, window);
                            return new WindowDecision(used < limit, used, limit, window.nextBoundary(now),
                                    window, tier, !result.isAvailable());
                        }))
                .collectList();
    }

    String key(WindowType window, Identity identity, Instant now) {
        return keyPrefix + ":" + window.code() + ":" + identity.subjectKey() + ":" + window.bucketSuffix(now);
    }

    private WindowDecision decide(Identity identity, Tier tier, Instant now, CounterOutcome outcome) {
        if (!outcome.allowed()) {
            WindowType window = WINDOWS.get(outcome.deniedIndex());
            long usage = outcome.count(outcome.deniedIndex());
            log.info("RATE_LIMIT_DENIED: subject={}, tier={}, window={}, usage={}, limit={}",
                    identity.subjectKey(), tier.label(), window.code(), usage, limitOf(tier, window));
            return new WindowDecision(false, usage, limitOf(tier, window), window.nextBoundary(now),
                    window, tier, false);
        }

        int binding = 0;
        long fewestRemaining = Long.MAX_VALUE;
        for (int i = 0; i < WINDOWS.size(); i++) {
            long remaining = limitOf(tier, WINDOWS.get(i)) - outcome.count(i);
            if (remaining < fewestRemaining) {
                fewestRemaining = remaining;
                binding = i;
            }
        }
        WindowType window = WINDOWS.get(binding);
        return new WindowDecision(true, outcome.count(binding), limitOf(tier, window),
                window.nextBoundary(now), window, tier, false);
    }

    private WindowDecision degraded(Identity identity, Tier tier, Instant now,
                                    FailurePolicy failurePolicy, StoreResult<?> result) {
        metrics.recordFailOpen("window");
        if (failurePolicy == FailurePolicy.CLOSED) {
            log.warn("RATE_LIMIT_STORE_UNAVAILABLE: subject={}, failure={}, policy=CLOSED - denying",
                    identity.subjectKey(), result.getFailure());
            long limit = tier.hourlyLimit();
            return new WindowDecision(false, limit, limit, WindowType.HOURLY.nextBoundary(now),
                    WindowType.HOURLY, tier, true);
        }
        log.warn("RATE_LIMIT_FAIL_OPEN: subject={}, failure={}, detail={}",
                identity.subjectKey(), result.getFailure(), result.getDetail());
        return new WindowDecision(true, 0L, failOpenLimit, WindowType.HOURLY.nextBoundary(now),
                WindowType.HOURLY, tier, true);
    }

    private static long limitOf(Tier tier, WindowType window) {
        return window == WindowType.HOURLY ? tier.hourlyLimit() : tier.dailyLimit();
    }
}
