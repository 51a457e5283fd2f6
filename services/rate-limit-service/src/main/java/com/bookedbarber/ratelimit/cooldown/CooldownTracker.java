package com.bookedbarber.ratelimit.cooldown;

import com.bookedbarber.ratelimit.store.CounterStore;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;

/**
 * Suppresses repeated downstream triggers (alerts, scans, syncs) within a per-type interval.
 *
 * Advisory only: when the store cannot answer, the trigger fires and a warning is logged.
 * Concurrent recorders are last-write-wins. Entries are stored as {@code epochMillis:minutes}.
 *
 * @author BookedBarber Platform Engineering
 * @since 1.0
 */
@Slf4j
public class CooldownTracker {

    private final CounterStore counterStore;
    private final Clock clock;
    private final Map<TriggerType, Integer> cooldowns;
    private final String keyPrefix;

    public CooldownTracker(CounterStore counterStore, Clock clock, Map<TriggerType, Integer> cooldowns,
                           String keyPrefix) {
        this.counterStore = counterStore;
        this.clock = clock;
        this.cooldowns = cooldowns;
        this.keyPrefix = keyPrefix;
    }

    public int cooldownMinutes(TriggerType type) {
        Integer minutes = cooldowns.get(type);
        return minutes != null ? minutes : type.getDefaultCooldownMinutes();
    }

    public Mono<Boolean> shouldTrigger(TriggerType type) {
        return shouldTrigger(type, null);
    }

    /**
     * @param scope optional subject the cooldown applies to, e.g. one identity's alerts
     */
    public Mono<Boolean> shouldTrigger(TriggerType type, String scope) {
        if (cooldownMinutes(type) == 0) {
            return Mono.just(true);
        }
        return lastEntry(type, scope)
                .map(entry -> entry
                        .map(last -> !clock.instant().isBefore(last.availableAt()))
                        .orElse(true))
                .onErrorResume(e -> {
                    log.warn("COOLDOWN_STORE_UNAVAILABLE: trigger={}, scope={}, error={} - allowing trigger",
                            type.code(), scope, e.getMessage());
                    return Mono.just(true);
                });
    }

    public Mono<Boolean> recordTrigger(TriggerType type) {
        return recordTrigger(type, null, cooldownMinutes(type));
    }

    public Mono<Boolean> recordTrigger(TriggerType type, int minutes) {
        return recordTrigger(type, null, minutes);
    }

    public Mono<Boolean> recordTrigger(TriggerType type, String scope, int minutes) {
        Instant now = clock.instant();
        String value = now.toEpochMilli() + ":" + minutes;
        Duration ttl = Duration.ofMinutes(Math.max(1, minutes));
        return counterStore.setValue(key(type, scope), value, ttl)
                .map(result -> {
                    if (!result.isAvailable()) {
                        log.warn("COOLDOWN_NOT_RECORDED: trigger={}, scope={}, failure={}",
                                type.code(), scope, result.getFailure());
                        return false;
                    }
                    log.debug("COOLDOWN_RECORDED: trigger={}, scope={}, minutes={}", type.code(), scope, minutes);
                    return true;
                });
    }

    /**
     * Checks the cooldown and records a new trigger when it has elapsed.
     *
     * @return whether the caller should fire
     */
    public Mono<Boolean> tryTrigger(TriggerType type) {
        return tryTrigger(type, null);
    }

    public Mono<Boolean> tryTrigger(TriggerType type, String scope) {
        return shouldTrigger(type, scope)
                .flatMap(fire -> {
                    if (!fire) {
                        log.debug("COOLDOWN_SUPPRESSED: trigger={}, scope={}", type.code(), scope);
                        return Mono.just(false);
                    }
                    return recordTrigger(type, scope, cooldownMinutes(type)).thenReturn(true);
                });
    }

    public Mono<Optional<CooldownEntry>> lastEntry(TriggerType type, String scope) {
        return counterStore.getValue(key(type, scope))
                .map(result -> {
                    if (!result.isAvailable()) {
                        throw new CooldownUnavailableException(result.getFailure() + ": " + result.getDetail());
                    }
                    return result.getValue().flatMap(raw -> parse(type, raw));
                });
    }

    private Optional<CooldownEntry> parse(TriggerType type, String raw) {
        int separator = raw.indexOf(':');
        try {
            if (separator < 0) {
                return Optional.of(new CooldownEntry(type, Instant.ofEpochMilli(Long.parseLong(raw)),
                        cooldownMinutes(type)));
            }
            long epochMillis = Long.parseLong(raw.substring(0, separator));
            int minutes = Integer.parseInt(raw.substring(separator + 1));
            return Optional.of(new CooldownEntry(type, Instant.ofEpochMilli(epochMillis), minutes));
        } catch (NumberFormatException e) {
            log.warn("COOLDOWN_ENTRY_INVALID: trigger={}, value={}", type.code(), raw);
            return Optional.empty();
        }
    }

    private String key(TriggerType type, String scope) {
        String base = keyPrefix + ":cooldown:" + type.code();
        return scope == null ? base : base + ":" + scope;
    }

    static class CooldownUnavailableException extends RuntimeException {
        CooldownUnavailableException(String message) {
            super(message);
        }
    }
}
