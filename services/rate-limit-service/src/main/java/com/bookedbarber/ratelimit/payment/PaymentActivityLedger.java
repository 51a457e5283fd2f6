package com.bookedbarber.ratelimit.payment;

import com.bookedbarber.ratelimit.identity.Identity;
import com.bookedbarber.ratelimit.store.CounterStore;
import com.bookedbarber.ratelimit.store.StoreResult;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Bounded per-identity list of recent payment activity, most recent first.
 *
 * Entries are stored as JSON in a capped store list whose expiry is refreshed on every append.
 * Entries that no longer parse are skipped.
 */
@Slf4j
public class PaymentActivityLedger {

    private final CounterStore counterStore;
    private final ObjectMapper objectMapper;
    private final String keyPrefix;
    private final int maxEntries;
    private final Duration retention;

    public PaymentActivityLedger(CounterStore counterStore, ObjectMapper objectMapper, String keyPrefix,
                                 int maxEntries, Duration retention) {
        this.counterStore = counterStore;
        this.objectMapper = objectMapper;
        this.keyPrefix = keyPrefix;
        this.maxEntries = maxEntries;
        this.retention = retention;
    }

    public Mono<StoreResult<Long>> append(Identity identity, PaymentActivity activity) {
        String json;
        try {
            json = objectMapper.writeValueAsString(activity);
        } catch (JsonProcessingException e) {
            return Mono.error(new IllegalStateException("Cannot serialize payment activity", e));
        }
        return counterStore.pushBounded(key(identity), json, maxEntries, retention);
    }

    public Mono<StoreResult<List<PaymentActivity>>> recent(Identity identity) {
        return counterStore.range(key(identity), maxEntries)
                .map(result -> result.map(this::parse));
    }

    private List<PaymentActivity> parse(List<String> raw) {
        List<PaymentActivity> entries = new ArrayList<>(raw.size());
        for (String json : raw) {
            try {
                entries.add(objectMapper.readValue(json, PaymentActivity.class));
            } catch (JsonProcessingException e) {
                log.warn("PAYMENT_LEDGER_ENTRY_SKIPPED: error={}", e.getOriginalMessage());
            }
        }
        return entries;
    }

    String key(Identity identity) {
        return keyPrefix + ":pay:ledger:" + identity.subjectKey();
    }
}
