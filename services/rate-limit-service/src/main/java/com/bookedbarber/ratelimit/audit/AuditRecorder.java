package com.bookedbarber.ratelimit.audit;

import com.bookedbarber.ratelimit.metrics.RateLimitMetrics;
import com.bookedbarber.ratelimit.store.CounterStore;
import com.bookedbarber.ratelimit.store.StoreResult;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;

/**
 * Audit and Usage Recorder
 *
 * Fire-and-forget recording of violations, security alerts and per-request usage. Every write
 * is dispatched to a dedicated bounded scheduler; failures are logged and counted but never
 * reach the request that triggered them.
 *
 * Usage is kept two ways: the most recent requests per subject, and daily per-endpoint counters
 * retained for the configured period.
 *
 * @author BookedBarber Platform Engineering
 * @since 1.0
 */
@Slf4j
public class AuditRecorder {

    private static final DateTimeFormatter DAY = DateTimeFormatter.ofPattern("yyyy-MM-dd").withZone(ZoneOffset.UTC);

    private final AuditSink auditSink;
    private final CounterStore counterStore;
    private final Scheduler scheduler;
    private final RateLimitMetrics metrics;
    private final ObjectMapper objectMapper;
    private final String keyPrefix;
    private final int recentLimit;
    private final Duration retention;

    public AuditRecorder(AuditSink auditSink, CounterStore counterStore, Scheduler scheduler,
                         RateLimitMetrics metrics, ObjectMapper objectMapper, String keyPrefix,
                         int recentLimit, Duration retention) {
        this.auditSink = auditSink;
        this.counterStore = counterStore;
        this.scheduler = scheduler;
        this.metrics = metrics;
        this.objectMapper = objectMapper;
        this.keyPrefix = keyPrefix;
        this.recentLimit = recentLimit;
        this.retention = retention;
    }

    public void recordViolation(ViolationEvent event) {
        dispatch("violation", Mono.fromRunnable(() -> auditSink.recordViolation(event)));
    }

    public void raiseAlert(SecurityAlert alert) {
        log.warn("SECURITY_ALERT: type={}, severity={}, subject={}, message={}",
                alert.alertType(), alert.severity().code(), alert.subject(), alert.message());
        dispatch("alert", Mono.fromRunnable(() -> auditSink.raiseAlert(alert)));
    }

    public void recordUsage(UsageRecord usage) {
        Mono<Void> work = Mono.fromRunnable(() -> auditSink.recordUsage(usage))
                .then(Mono.fromCallable(() -> objectMapper.writeValueAsString(usage)))
                .flatMap(json -> counterStore.pushBounded(recentKey(usage.subject()), json, recentLimit, retention))
                .doOnNext(result -> checkStored("recent_usage", result))
                .then(counterStore.increment(endpointKey(usage), 1, retention))
                .doOnNext(result -> checkStored("endpoint_usage", result))
                .then();
        dispatch("usage", work);
    }

    public Mono<List<UsageRecord>> recentUsage(String subject, int count) {
        return counterStore.range(recentKey(subject), Math.min(count, recentLimit))
                .map(result -> {
                    List<UsageRecord> records = new ArrayList<>();
                    for (String json : result.orElse(List.of())) {
                        try {
                            records.add(objectMapper.readValue(json, UsageRecord.class));
                        } catch (JsonProcessingException e) {
                            log.debug("Skipping unreadable usage record for subject={}", subject);
                        }
                    }
                    return records;
                });
    }

    public Mono<Long> endpointUsage(String method, String endpoint, Instant day) {
        return counterStore.get(endpointKey(method, endpoint, day))
                .map(result -> result.orElse(0L));
    }

    private void dispatch(String kind, Mono<?> work) {
        work.subscribeOn(scheduler)
                .subscribe(
                        ignored -> { },
                        error -> {
                            metrics.recordAuditFailure();
                            log.warn("AUDIT_WRITE_FAILED: kind={}, error={}", kind, error.toString());
                        });
    }

    private void checkStored(String what, StoreResult<?> result) {
        if (!result.isAvailable()) {
            metrics.recordAuditFailure();
            log.debug("AUDIT_STORE_UNAVAILABLE: record={}, failure={}", what, result.getFailure());
        }
    }

    String recentKey(String subject) {
        return keyPrefix + ":usage:recent:" + subject;
    }

    private String endpointKey(UsageRecord usage) {
        return endpointKey(usage.method(), usage.endpoint(), usage.timestamp());
    }

    String endpointKey(String method, String endpoint, Instant day) {
        return keyPrefix + ":usage:endpoint:" + method + ":" + endpoint + ":" + DAY.format(day);
    }
}
