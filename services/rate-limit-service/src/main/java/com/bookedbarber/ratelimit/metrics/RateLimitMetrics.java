package com.bookedbarber.ratelimit.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;

/**
 * Micrometer counters for gate decisions, fail-open events, violations and audit failures.
 */
public class RateLimitMetrics {

    private final MeterRegistry meterRegistry;
    private final Counter auditFailureCounter;
    private final Counter gateErrorCounter;

    public RateLimitMetrics(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
        this.auditFailureCounter = Counter.builder("rate_limit_audit_failures")
                .description("Audit or usage writes that could not be completed")
                .register(meterRegistry);
        this.gateErrorCounter = Counter.builder("rate_limit_gate_errors")
                .description("Unexpected errors inside the request gate; the request was allowed")
                .register(meterRegistry);
    }

    public void recordDecision(String outcome, String tier) {
        meterRegistry.counter("rate_limit_decisions", "outcome", outcome, "tier", tier).increment();
    }

    public void recordFailOpen(String component) {
        meterRegistry.counter("rate_limit_fail_open", "component", component).increment();
    }

    public void recordViolation(String violationType) {
        meterRegistry.counter("rate_limit_violations", "type", violationType).increment();
    }

    public void recordAuditFailure() {
        auditFailureCounter.increment();
    }

    public void recordGateError() {
        gateErrorCounter.increment();
    }
}
