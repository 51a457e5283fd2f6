package com.bookedbarber.ratelimit.audit;

/**
 * Destination for compliance and usage records. Implementations may block; callers run them
 * off the request path.
 */
public interface AuditSink {

    void recordViolation(ViolationEvent event);

    void recordUsage(UsageRecord usage);

    void raiseAlert(SecurityAlert alert);
}
