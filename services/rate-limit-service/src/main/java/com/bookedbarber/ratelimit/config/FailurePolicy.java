package com.bookedbarber.ratelimit.config;

/**
 * What the gate does when enforcement cannot reach a decision.
 */
public enum FailurePolicy {
    /** Let the request through and log the degradation. */
    OPEN,
    /** Reject the request as if the limit had been reached. */
    CLOSED
}
