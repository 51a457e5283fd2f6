package com.bookedbarber.ratelimit.gate;

/**
 * Progress of a request through the gate, reported when gating fails unexpectedly.
 */
public enum GateStage {
    ENTRY,
    IDENTITY_RESOLVED,
    TIER_RESOLVED,
    WINDOW_CHECKED,
    CLASSIFIED,
    DECIDED
}
