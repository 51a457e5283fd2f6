package com.bookedbarber.ratelimit.store;

/**
 * Reason a counter store call produced no value.
 */
public enum StoreFailure {
    TIMEOUT,
    ERROR,
    CIRCUIT_OPEN
}
