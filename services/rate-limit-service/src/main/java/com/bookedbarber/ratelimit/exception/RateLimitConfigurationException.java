package com.bookedbarber.ratelimit.exception;

/**
 * Invalid rate limiting configuration or unusable store connection detected at startup.
 */
public class RateLimitConfigurationException extends RuntimeException {

    public RateLimitConfigurationException(String message) {
        super(message);
    }

    public RateLimitConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
