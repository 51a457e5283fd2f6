package com.bookedbarber.ratelimit.audit;

import com.bookedbarber.ratelimit.payment.Severity;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.time.Instant;
import java.util.Map;

/**
 * Security event for the on-call channel, raised at most once per cooldown interval per subject.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record SecurityAlert(String alertType,
                            Severity severity,
                            String subject,
                            String message,
                            Map<String, Object> details,
                            Instant timestamp) {
}
