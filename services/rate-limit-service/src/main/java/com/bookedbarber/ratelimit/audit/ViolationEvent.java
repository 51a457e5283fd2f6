package com.bookedbarber.ratelimit.audit;

import com.bookedbarber.ratelimit.payment.Violation;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Map;

/**
 * Compliance record of a denied request.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ViolationEvent(String subject,
                             String ipAddress,
                             String violationType,
                             String severity,
                             String message,
                             BigDecimal amount,
                             String endpoint,
                             Map<String, Object> context,
                             Instant timestamp) {

    public static ViolationEvent from(Violation violation, BigDecimal amount, String endpoint) {
        return new ViolationEvent(violation.identity().subjectKey(), violation.identity().ipAddress(),
                violation.type().code(), violation.severity().code(), violation.message(),
                amount, endpoint, violation.context(), violation.timestamp());
    }
}
