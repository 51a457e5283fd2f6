package com.bookedbarber.ratelimit.audit;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.time.Instant;

/**
 * One gated request, recorded after the response was produced.
 *
 * @param endpoint normalized path, ids replaced by placeholders
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record UsageRecord(String subject,
                          String endpoint,
                          String method,
                          Instant timestamp,
                          int responseCode,
                          long durationMs) {
}
