package com.bookedbarber.ratelimit.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class WindowCheckResponse {

    private String subject;
    private String tier;
    private String window;
    private long limit;
    private long remaining;
    private Instant resetTime;
    private boolean degraded;
}
