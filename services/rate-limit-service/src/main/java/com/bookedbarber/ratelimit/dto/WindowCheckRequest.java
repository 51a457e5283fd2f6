package com.bookedbarber.ratelimit.dto;

import com.bookedbarber.ratelimit.identity.Identity;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request DTO for counting a request against a subject's windows on behalf of another service
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class WindowCheckRequest {

    @Size(max = 64, message = "API key id must not exceed 64 characters")
    private String apiKeyId;

    @Size(max = 100, message = "User id must not exceed 100 characters")
    private String userId;

    @Size(max = 64, message = "IP address must not exceed 64 characters")
    private String ipAddress;

    public Identity toIdentity() {
        return Identity.of(apiKeyId, userId, ipAddress);
    }
}
