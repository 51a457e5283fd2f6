package com.bookedbarber.ratelimit.dto;

import com.bookedbarber.ratelimit.identity.Identity;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * Request DTO for reporting the final outcome of a payment
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class PaymentResultRequest {

    @Size(max = 64, message = "API key id must not exceed 64 characters")
    private String apiKeyId;

    @Size(max = 100, message = "User id must not exceed 100 characters")
    private String userId;

    @Size(max = 64, message = "IP address must not exceed 64 characters")
    private String ipAddress;

    @NotNull(message = "Amount is required")
    @PositiveOrZero(message = "Amount must not be negative")
    private BigDecimal amount;

    @NotBlank(message = "Status is required")
    private String status; // success, failed, pending

    @Size(max = 500, message = "Failure reason must not exceed 500 characters")
    private String failureReason;

    public Identity toIdentity() {
        return Identity.of(apiKeyId, userId, ipAddress);
    }
}
