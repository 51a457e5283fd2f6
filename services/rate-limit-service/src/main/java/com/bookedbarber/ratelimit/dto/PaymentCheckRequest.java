package com.bookedbarber.ratelimit.dto;

import com.bookedbarber.ratelimit.identity.Identity;
import com.bookedbarber.ratelimit.payment.PaymentMethodInfo;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * Request DTO for checking a payment intent before it is created
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class PaymentCheckRequest {

    @Size(max = 64, message = "API key id must not exceed 64 characters")
    private String apiKeyId;

    @Size(max = 100, message = "User id must not exceed 100 characters")
    private String userId;

    @Size(max = 64, message = "IP address must not exceed 64 characters")
    private String ipAddress;

    @NotNull(message = "Amount is required")
    @Positive(message = "Amount must be positive")
    private BigDecimal amount;

    private PaymentMethodInfo paymentMethod;

    @Size(min = 2, max = 2, message = "Country must be a two-letter code")
    private String country;

    public Identity toIdentity() {
        return Identity.of(apiKeyId, userId, ipAddress);
    }
}
