package com.bookedbarber.ratelimit.payment;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * Non-sensitive payment method descriptors as sent by the booking client.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record PaymentMethodInfo(@JsonProperty("type") String type,
                                @JsonProperty("last4") String last4,
                                @JsonProperty("brand") String brand,
                                @JsonProperty("exp_month") String expMonth,
                                @JsonProperty("exp_year") String expYear) {

    public static PaymentMethodInfo unknown() {
        return new PaymentMethodInfo(null, null, null, null, null);
    }

    /**
     * Stable 16 hex character digest of the method descriptors. Missing fields hash as empty,
     * a missing type as {@code unknown}.
     */
    public String fingerprint() {
        String canonical = "brand=" + nullToEmpty(brand)
                + "|exp_month=" + nullToEmpty(expMonth)
                + "|exp_year=" + nullToEmpty(expYear)
                + "|last4=" + nullToEmpty(last4)
                + "|type=" + (type == null || type.isBlank() ? "unknown" : type);
        try {
            byte[] hash = MessageDigest.getInstance("SHA-256").digest(canonical.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(hash).substring(0, 16);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value.trim();
    }
}
