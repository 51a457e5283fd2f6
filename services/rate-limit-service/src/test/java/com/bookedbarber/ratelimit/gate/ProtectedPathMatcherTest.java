package com.bookedbarber.ratelimit.gate;

import com.bookedbarber.ratelimit.config.RateLimitProperties;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.springframework.http.HttpMethod;

import static org.assertj.core.api.Assertions.assertThat;

class ProtectedPathMatcherTest {

    private final ProtectedPathMatcher matcher = new ProtectedPathMatcher(new RateLimitProperties());

    @ParameterizedTest
    @ValueSource(strings = {"/api/v2/public/shops", "/api/v2/public/barbers/42/slots", "/api/v2/payments/intents"})
    @DisplayName("Should protect public and payment endpoints")
    void shouldProtectPublicAndPaymentPaths(String path) {
        assertThat(matcher.isProtected(path)).isTrue();
    }

    @ParameterizedTest
    @ValueSource(strings = {"/actuator/health", "/api/v2/rate-limits/status", "/api/v1/public/shops"})
    @DisplayName("Should leave other endpoints alone")
    void shouldIgnoreOtherPaths(String path) {
        assertThat(matcher.isProtected(path)).isFalse();
    }

    @Test
    @DisplayName("Should only treat POST as a payment intent")
    void shouldMatchIntentCreation() {
        assertThat(matcher.isPaymentIntent(HttpMethod.POST, "/api/v2/payments/intents")).isTrue();
        assertThat(matcher.isPaymentIntent(HttpMethod.GET, "/api/v2/payments/intents")).isFalse();
        assertThat(matcher.isPaymentIntent(HttpMethod.POST, "/api/v2/payments/intents/pi_1/confirm")).isFalse();
    }

    @Test
    @DisplayName("Should extract the intent id of a confirmation")
    void shouldExtractIntentId() {
        assertThat(matcher.paymentIntentId(HttpMethod.POST, "/api/v2/payments/intents/pi_3Nx/confirm"))
                .contains("pi_3Nx");
        assertThat(matcher.paymentIntentId(HttpMethod.GET, "/api/v2/payments/intents/pi_3Nx/confirm")).isEmpty();
        assertThat(matcher.isPaymentAction(HttpMethod.POST, "/api/v2/payments/intents/pi_3Nx/confirm")).isTrue();
        assertThat(matcher.isPaymentAction(HttpMethod.POST, "/api/v2/payments/refunds")).isFalse();
    }
}
