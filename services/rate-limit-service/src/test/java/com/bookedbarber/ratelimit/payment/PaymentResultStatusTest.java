package com.bookedbarber.ratelimit.payment;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Locale;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("PaymentResultStatus")
class PaymentResultStatusTest {

    @Test
    @DisplayName("Should accept every reported status spelling")
    void shouldParseKnownCodes() {
        assertThat(PaymentResultStatus.fromCode("success")).isEqualTo(PaymentResultStatus.SUCCEEDED);
        assertThat(PaymentResultStatus.fromCode(" Succeeded ")).isEqualTo(PaymentResultStatus.SUCCEEDED);
        assertThat(PaymentResultStatus.fromCode("failure")).isEqualTo(PaymentResultStatus.FAILED);
        assertThat(PaymentResultStatus.fromCode("pending")).isEqualTo(PaymentResultStatus.PENDING);
        assertThat(PaymentResultStatus.PENDING.code()).isEqualTo("pending");
    }

    @Test
    @DisplayName("Should reject unknown and missing statuses")
    void shouldRejectUnknownCodes() {
        assertThatThrownBy(() -> PaymentResultStatus.fromCode("refunded"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("refunded");
        assertThatThrownBy(() -> PaymentResultStatus.fromCode(null))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Should parse upper-case codes regardless of the default locale")
    void shouldParseUnderTurkishLocale() {
        Locale original = Locale.getDefault();
        Locale.setDefault(Locale.forLanguageTag("tr-TR"));
        try {
            assertThat(PaymentResultStatus.fromCode("FAILED")).isEqualTo(PaymentResultStatus.FAILED);
            assertThat(PaymentResultStatus.fromCode("PENDING")).isEqualTo(PaymentResultStatus.PENDING);
        } finally {
            Locale.setDefault(original);
        }
    }
}
