package com.baufi.domain;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class PaymentMonthTest {

    @Test
    void bounds() {
        assertThat(PaymentMonth.of(0).getError()).isEqualTo(PaymentMonthValidationError.POSITIVE_INTEGER_VALIDATION_ERROR);
        assertThat(PaymentMonth.of(481).getError()).isEqualTo(PaymentMonthValidationError.INVALID_PAYMENT_MONTH);
        assertThat(PaymentMonth.of(480).isSuccess()).isTrue();
    }

    @Test
    @DisplayName("payment year is ceil(month / 12)")
    void paymentYear() {
        assertThat(PaymentMonth.of(1).orElseThrow().getPaymentYear()).isEqualTo(1);
        assertThat(PaymentMonth.of(12).orElseThrow().getPaymentYear()).isEqualTo(1);
        assertThat(PaymentMonth.of(13).orElseThrow().getPaymentYear()).isEqualTo(2);
        assertThat(PaymentMonth.of(480).orElseThrow().getPaymentYear()).isEqualTo(40);
    }

    @Test
    @DisplayName("year and month-in-year round-trip for every month")
    void yearAndMonthRoundTrip() {
        for (int m = 1; m <= 480; m++) {
            PaymentMonth month = PaymentMonth.of(m).orElseThrow();
            PaymentMonth rebuilt = PaymentMonth.fromYearAndMonth(month.getPaymentYear(), month.getMonthInYear()).orElseThrow();
            assertThat(rebuilt).isEqualTo(month);
        }
        assertThat(PaymentMonth.fromYearAndMonth(1, 13).getError()).isEqualTo(PaymentMonthValidationError.INVALID_PAYMENT_MONTH);
    }

    @Test
    void predicatesAndFormat() {
        PaymentMonth fourteen = PaymentMonth.of(14).orElseThrow();
        assertThat(fourteen.isFirstYear()).isFalse();
        assertThat(PaymentMonth.END_OF_FIRST_YEAR.isEndOfYear()).isTrue();
        assertThat(PaymentMonth.END_OF_FIRST_YEAR.isFirstYear()).isTrue();
        assertThat(fourteen.format()).isEqualTo("Monat 14 (Jahr 2, 2. Monat)");
        assertThat(PaymentMonth.FIRST_PAYMENT.addMonths(479).isSuccess()).isTrue();
        assertThat(PaymentMonth.FIRST_PAYMENT.addMonths(480).getError()).isEqualTo(PaymentMonthValidationError.INVALID_PAYMENT_MONTH);
    }
}
