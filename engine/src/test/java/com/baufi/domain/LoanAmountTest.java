package com.baufi.domain;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class LoanAmountTest {

    @Test
    void validationOrder() {
        assertThat(LoanAmount.of(-5).getError()).isEqualTo(LoanAmountValidationError.MONEY_VALIDATION_ERROR);
        assertThat(LoanAmount.of(999.99).getError()).isEqualTo(LoanAmountValidationError.BELOW_MINIMUM);
        assertThat(LoanAmount.of(10_000_000.01).getError()).isEqualTo(LoanAmountValidationError.ABOVE_MAXIMUM);
        assertThat(LoanAmount.of(1_000).isSuccess()).isTrue();
        assertThat(LoanAmount.of(10_000_000).isSuccess()).isTrue();
    }

    @Test
    void moneyRoundTrip() {
        LoanAmount amount = LoanAmount.of(300_000).orElseThrow();
        assertThat(LoanAmount.of(amount.toMoney()).getValue()).isEqualTo(amount);
        assertThat(amount.format()).isEqualTo("300.000,00\u00A0€");
    }
}
