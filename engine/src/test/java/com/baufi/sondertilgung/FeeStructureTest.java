package com.baufi.sondertilgung;

import com.baufi.domain.Money;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.assertj.core.api.Assertions.assertThat;

class FeeStructureTest {

    private static final BigDecimal PAYMENT = new BigDecimal("20000");
    private static final BigDecimal EXCESS = new BigDecimal("5000");

    @Test
    void simpleStructures() {
        assertThat(FeeStructure.none().feeEuros(PAYMENT, EXCESS)).isEqualByComparingTo("0");
        assertThat(FeeStructure.percentage(1.0).feeEuros(PAYMENT, EXCESS)).isEqualByComparingTo("200");
        assertThat(FeeStructure.fixed(Money.of(250).orElseThrow()).feeEuros(PAYMENT, EXCESS)).isEqualByComparingTo("250");
        assertThat(FeeStructure.excessOnly(2.0).feeEuros(PAYMENT, EXCESS)).isEqualByComparingTo("100");
    }

    @Test
    void tieredAddsPenaltyOnExcess() {
        assertThat(FeeStructure.tiered(0.5, 2.0).feeEuros(PAYMENT, EXCESS)).isEqualByComparingTo("200");
        assertThat(FeeStructure.tiered(0.5, 2.0).feeEuros(PAYMENT, BigDecimal.ZERO)).isEqualByComparingTo("100");
    }

    @Test
    void boundsClampTheBaseFee() {
        FeeStructure bounded = FeeStructure.percentage(1.0)
                .bounded(Money.of(50).orElseThrow(), Money.of(150).orElseThrow());

        assertThat(bounded.feeEuros(PAYMENT, EXCESS)).isEqualByComparingTo("150");
        assertThat(bounded.feeEuros(new BigDecimal("1000"), BigDecimal.ZERO)).isEqualByComparingTo("50");
        assertThat(bounded.feeEuros(new BigDecimal("10000"), BigDecimal.ZERO)).isEqualByComparingTo("100");
        assertThat(FeeStructure.percentage(1.0).bounded(null, null).feeEuros(PAYMENT, EXCESS))
                .isEqualByComparingTo("200");
    }
}
