package com.baufi.common;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class GermanFormatTest {

    private static final String NBSP = "\u00A0";

    @Test
    @DisplayName("euros use dot grouping, comma decimals and a no-break space before the sign")
    void euros() {
        assertThat(GermanFormat.euros(new BigDecimal("1234.56"))).isEqualTo("1.234,56" + NBSP + "€");
        assertThat(GermanFormat.euros(0)).isEqualTo("0,00" + NBSP + "€");
        assertThat(GermanFormat.euros(1_000_000)).isEqualTo("1.000.000,00" + NBSP + "€");
    }

    @Test
    void percentWithFixedPrecision() {
        assertThat(GermanFormat.percent(3.5, 2)).isEqualTo("3,50" + NBSP + "%");
        assertThat(GermanFormat.percent(80, 1)).isEqualTo("80,0" + NBSP + "%");
        assertThat(GermanFormat.percent(12.345, 0)).isEqualTo("12" + NBSP + "%");
    }

    @Test
    void percentRoundsTheFractionOfOneHundred() {
        assertThat(GermanFormat.percent(1.005, 2)).isEqualTo("1,00" + NBSP + "%");
        assertThat(GermanFormat.percent(2.675, 2)).isEqualTo("2,68" + NBSP + "%");
    }

    @Test
    void roundsHalfUp() {
        assertThat(GermanFormat.decimal(new BigDecimal("2.345"), 2)).isEqualTo("2,35");
        assertThat(GermanFormat.integer(1234567)).isEqualTo("1.234.567");
    }

    @Test
    void rejectsNegativePrecision() {
        assertThatThrownBy(() -> GermanFormat.decimal(1.0, -1)).isInstanceOf(IllegalArgumentException.class);
    }
}
