package com.baufi.loan;

import org.junit.jupiter.api.Test;

import java.time.LocalDate;

import static org.assertj.core.api.Assertions.assertThat;

class FixedRatePeriodTest {

    private static final LocalDate START = LocalDate.of(2024, 1, 1);

    @Test
    void validation() {
        assertThat(FixedRatePeriod.of(0.5, 3.5, FixedRateType.FIXED, START).getError()).isEqualTo(FixedRatePeriodError.PERIOD_TOO_SHORT);
        assertThat(FixedRatePeriod.of(41, 3.5, FixedRateType.FIXED, START).getError()).isEqualTo(FixedRatePeriodError.PERIOD_TOO_LONG);
        assertThat(FixedRatePeriod.of(10.5, 3.5, FixedRateType.FIXED, START).getError()).isEqualTo(FixedRatePeriodError.INVALID_PERIOD_LENGTH);
        assertThat(FixedRatePeriod.of(10, 30, FixedRateType.FIXED, START).getError()).isEqualTo(FixedRatePeriodError.INVALID_INTEREST_RATE);
        assertThat(FixedRatePeriod.of(10, 3.5, FixedRateType.FIXED, START, LocalDate.of(2030, 1, 2)).getError())
                .isEqualTo(FixedRatePeriodError.INVALID_START_DATE);
    }

    @Test
    void activeWindowIsInclusive() {
        FixedRatePeriod period = FixedRatePeriod.standard(10, 3.5, START).orElseThrow();
        assertThat(period.getEndDate()).isEqualTo(LocalDate.of(2034, 1, 1));
        assertThat(period.isActive(START)).isTrue();
        assertThat(period.isActive(period.getEndDate())).isTrue();
        assertThat(period.isActive(START.minusDays(1))).isFalse();
        assertThat(period.isActive(period.getEndDate().plusDays(1))).isFalse();
    }

    @Test
    void remainingYearsAndExpiry() {
        FixedRatePeriod period = FixedRatePeriod.standard(10, 3.5, START).orElseThrow();
        assertThat(period.remainingYears(LocalDate.of(2029, 1, 1))).isEqualTo(5.0);
        assertThat(period.remainingYears(LocalDate.of(2035, 1, 1))).isZero();
        assertThat(period.isExpiringSoon(LocalDate.of(2033, 6, 1))).isTrue();
        assertThat(period.isExpiringSoon(LocalDate.of(2030, 6, 1))).isFalse();
        assertThat(period.isTypicalPeriod()).isTrue();
    }

    @Test
    void format() {
        assertThat(FixedRatePeriod.standard(10, 3.5, START).orElseThrow().format())
                .isEqualTo("10 Jahre Zinsbindung @ 3,50\u00A0%");
    }
}
