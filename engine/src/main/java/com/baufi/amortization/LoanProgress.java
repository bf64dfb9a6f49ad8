package com.baufi.amortization;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

/**
 * State of a running loan at a given date.
 *
 * @param remainingSchedule entries after {@code monthsElapsed}; empty unless requested
 */
public record LoanProgress(
        BigDecimal currentBalance,
        int monthsElapsed,
        int remainingMonths,
        LocalDate payoffDate,
        BigDecimal totalInterestPaid,
        BigDecimal remainingInterest,
        List<AmortizationEntry> remainingSchedule
) {

    public LoanProgress {
        remainingSchedule = List.copyOf(remainingSchedule);
    }

    public boolean isPaidOff() {
        return currentBalance.signum() == 0;
    }
}
