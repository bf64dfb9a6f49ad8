package com.baufi.amortization;

import java.math.BigDecimal;

/**
 * Effect of switching from {@code base} to {@code comparison}.
 *
 * @param returnOnInvestment interest saved per euro of extra payment, in percent
 * @param worthwhile         savings are positive and the return exceeds 2 %
 */
public record ScheduleComparison(
        AmortizationSchedule base,
        AmortizationSchedule comparison,
        BigDecimal interestSavings,
        int termReduction,
        double returnOnInvestment,
        boolean worthwhile
) {
}
