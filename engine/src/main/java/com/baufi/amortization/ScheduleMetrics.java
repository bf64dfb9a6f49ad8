package com.baufi.amortization;

import java.math.BigDecimal;

/**
 * Aggregates over a full schedule, measured against the same loan without extra payments.
 *
 * @param effectiveInterestRate interest saved per euro of extra payment in percent; the nominal rate when there are
 *                              no extra payments
 * @param payoffYear            loan-year of the last payment (1-based)
 * @param payoffMonth           month within that year (1-12)
 */
public record ScheduleMetrics(
        BigDecimal totalInterestPaid,
        BigDecimal totalPrincipalPaid,
        BigDecimal totalExtraPayments,
        BigDecimal totalPayments,
        int actualTermMonths,
        BigDecimal interestSavedVsOriginal,
        int termReductionMonths,
        double effectiveInterestRate,
        BigDecimal averageMonthlyPayment,
        BigDecimal largestMonthlyPayment,
        BigDecimal smallestMonthlyPayment,
        int payoffYear,
        int payoffMonth
) {
}
