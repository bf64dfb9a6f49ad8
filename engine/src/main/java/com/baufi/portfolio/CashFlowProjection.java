package com.baufi.portfolio;

import com.baufi.domain.Money;

import java.time.YearMonth;
import java.util.List;

/**
 * Portfolio payments per calendar month, following each loan's amortization schedule.
 */
public record CashFlowProjection(List<MonthlyCashFlow> months) {

    public CashFlowProjection {
        months = List.copyOf(months);
    }

    /**
     * @param remainingBalance sum of balances after this month's payments
     */
    public record MonthlyCashFlow(
            YearMonth month,
            Money totalPayment,
            Money interest,
            Money principal,
            Money remainingBalance
    ) {
    }
}
