package com.baufi.analysis;

import com.baufi.domain.Money;
import com.baufi.loan.LoanConfiguration;
import com.baufi.loan.MonthlyPayment;

/**
 * Key figures of one loan over its full term.
 *
 * @param totalCost    principal plus total interest
 * @param payoffMonths months of the generated schedule
 */
public record LoanAnalysis(
        LoanConfiguration configuration,
        MonthlyPayment firstMonthPayment,
        Money totalInterest,
        Money totalCost,
        Money firstYearInterest,
        Money firstYearPrincipal,
        int payoffMonths
) {

    public String format() {
        return configuration.format() + ", Gesamtzinsen: " + totalInterest.format()
                + ", Gesamtkosten: " + totalCost.format();
    }
}
