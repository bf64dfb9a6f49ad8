package com.baufi.portfolio;

import com.baufi.domain.Money;

import java.time.LocalDate;

/**
 * Totals over the active mortgages of a portfolio.
 *
 * @param averageInterestRate principal-weighted nominal rate in percent, two decimals; 0 for an empty portfolio
 * @param totalCurrentBalance outstanding balances as of {@code asOf}
 */
public record PortfolioSummary(
        int totalMortgages,
        int activeMortgages,
        Money totalPrincipal,
        Money totalMonthlyPayment,
        double averageInterestRate,
        Money totalCurrentBalance,
        LocalDate asOf
) {
}
