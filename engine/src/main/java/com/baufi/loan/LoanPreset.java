package com.baufi.loan;

import com.baufi.common.Result;
import com.baufi.domain.InterestRate;
import com.baufi.domain.LoanAmount;
import com.baufi.domain.MonthCount;

/**
 * Typical German mortgage set-ups.
 */
public enum LoanPreset {
    TYPICAL_FIRST_HOME(300_000, 3.5, 25),
    LUXURY_HOME(800_000, 3.8, 30),
    INVESTMENT_PROPERTY(500_000, 4.2, 20);

    private final double amount;
    private final double annualRate;
    private final int termInYears;

    LoanPreset(double amount, double annualRate, int termInYears) {
        this.amount = amount;
        this.annualRate = annualRate;
        this.termInYears = termInYears;
    }

    public double getAmount() {
        return amount;
    }

    public double getAnnualRate() {
        return annualRate;
    }

    public int getTermInYears() {
        return termInYears;
    }

    public Result<LoanConfiguration, LoanConfigurationError> toConfiguration() {
        return LoanConfiguration.withAnnuityPayment(
                LoanAmount.of(amount).orElseThrow(),
                InterestRate.of(annualRate).orElseThrow(),
                MonthCount.of(termInYears * 12).orElseThrow());
    }
}
