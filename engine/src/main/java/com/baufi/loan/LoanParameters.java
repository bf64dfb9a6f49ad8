package com.baufi.loan;

/**
 * Plain numeric view of a loan used inside calculations.
 *
 * @param amount          principal in euros
 * @param annualRate      nominal annual rate in percent (3.5 for 3,5 %)
 * @param monthlyRate     annualRate / 100 / 12
 * @param termInMonths    contractual number of payments
 * @param monthlyPayment  regular payment in euros
 */
public record LoanParameters(
        double amount,
        double annualRate,
        double monthlyRate,
        int termInMonths,
        double monthlyPayment
) {

    public static LoanParameters of(double amount, double annualRatePercent, int termInMonths, double monthlyPayment) {
        return new LoanParameters(amount, annualRatePercent, annualRatePercent / 100 / 12, termInMonths, monthlyPayment);
    }

    public boolean isZeroRate() {
        return monthlyRate == 0;
    }
}
