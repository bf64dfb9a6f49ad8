package com.baufi.loan;

/**
 * Field-wise difference between two configurations (second minus first).
 */
public record LoanConfigurationDifference(
        double amountDifference,
        double rateDifference,
        int termDifference,
        double paymentDifference
) {
}
