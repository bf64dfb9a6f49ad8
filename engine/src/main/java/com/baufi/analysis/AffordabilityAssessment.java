package com.baufi.analysis;

import com.baufi.domain.Money;

/**
 * Monthly payment measured against net household income.
 *
 * @param maxAffordablePayment income times the configured payment-to-income limit
 */
public record AffordabilityAssessment(
        Money monthlyNetIncome,
        Money monthlyPayment,
        double paymentToIncomePercent,
        Money maxAffordablePayment,
        boolean affordable
) {
}
