package com.baufi.sondertilgung;

import com.baufi.domain.Money;

/**
 * Extra payments of one loan-year.
 *
 * @param percentOfLoan share of the original loan amount, 0-100
 */
public record YearlyPaymentSummary(int year, Money totalAmount, int paymentCount, Money averagePayment,
                                   double percentOfLoan) {
}
