package com.baufi.amortization;

public enum AmortizationError {
    /** Monthly payment ≤ first month's interest; the loan would never amortize. */
    PAYMENT_DOES_NOT_COVER_INTEREST,
    INVALID_LOAN_PARAMETERS,
    /** Extra payments not strictly increasing by month. */
    UNORDERED_EXTRA_PAYMENTS,
    MONTH_NOT_IN_SCHEDULE
}
