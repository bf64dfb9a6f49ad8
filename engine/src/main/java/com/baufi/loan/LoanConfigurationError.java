package com.baufi.loan;

public enum LoanConfigurationError {
    INVALID_LOAN_AMOUNT,
    INVALID_INTEREST_RATE,
    INVALID_TERM,
    INVALID_MONTHLY_PAYMENT,
    INCONSISTENT_PARAMETERS,
    PAYMENT_TOO_LOW,
    PAYMENT_TOO_HIGH
}
