package com.baufi.loan;

public enum MonthlyPaymentError {
    INVALID_PRINCIPAL,
    INVALID_INTEREST,
    INVALID_TOTAL,
    INCONSISTENT_AMOUNTS,
    NEGATIVE_AMOUNTS
}
