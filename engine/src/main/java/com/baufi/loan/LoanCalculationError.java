package com.baufi.loan;

public enum LoanCalculationError {
    MATHEMATICAL_ERROR,
    INSUFFICIENT_PAYMENT,
    PAYMENT_TOO_HIGH,
    INVALID_PARAMETERS
}
