package com.baufi.domain;

public enum LoanAmountValidationError {
    MONEY_VALIDATION_ERROR,
    BELOW_MINIMUM,
    ABOVE_MAXIMUM
}
