package com.baufi.property;

public enum LoanToValueError {
    INVALID_LOAN_AMOUNT,
    PROPERTY_VALUATION_NOT_ACCEPTABLE,
    PROPERTY_VALUE_TOO_LOW,
    LTV_TOO_HIGH
}
