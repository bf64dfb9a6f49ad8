package com.baufi.domain;

public enum PaymentMonthValidationError {
    POSITIVE_INTEGER_VALIDATION_ERROR,
    INVALID_PAYMENT_MONTH
}
