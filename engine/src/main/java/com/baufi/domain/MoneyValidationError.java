package com.baufi.domain;

public enum MoneyValidationError {
    NEGATIVE_AMOUNT,
    INVALID_AMOUNT,
    EXCEEDS_MAXIMUM,
    TOO_MANY_DECIMALS
}
