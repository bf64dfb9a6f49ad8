package com.baufi.domain;

public enum InterestRateValidationError {
    PERCENTAGE_VALIDATION_ERROR,
    BELOW_MINIMUM_RATE,
    ABOVE_MAXIMUM_RATE
}
