package com.baufi.domain;

public enum PercentageValidationError {
    INVALID_VALUE,
    OUT_OF_RANGE
}
