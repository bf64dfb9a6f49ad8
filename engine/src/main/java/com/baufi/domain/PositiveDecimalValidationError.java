package com.baufi.domain;

public enum PositiveDecimalValidationError {
    INVALID_VALUE,
    NOT_POSITIVE
}
