package com.baufi.domain;

public enum PositiveIntegerValidationError {
    INVALID_VALUE,
    NOT_POSITIVE,
    NOT_INTEGER
}
