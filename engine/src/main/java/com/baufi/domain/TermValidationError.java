package com.baufi.domain;

/**
 * Errors shared by {@link MonthCount} and {@link YearCount}.
 */
public enum TermValidationError {
    POSITIVE_INTEGER_VALIDATION_ERROR,
    BELOW_MINIMUM_TERM,
    ABOVE_MAXIMUM_TERM
}
