package com.baufi.loan;

public enum FixedRatePeriodError {
    PERIOD_TOO_SHORT,
    PERIOD_TOO_LONG,
    INVALID_PERIOD_LENGTH,
    INVALID_INTEREST_RATE,
    INVALID_START_DATE
}
