package com.baufi.analysis;

public enum AnalysisError {
    INVALID_CONFIGURATION,
    CALCULATION_FAILED,
    INVALID_INCOME,
    NO_SCENARIOS
}
