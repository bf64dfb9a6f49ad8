package com.baufi.portfolio;

public enum PortfolioError {
    REPOSITORY_FAILURE,
    CALCULATION_FAILED
}
