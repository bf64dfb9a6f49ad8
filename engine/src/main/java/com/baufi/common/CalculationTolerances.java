package com.baufi.common;

/**
 * Pragmatic consistency tolerances used by composite constructors.
 *
 * @param configurationToleranceEuros max deviation of a stated monthly payment from the annuity payment
 * @param zeroRateToleranceEuros      max deviation from amount / term when the interest rate is zero
 * @param ltvApprovalBufferPoints     percentage points above the max allowed LTV before creation is refused
 */
public record CalculationTolerances(
        double configurationToleranceEuros,
        double zeroRateToleranceEuros,
        double ltvApprovalBufferPoints
) {

    public static final double DEFAULT_CONFIGURATION_TOLERANCE_EUROS = 1.0;
    public static final double DEFAULT_ZERO_RATE_TOLERANCE_EUROS = 0.01;
    public static final double DEFAULT_LTV_APPROVAL_BUFFER_POINTS = 10.0;

    public static final CalculationTolerances DEFAULT = new CalculationTolerances(
            DEFAULT_CONFIGURATION_TOLERANCE_EUROS,
            DEFAULT_ZERO_RATE_TOLERANCE_EUROS,
            DEFAULT_LTV_APPROVAL_BUFFER_POINTS);

    public CalculationTolerances {
        if (configurationToleranceEuros < 0 || zeroRateToleranceEuros < 0 || ltvApprovalBufferPoints < 0) {
            throw new IllegalArgumentException("tolerances must be non-negative");
        }
    }
}
