package com.baufi.loan;

/**
 * Variation applied to a base loan: amount scaled by {@code amountMultiplier}, rate shifted by
 * {@code rateAdjustment} percentage points, term shifted by {@code termAdjustmentMonths}.
 */
public record PaymentScenario(double amountMultiplier, double rateAdjustment, int termAdjustmentMonths) {

    public static PaymentScenario rateShift(double percentagePoints) {
        return new PaymentScenario(1.0, percentagePoints, 0);
    }

    public static PaymentScenario termShift(int months) {
        return new PaymentScenario(1.0, 0, months);
    }

    public static PaymentScenario amountScale(double multiplier) {
        return new PaymentScenario(multiplier, 0, 0);
    }
}
