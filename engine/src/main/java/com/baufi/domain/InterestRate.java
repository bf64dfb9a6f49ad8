package com.baufi.domain;

import com.baufi.common.Result;

/**
 * Nominal annual interest rate in percent, limited to [0,1 %, 25 %].
 */
public final class InterestRate implements Comparable<InterestRate> {

    public static final double MIN_RATE = 0.1;
    public static final double MAX_RATE = 25.0;

    public static final InterestRate MINIMUM = of(MIN_RATE).orElseThrow();
    public static final InterestRate MAXIMUM = of(MAX_RATE).orElseThrow();
    public static final InterestRate TYPICAL_LOW = of(1.5).orElseThrow();
    public static final InterestRate TYPICAL_CURRENT = of(3.5).orElseThrow();
    public static final InterestRate TYPICAL_HIGH = of(6.0).orElseThrow();
    public static final InterestRate STRESS_TEST = of(10.0).orElseThrow();

    private final Percentage percentage;

    private InterestRate(Percentage percentage) {
        this.percentage = percentage;
    }

    public static Result<InterestRate, InterestRateValidationError> of(double ratePercent) {
        Result<Percentage, PercentageValidationError> percentage = Percentage.of(ratePercent);
        if (percentage.isFailure()) {
            return Result.failure(InterestRateValidationError.PERCENTAGE_VALIDATION_ERROR);
        }
        double value = percentage.getValue().getValue();
        if (value < MIN_RATE) {
            return Result.failure(InterestRateValidationError.BELOW_MINIMUM_RATE);
        }
        if (value > MAX_RATE) {
            return Result.failure(InterestRateValidationError.ABOVE_MAXIMUM_RATE);
        }
        return Result.success(new InterestRate(percentage.getValue()));
    }

    /** 0.035 becomes 3,5 %. */
    public static Result<InterestRate, InterestRateValidationError> fromDecimal(double decimal) {
        return of(decimal * 100);
    }

    public static Result<InterestRate, InterestRateValidationError> fromMonthlyRate(double monthlyDecimal) {
        return fromDecimal(monthlyDecimal * 12);
    }

    public Percentage toPercentage() {
        return percentage;
    }

    /** Rate in percent, e.g. 3.5. */
    public double getValue() {
        return percentage.getValue();
    }

    public double toDecimal() {
        return percentage.toDecimal();
    }

    public double toMonthlyRate() {
        return toDecimal() / 12;
    }

    /** One basis point is 0,01 percentage points. */
    public Result<InterestRate, InterestRateValidationError> addBasisPoints(double basisPoints) {
        return of(getValue() + basisPoints / 100);
    }

    public String format() {
        return percentage.format();
    }

    public String format(int decimals) {
        return percentage.format(decimals);
    }

    @Override
    public int compareTo(InterestRate other) {
        return percentage.compareTo(other.percentage);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return percentage.equals(((InterestRate) o).percentage);
    }

    @Override
    public int hashCode() {
        return percentage.hashCode();
    }

    @Override
    public String toString() {
        return format();
    }
}
