package com.baufi.domain;

import com.baufi.common.GermanFormat;
import com.baufi.common.Result;

/**
 * Percentage on the 0-100 scale.
 */
public final class Percentage implements Comparable<Percentage> {

    public static final double MIN = 0;
    public static final double MAX = 100;

    /** Equality tolerance for values produced by floating point arithmetic. */
    public static final double EQUALITY_TOLERANCE = 0.001;

    public static final Percentage ZERO = new Percentage(0);
    public static final Percentage FIFTY = new Percentage(50);
    public static final Percentage HUNDRED = new Percentage(100);

    private final double value;

    private Percentage(double value) {
        this.value = value;
    }

    public static Result<Percentage, PercentageValidationError> of(double value) {
        if (!Double.isFinite(value)) {
            return Result.failure(PercentageValidationError.INVALID_VALUE);
        }
        if (value < MIN || value > MAX) {
            return Result.failure(PercentageValidationError.OUT_OF_RANGE);
        }
        return Result.success(new Percentage(value));
    }

    /** From a fraction: 0.035 becomes 3.5 %. */
    public static Result<Percentage, PercentageValidationError> fromDecimal(double decimal) {
        return of(decimal * 100);
    }

    public double getValue() {
        return value;
    }

    public double toDecimal() {
        return value / 100;
    }

    public Result<Percentage, PercentageValidationError> add(Percentage other) {
        return of(value + other.value);
    }

    public Result<Percentage, PercentageValidationError> subtract(Percentage other) {
        return of(value - other.value);
    }

    public Result<Percentage, PercentageValidationError> multiply(double factor) {
        if (!Double.isFinite(factor) || factor < 0) {
            return Result.failure(PercentageValidationError.INVALID_VALUE);
        }
        return of(value * factor);
    }

    public boolean isEqual(Percentage other) {
        return Math.abs(value - other.value) < EQUALITY_TOLERANCE;
    }

    public String format() {
        return format(2);
    }

    /** "3,50 %" for 3.5 with two decimals. */
    public String format(int decimals) {
        return GermanFormat.percent(value, decimals);
    }

    @Override
    public int compareTo(Percentage other) {
        return Double.compare(value, other.value);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return Double.compare(value, ((Percentage) o).value) == 0;
    }

    @Override
    public int hashCode() {
        return Double.hashCode(value);
    }

    @Override
    public String toString() {
        return format();
    }
}
