package com.baufi.domain;

import com.baufi.common.GermanFormat;
import com.baufi.common.Result;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Finite decimal strictly greater than zero.
 */
public final class PositiveDecimal implements Comparable<PositiveDecimal> {

    public static final double DEFAULT_EPSILON = 1e-10;

    public static final PositiveDecimal ONE = new PositiveDecimal(1.0);
    public static final PositiveDecimal HALF = new PositiveDecimal(0.5);

    private final double value;

    private PositiveDecimal(double value) {
        this.value = value;
    }

    public static Result<PositiveDecimal, PositiveDecimalValidationError> of(double value) {
        if (!Double.isFinite(value)) {
            return Result.failure(PositiveDecimalValidationError.INVALID_VALUE);
        }
        if (value <= 0) {
            return Result.failure(PositiveDecimalValidationError.NOT_POSITIVE);
        }
        return Result.success(new PositiveDecimal(value));
    }

    public double getValue() {
        return value;
    }

    public PositiveDecimal add(PositiveDecimal other) {
        return new PositiveDecimal(value + other.value);
    }

    public PositiveDecimal multiply(PositiveDecimal other) {
        return new PositiveDecimal(value * other.value);
    }

    public PositiveDecimal divide(PositiveDecimal other) {
        return new PositiveDecimal(value / other.value);
    }

    public Result<PositiveDecimal, PositiveDecimalValidationError> subtract(PositiveDecimal other) {
        double difference = value - other.value;
        if (difference <= 0) {
            return Result.failure(PositiveDecimalValidationError.NOT_POSITIVE);
        }
        return Result.success(new PositiveDecimal(difference));
    }

    public Result<PositiveDecimal, PositiveDecimalValidationError> multiplyByFactor(double factor) {
        if (!Double.isFinite(factor) || factor <= 0) {
            return Result.failure(PositiveDecimalValidationError.INVALID_VALUE);
        }
        return of(value * factor);
    }

    /** Half-up rounding; fails if the rounded value is zero. */
    public Result<PositiveDecimal, PositiveDecimalValidationError> round(int places) {
        return of(BigDecimal.valueOf(value).setScale(places, RoundingMode.HALF_UP).doubleValue());
    }

    public boolean isEqual(PositiveDecimal other) {
        return isEqual(other, DEFAULT_EPSILON);
    }

    public boolean isEqual(PositiveDecimal other, double epsilon) {
        return Math.abs(value - other.value) < epsilon;
    }

    public String format() {
        return format(2);
    }

    public String format(int decimals) {
        return GermanFormat.decimal(value, decimals);
    }

    @Override
    public int compareTo(PositiveDecimal other) {
        return Double.compare(value, other.value);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return Double.compare(value, ((PositiveDecimal) o).value) == 0;
    }

    @Override
    public int hashCode() {
        return Double.hashCode(value);
    }

    @Override
    public String toString() {
        return String.valueOf(value);
    }
}
