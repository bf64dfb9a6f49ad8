package com.baufi.domain;

import com.baufi.common.GermanFormat;
import com.baufi.common.Result;

/**
 * Whole number greater than zero.
 */
public final class PositiveInteger implements Comparable<PositiveInteger> {

    public static final PositiveInteger ONE = new PositiveInteger(1);
    public static final PositiveInteger TWELVE = new PositiveInteger(12);

    private final int value;

    private PositiveInteger(int value) {
        this.value = value;
    }

    /**
     * Checks finiteness, sign and integrality, in that order.
     */
    public static Result<PositiveInteger, PositiveIntegerValidationError> of(double value) {
        if (!Double.isFinite(value) || value > Integer.MAX_VALUE) {
            return Result.failure(PositiveIntegerValidationError.INVALID_VALUE);
        }
        if (value <= 0) {
            return Result.failure(PositiveIntegerValidationError.NOT_POSITIVE);
        }
        if (value != Math.rint(value)) {
            return Result.failure(PositiveIntegerValidationError.NOT_INTEGER);
        }
        return Result.success(new PositiveInteger((int) value));
    }

    public int getValue() {
        return value;
    }

    public PositiveInteger add(PositiveInteger other) {
        return new PositiveInteger(Math.addExact(value, other.value));
    }

    public PositiveInteger multiply(PositiveInteger other) {
        return new PositiveInteger(Math.multiplyExact(value, other.value));
    }

    public Result<PositiveInteger, PositiveIntegerValidationError> subtract(PositiveInteger other) {
        int difference = value - other.value;
        if (difference <= 0) {
            return Result.failure(PositiveIntegerValidationError.NOT_POSITIVE);
        }
        return Result.success(new PositiveInteger(difference));
    }

    /** Floor division; fails when the quotient rounds down to zero. */
    public Result<PositiveInteger, PositiveIntegerValidationError> divide(PositiveInteger divisor) {
        int quotient = value / divisor.value;
        if (quotient <= 0) {
            return Result.failure(PositiveIntegerValidationError.NOT_POSITIVE);
        }
        return Result.success(new PositiveInteger(quotient));
    }

    public boolean isEqual(PositiveInteger other) {
        return value == other.value;
    }

    /** "1.234" */
    public String format() {
        return GermanFormat.integer(value);
    }

    @Override
    public int compareTo(PositiveInteger other) {
        return Integer.compare(value, other.value);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return value == ((PositiveInteger) o).value;
    }

    @Override
    public int hashCode() {
        return Integer.hashCode(value);
    }

    @Override
    public String toString() {
        return String.valueOf(value);
    }
}
