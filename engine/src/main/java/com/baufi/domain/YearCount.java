package com.baufi.domain;

import com.baufi.common.Result;

/**
 * Loan or fixed-rate term in whole years, 1 to 40.
 */
public final class YearCount implements Comparable<YearCount> {

    public static final int MIN_YEARS = 1;
    public static final int MAX_YEARS = 40;

    public static final YearCount SHORT_TERM = of(5).orElseThrow();
    public static final YearCount MEDIUM_TERM = of(15).orElseThrow();
    public static final YearCount LONG_TERM = of(25).orElseThrow();
    public static final YearCount MAXIMUM_STANDARD_TERM = of(30).orElseThrow();

    private final PositiveInteger years;

    private YearCount(PositiveInteger years) {
        this.years = years;
    }

    public static Result<YearCount, TermValidationError> of(double years) {
        Result<PositiveInteger, PositiveIntegerValidationError> positive = PositiveInteger.of(years);
        if (positive.isFailure()) {
            return Result.failure(TermValidationError.POSITIVE_INTEGER_VALIDATION_ERROR);
        }
        int value = positive.getValue().getValue();
        if (value < MIN_YEARS) {
            return Result.failure(TermValidationError.BELOW_MINIMUM_TERM);
        }
        if (value > MAX_YEARS) {
            return Result.failure(TermValidationError.ABOVE_MAXIMUM_TERM);
        }
        return Result.success(new YearCount(positive.getValue()));
    }

    /** Rounds to the nearest whole year. */
    public static Result<YearCount, TermValidationError> fromMonths(int months) {
        return of(Math.round(months / 12.0));
    }

    public int getValue() {
        return years.getValue();
    }

    public int toMonths() {
        return getValue() * 12;
    }

    public Result<YearCount, TermValidationError> addYears(int additional) {
        return of(getValue() + (double) additional);
    }

    public Result<YearCount, TermValidationError> subtractYears(int toSubtract) {
        return of(getValue() - (double) toSubtract);
    }

    public String format() {
        int value = getValue();
        return value == 1 ? "1 Jahr" : value + " Jahre";
    }

    @Override
    public int compareTo(YearCount other) {
        return years.compareTo(other.years);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return years.equals(((YearCount) o).years);
    }

    @Override
    public int hashCode() {
        return years.hashCode();
    }

    @Override
    public String toString() {
        return format();
    }
}
