package com.baufi.domain;

import com.baufi.common.Result;

/**
 * Loan term in months, 1 to 480.
 */
public final class MonthCount implements Comparable<MonthCount> {

    public static final int MIN_MONTHS = 1;
    public static final int MAX_MONTHS = 480;

    public static final MonthCount FIVE_YEARS = of(60).orElseThrow();
    public static final MonthCount FIFTEEN_YEARS = of(180).orElseThrow();
    public static final MonthCount TWENTY_FIVE_YEARS = of(300).orElseThrow();
    public static final MonthCount THIRTY_YEARS = of(360).orElseThrow();

    private final PositiveInteger months;

    private MonthCount(PositiveInteger months) {
        this.months = months;
    }

    public static Result<MonthCount, TermValidationError> of(double months) {
        Result<PositiveInteger, PositiveIntegerValidationError> positive = PositiveInteger.of(months);
        if (positive.isFailure()) {
            return Result.failure(TermValidationError.POSITIVE_INTEGER_VALIDATION_ERROR);
        }
        int value = positive.getValue().getValue();
        if (value < MIN_MONTHS) {
            return Result.failure(TermValidationError.BELOW_MINIMUM_TERM);
        }
        if (value > MAX_MONTHS) {
            return Result.failure(TermValidationError.ABOVE_MAXIMUM_TERM);
        }
        return Result.success(new MonthCount(positive.getValue()));
    }

    /** Rounds to whole months: 2.5 years become 30 months. */
    public static Result<MonthCount, TermValidationError> fromYears(double years) {
        return of(Math.round(years * 12));
    }

    public int getValue() {
        return months.getValue();
    }

    public PositiveInteger toPositiveInteger() {
        return months;
    }

    public double toYears() {
        return getValue() / 12.0;
    }

    public Result<MonthCount, TermValidationError> addMonths(int additional) {
        return of(getValue() + (double) additional);
    }

    public Result<MonthCount, TermValidationError> subtractMonths(int toSubtract) {
        return of(getValue() - (double) toSubtract);
    }

    public Result<MonthCount, TermValidationError> remainingAfter(MonthCount elapsed) {
        return of(getValue() - (double) elapsed.getValue());
    }

    /** "5 Monate", "1 Jahr", "2 Jahre 6 Monate". */
    public String format() {
        int total = getValue();
        int years = total / 12;
        int remainder = total % 12;
        if (total < 12) {
            return total + " " + (total == 1 ? "Monat" : "Monate");
        }
        String yearPart = years + " " + (years == 1 ? "Jahr" : "Jahre");
        if (remainder == 0) {
            return yearPart;
        }
        return yearPart + " " + remainder + " " + (remainder == 1 ? "Monat" : "Monate");
    }

    @Override
    public int compareTo(MonthCount other) {
        return months.compareTo(other.months);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return months.equals(((MonthCount) o).months);
    }

    @Override
    public int hashCode() {
        return months.hashCode();
    }

    @Override
    public String toString() {
        return format();
    }
}
