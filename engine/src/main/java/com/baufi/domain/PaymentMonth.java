package com.baufi.domain;

import com.baufi.common.Result;

/**
 * 1-based month index inside a repayment schedule. Month 13 is the first month of loan-year 2.
 */
public final class PaymentMonth implements Comparable<PaymentMonth> {

    public static final int MIN_MONTH = 1;
    public static final int MAX_MONTH = 480;
    private static final int MAX_YEAR = 40;

    public static final PaymentMonth FIRST_PAYMENT = of(1).orElseThrow();
    public static final PaymentMonth END_OF_FIRST_YEAR = of(12).orElseThrow();
    public static final PaymentMonth END_OF_FIFTH_YEAR = of(60).orElseThrow();

    private final PositiveInteger month;

    private PaymentMonth(PositiveInteger month) {
        this.month = month;
    }

    public static Result<PaymentMonth, PaymentMonthValidationError> of(double month) {
        Result<PositiveInteger, PositiveIntegerValidationError> positive = PositiveInteger.of(month);
        if (positive.isFailure()) {
            return Result.failure(PaymentMonthValidationError.POSITIVE_INTEGER_VALIDATION_ERROR);
        }
        int value = positive.getValue().getValue();
        if (value < MIN_MONTH || value > MAX_MONTH) {
            return Result.failure(PaymentMonthValidationError.INVALID_PAYMENT_MONTH);
        }
        return Result.success(new PaymentMonth(positive.getValue()));
    }

    public static Result<PaymentMonth, PaymentMonthValidationError> fromYearAndMonth(int year, int monthInYear) {
        if (year < 1 || year > MAX_YEAR || monthInYear < 1 || monthInYear > 12) {
            return Result.failure(PaymentMonthValidationError.INVALID_PAYMENT_MONTH);
        }
        return of((year - 1) * 12 + monthInYear);
    }

    public int getValue() {
        return month.getValue();
    }

    /** Loan-year of this month: ceil(month / 12). */
    public int getPaymentYear() {
        return (getValue() + 11) / 12;
    }

    /** 1..12 */
    public int getMonthInYear() {
        return (getValue() - 1) % 12 + 1;
    }

    public Result<PaymentMonth, PaymentMonthValidationError> addMonths(int months) {
        return of(getValue() + (double) months);
    }

    public boolean isFirstYear() {
        return getValue() <= 12;
    }

    public boolean isEndOfYear() {
        return getValue() % 12 == 0;
    }

    /** "Monat 14 (Jahr 2, 2. Monat)" */
    public String format() {
        return "Monat " + getValue() + " (Jahr " + getPaymentYear() + ", " + getMonthInYear() + ". Monat)";
    }

    @Override
    public int compareTo(PaymentMonth other) {
        return month.compareTo(other.month);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return month.equals(((PaymentMonth) o).month);
    }

    @Override
    public int hashCode() {
        return month.hashCode();
    }

    @Override
    public String toString() {
        return "Monat " + getValue();
    }
}
