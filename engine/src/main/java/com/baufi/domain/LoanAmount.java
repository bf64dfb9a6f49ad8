package com.baufi.domain;

import com.baufi.common.Result;

/**
 * Principal of a mortgage: a {@link Money} amount between 1.000 € and 10.000.000 €.
 */
public final class LoanAmount implements Comparable<LoanAmount> {

    public static final double MIN_EUROS = 1_000;
    public static final double MAX_EUROS = 10_000_000;

    public static final LoanAmount MINIMUM = of(MIN_EUROS).orElseThrow();
    public static final LoanAmount MAXIMUM = of(MAX_EUROS).orElseThrow();

    private final Money money;

    private LoanAmount(Money money) {
        this.money = money;
    }

    public static Result<LoanAmount, LoanAmountValidationError> of(double euros) {
        Result<Money, MoneyValidationError> money = Money.of(euros);
        if (money.isFailure()) {
            return Result.failure(LoanAmountValidationError.MONEY_VALIDATION_ERROR);
        }
        double value = money.getValue().toEuros();
        if (value < MIN_EUROS) {
            return Result.failure(LoanAmountValidationError.BELOW_MINIMUM);
        }
        if (value > MAX_EUROS) {
            return Result.failure(LoanAmountValidationError.ABOVE_MAXIMUM);
        }
        return Result.success(new LoanAmount(money.getValue()));
    }

    public static Result<LoanAmount, LoanAmountValidationError> of(Money money) {
        return of(money.toEuros());
    }

    public Money toMoney() {
        return money;
    }

    public double toEuros() {
        return money.toEuros();
    }

    public String format() {
        return money.format();
    }

    @Override
    public int compareTo(LoanAmount other) {
        return money.compareTo(other.money);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return money.equals(((LoanAmount) o).money);
    }

    @Override
    public int hashCode() {
        return money.hashCode();
    }

    @Override
    public String toString() {
        return format();
    }
}
