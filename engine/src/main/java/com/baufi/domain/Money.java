package com.baufi.domain;

import com.baufi.common.GermanFormat;
import com.baufi.common.Result;

import java.math.BigDecimal;

/**
 * Non-negative euro amount stored as whole cents. Range [0, 999.999.999,00 €].
 * Construction rounds to the nearest cent; {@link #ofExact(double)} refuses sub-cent input instead.
 */
public final class Money implements Comparable<Money> {

    public static final long MAX_CENTS = 99_999_999_900L;

    public static final Money ZERO = new Money(0L);

    private static final double SUB_CENT_EPSILON = 1e-6;

    private final long cents;

    private Money(long cents) {
        this.cents = cents;
    }

    public static Result<Money, MoneyValidationError> of(double euros) {
        if (!Double.isFinite(euros)) {
            return Result.failure(MoneyValidationError.INVALID_AMOUNT);
        }
        if (euros < 0) {
            return Result.failure(MoneyValidationError.NEGATIVE_AMOUNT);
        }
        return ofCents(Math.round(euros * 100));
    }

    /**
     * Like {@link #of(double)} but reports {@code TOO_MANY_DECIMALS} for fractions of a cent.
     */
    public static Result<Money, MoneyValidationError> ofExact(double euros) {
        if (!Double.isFinite(euros)) {
            return Result.failure(MoneyValidationError.INVALID_AMOUNT);
        }
        if (euros < 0) {
            return Result.failure(MoneyValidationError.NEGATIVE_AMOUNT);
        }
        double scaled = euros * 100;
        if (Math.abs(scaled - Math.rint(scaled)) > SUB_CENT_EPSILON) {
            return Result.failure(MoneyValidationError.TOO_MANY_DECIMALS);
        }
        return ofCents(Math.round(scaled));
    }

    public static Result<Money, MoneyValidationError> of(BigDecimal euros) {
        if (euros == null) {
            return Result.failure(MoneyValidationError.INVALID_AMOUNT);
        }
        return of(euros.doubleValue());
    }

    public static Result<Money, MoneyValidationError> ofCents(long cents) {
        if (cents < 0) {
            return Result.failure(MoneyValidationError.NEGATIVE_AMOUNT);
        }
        if (cents > MAX_CENTS) {
            return Result.failure(MoneyValidationError.EXCEEDS_MAXIMUM);
        }
        return Result.success(new Money(cents));
    }

    public long getCents() {
        return cents;
    }

    public double toEuros() {
        return cents / 100.0;
    }

    public BigDecimal toBigDecimal() {
        return BigDecimal.valueOf(cents, 2);
    }

    public boolean isZero() {
        return cents == 0;
    }

    public Result<Money, MoneyValidationError> add(Money other) {
        return ofCents(cents + other.cents);
    }

    public Result<Money, MoneyValidationError> subtract(Money other) {
        return ofCents(cents - other.cents);
    }

    public Result<Money, MoneyValidationError> multiply(double factor) {
        if (!Double.isFinite(factor) || factor < 0) {
            return Result.failure(MoneyValidationError.INVALID_AMOUNT);
        }
        double product = cents * factor;
        if (product > MAX_CENTS) {
            return Result.failure(MoneyValidationError.EXCEEDS_MAXIMUM);
        }
        return ofCents(Math.round(product));
    }

    public boolean isEqual(Money other) {
        return other != null && cents == other.cents;
    }

    public boolean isGreaterThan(Money other) {
        return cents > other.cents;
    }

    /** "1.234,56 €" */
    public String format() {
        return GermanFormat.euros(toBigDecimal());
    }

    @Override
    public int compareTo(Money other) {
        return Long.compare(cents, other.cents);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return cents == ((Money) o).cents;
    }

    @Override
    public int hashCode() {
        return Long.hashCode(cents);
    }

    @Override
    public String toString() {
        return format();
    }
}
