package com.baufi.sondertilgung;

import com.baufi.common.Result;
import com.baufi.domain.Money;
import com.baufi.domain.PaymentMonth;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Sondertilgung: an out-of-schedule principal payment in a given schedule month.
 */
public final class ExtraPayment {

    public static final Money MIN_AMOUNT = Money.ofCents(100).orElseThrow();
    public static final Money MAX_AMOUNT = Money.ofCents(100_000_000).orElseThrow();

    private static final double LARGE_PAYMENT_EUROS = 10_000;
    private static final double SMALL_PAYMENT_EUROS = 1_000;

    /** Month first, then amount. */
    public static final Comparator<ExtraPayment> BY_MONTH_THEN_AMOUNT =
            Comparator.comparing(ExtraPayment::getMonth).thenComparing(ExtraPayment::getAmount);

    private final PaymentMonth month;
    private final Money amount;

    private ExtraPayment(PaymentMonth month, Money amount) {
        this.month = month;
        this.amount = amount;
    }

    public static Result<ExtraPayment, ExtraPaymentError> of(PaymentMonth month, double amountEuros) {
        Result<Money, ?> amount = Money.of(amountEuros);
        if (amount.isFailure()) {
            return Result.failure(ExtraPaymentError.INVALID_AMOUNT);
        }
        return of(month, amount.getValue());
    }

    public static Result<ExtraPayment, ExtraPaymentError> of(int month, double amountEuros) {
        Result<PaymentMonth, ?> paymentMonth = PaymentMonth.of(month);
        if (paymentMonth.isFailure()) {
            return Result.failure(ExtraPaymentError.INVALID_PAYMENT_MONTH);
        }
        return of(paymentMonth.getValue(), amountEuros);
    }

    public static Result<ExtraPayment, ExtraPaymentError> of(PaymentMonth month, Money amount) {
        if (month == null) {
            return Result.failure(ExtraPaymentError.INVALID_PAYMENT_MONTH);
        }
        if (amount == null || amount.compareTo(MIN_AMOUNT) < 0) {
            return Result.failure(ExtraPaymentError.INVALID_AMOUNT);
        }
        if (amount.compareTo(MAX_AMOUNT) > 0) {
            return Result.failure(ExtraPaymentError.AMOUNT_TOO_LARGE);
        }
        return Result.success(new ExtraPayment(month, amount));
    }

    public PaymentMonth getMonth() {
        return month;
    }

    public Money getAmount() {
        return amount;
    }

    public int monthNumber() {
        return month.getValue();
    }

    public int paymentYear() {
        return month.getPaymentYear();
    }

    public double amountInEuros() {
        return amount.toEuros();
    }

    public boolean isSameMonth(ExtraPayment other) {
        return month.equals(other.month);
    }

    public boolean isInFirstYear() {
        return month.isFirstYear();
    }

    public boolean isLarge() {
        return amount.toEuros() >= LARGE_PAYMENT_EUROS;
    }

    public boolean isSmall() {
        return amount.toEuros() < SMALL_PAYMENT_EUROS;
    }

    /**
     * Sum of two payments in the same month. Payments in different months give {@code INVALID_PAYMENT_MONTH}.
     */
    public Result<ExtraPayment, ExtraPaymentError> combine(ExtraPayment other) {
        if (!isSameMonth(other)) {
            return Result.failure(ExtraPaymentError.INVALID_PAYMENT_MONTH);
        }
        Result<Money, ?> sum = amount.add(other.amount);
        if (sum.isFailure()) {
            return Result.failure(ExtraPaymentError.INVALID_AMOUNT);
        }
        return of(month, sum.getValue());
    }

    public static Result<Money, ExtraPaymentError> total(List<ExtraPayment> payments) {
        Money total = Money.ZERO;
        for (ExtraPayment payment : payments) {
            Result<Money, ?> sum = total.add(payment.amount);
            if (sum.isFailure()) {
                return Result.failure(ExtraPaymentError.INVALID_AMOUNT);
            }
            total = sum.getValue();
        }
        return Result.success(total);
    }

    /**
     * One payment per month, amounts of the same month summed, ordered by month.
     */
    public static Result<List<ExtraPayment>, ExtraPaymentError> groupByMonth(List<ExtraPayment> payments) {
        Map<PaymentMonth, ExtraPayment> byMonth = new TreeMap<>();
        for (ExtraPayment payment : payments) {
            ExtraPayment existing = byMonth.get(payment.month);
            if (existing == null) {
                byMonth.put(payment.month, payment);
                continue;
            }
            Result<ExtraPayment, ExtraPaymentError> combined = existing.combine(payment);
            if (combined.isFailure()) {
                return Result.failure(combined.getError());
            }
            byMonth.put(payment.month, combined.getValue());
        }
        return Result.success(List.copyOf(byMonth.values()));
    }

    /** Payments falling into loan-year {@code year} (months 12·(year−1)+1 .. 12·year). */
    public static List<ExtraPayment> filterByYear(List<ExtraPayment> payments, int year) {
        List<ExtraPayment> result = new ArrayList<>();
        for (ExtraPayment payment : payments) {
            if (payment.paymentYear() == year) {
                result.add(payment);
            }
        }
        return result;
    }

    /** "Sondertilgung: 5.000,00 € in Monat 14 (Jahr 2, 2. Monat)" */
    public String format() {
        return "Sondertilgung: " + amount.format() + " in " + month.format();
    }

    /** "5.000,00 € (Monat 14)" */
    public String formatShort() {
        return amount.format() + " (Monat " + month.getValue() + ")";
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ExtraPayment that)) return false;
        return month.equals(that.month) && amount.equals(that.amount);
    }

    @Override
    public int hashCode() {
        return Objects.hash(month, amount);
    }

    @Override
    public String toString() {
        return formatShort();
    }
}
