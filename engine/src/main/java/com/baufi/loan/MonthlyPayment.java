package com.baufi.loan;

import com.baufi.common.Result;
import com.baufi.domain.Money;

import java.util.Locale;
import java.util.Objects;

/**
 * One month's payment split into principal (Tilgung) and interest (Zinsen).
 */
public final class MonthlyPayment {

    public static final double TOTAL_TOLERANCE_EUROS = 0.01;
    private static final double HEAVY_SHARE_PERCENT = 60;

    public static final MonthlyPayment ZERO = new MonthlyPayment(Money.ZERO, Money.ZERO, Money.ZERO);

    private final Money principal;
    private final Money interest;
    private final Money total;

    private MonthlyPayment(Money principal, Money interest, Money total) {
        this.principal = principal;
        this.interest = interest;
        this.total = total;
    }

    public static Result<MonthlyPayment, MonthlyPaymentError> of(double principal, double interest) {
        if (!Double.isFinite(principal)) {
            return Result.failure(MonthlyPaymentError.INVALID_PRINCIPAL);
        }
        if (!Double.isFinite(interest)) {
            return Result.failure(MonthlyPaymentError.INVALID_INTEREST);
        }
        if (principal < 0 || interest < 0) {
            return Result.failure(MonthlyPaymentError.NEGATIVE_AMOUNTS);
        }
        Result<Money, ?> principalMoney = Money.of(principal);
        if (principalMoney.isFailure()) {
            return Result.failure(MonthlyPaymentError.INVALID_PRINCIPAL);
        }
        Result<Money, ?> interestMoney = Money.of(interest);
        if (interestMoney.isFailure()) {
            return Result.failure(MonthlyPaymentError.INVALID_INTEREST);
        }
        return of(principalMoney.getValue(), interestMoney.getValue());
    }

    public static Result<MonthlyPayment, MonthlyPaymentError> of(Money principal, Money interest) {
        Result<Money, ?> total = principal.add(interest);
        if (total.isFailure()) {
            return Result.failure(MonthlyPaymentError.INVALID_TOTAL);
        }
        return Result.success(new MonthlyPayment(principal, interest, total.getValue()));
    }

    /**
     * Like {@link #of(double, double)} but also checks the parts against a stated total (0,01 € tolerance).
     */
    public static Result<MonthlyPayment, MonthlyPaymentError> withTotal(double principal, double interest, double expectedTotal) {
        Result<MonthlyPayment, MonthlyPaymentError> payment = of(principal, interest);
        if (payment.isFailure()) {
            return payment;
        }
        if (Math.abs(payment.getValue().total.toEuros() - expectedTotal) > TOTAL_TOLERANCE_EUROS) {
            return Result.failure(MonthlyPaymentError.INCONSISTENT_AMOUNTS);
        }
        return payment;
    }

    public Money getPrincipal() {
        return principal;
    }

    public Money getInterest() {
        return interest;
    }

    public Money getTotal() {
        return total;
    }

    /** Infinite when the payment carries no interest. */
    public double principalToInterestRatio() {
        if (interest.isZero()) {
            return Double.POSITIVE_INFINITY;
        }
        return principal.toEuros() / interest.toEuros();
    }

    public double principalPercentage() {
        return total.isZero() ? 0 : principal.toEuros() / total.toEuros() * 100;
    }

    public double interestPercentage() {
        return total.isZero() ? 0 : interest.toEuros() / total.toEuros() * 100;
    }

    public Result<MonthlyPayment, MonthlyPaymentError> add(MonthlyPayment other) {
        Result<Money, ?> p = principal.add(other.principal);
        if (p.isFailure()) {
            return Result.failure(MonthlyPaymentError.INVALID_PRINCIPAL);
        }
        Result<Money, ?> i = interest.add(other.interest);
        if (i.isFailure()) {
            return Result.failure(MonthlyPaymentError.INVALID_INTEREST);
        }
        return of(p.getValue(), i.getValue());
    }

    public boolean isPrincipalHeavy() {
        return principalPercentage() > HEAVY_SHARE_PERCENT;
    }

    public boolean isInterestHeavy() {
        return interestPercentage() > HEAVY_SHARE_PERCENT;
    }

    /** "Monatliche Rate: 1.501,87 € (Tilgung: 626,87 €, Zinsen: 875,00 €)" */
    public String format() {
        return "Monatliche Rate: " + total.format()
                + " (Tilgung: " + principal.format()
                + ", Zinsen: " + interest.format() + ")";
    }

    /** "1.501,87 € = 626,87 € (41.7% Tilgung) + 875,00 € (58.3% Zinsen)" */
    public String formatBreakdown() {
        return total.format() + " = "
                + principal.format() + " (" + String.format(Locale.ROOT, "%.1f", principalPercentage()) + "% Tilgung) + "
                + interest.format() + " (" + String.format(Locale.ROOT, "%.1f", interestPercentage()) + "% Zinsen)";
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        MonthlyPayment that = (MonthlyPayment) o;
        return principal.equals(that.principal) && interest.equals(that.interest) && total.equals(that.total);
    }

    @Override
    public int hashCode() {
        return Objects.hash(principal, interest, total);
    }

    @Override
    public String toString() {
        return format();
    }
}
