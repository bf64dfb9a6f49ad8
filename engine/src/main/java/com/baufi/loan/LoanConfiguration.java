package com.baufi.loan;

import com.baufi.common.CalculationTolerances;
import com.baufi.common.Result;
import com.baufi.domain.InterestRate;
import com.baufi.domain.LoanAmount;
import com.baufi.domain.Money;
import com.baufi.domain.MonthCount;
import com.baufi.domain.TermValidationError;
import com.baufi.domain.YearCount;

import java.util.Objects;

/**
 * Amount, rate, term and monthly payment of an annuity loan. The four values always satisfy the
 * annuity relation within {@link CalculationTolerances#configurationToleranceEuros()} (or the
 * straight-line relation within {@link CalculationTolerances#zeroRateToleranceEuros()} for a zero rate).
 * Recalculation produces a new configuration.
 */
public final class LoanConfiguration {

    private final LoanAmount amount;
    private final InterestRate annualRate;
    private final MonthCount termInMonths;
    private final Money monthlyPayment;

    private LoanConfiguration(LoanAmount amount, InterestRate annualRate, MonthCount termInMonths, Money monthlyPayment) {
        this.amount = amount;
        this.annualRate = annualRate;
        this.termInMonths = termInMonths;
        this.monthlyPayment = monthlyPayment;
    }

    public static Result<LoanConfiguration, LoanConfigurationError> of(
            LoanAmount amount, InterestRate annualRate, MonthCount termInMonths, Money monthlyPayment) {
        return of(amount, annualRate, termInMonths, monthlyPayment, CalculationTolerances.DEFAULT);
    }

    public static Result<LoanConfiguration, LoanConfigurationError> of(
            LoanAmount amount, InterestRate annualRate, MonthCount termInMonths, Money monthlyPayment,
            CalculationTolerances tolerances) {
        Objects.requireNonNull(amount, "amount must not be null");
        Objects.requireNonNull(annualRate, "annualRate must not be null");
        Objects.requireNonNull(termInMonths, "termInMonths must not be null");
        Objects.requireNonNull(monthlyPayment, "monthlyPayment must not be null");
        if (!isConsistent(amount, annualRate, termInMonths, monthlyPayment, tolerances)) {
            return Result.failure(LoanConfigurationError.INCONSISTENT_PARAMETERS);
        }
        return Result.success(new LoanConfiguration(amount, annualRate, termInMonths, monthlyPayment));
    }

    /**
     * Configuration whose monthly payment is the annuity payment rounded to the cent.
     */
    public static Result<LoanConfiguration, LoanConfigurationError> withAnnuityPayment(
            LoanAmount amount, InterestRate annualRate, MonthCount termInMonths) {
        double payment = AnnuityMath.annuityPayment(amount.toEuros(), annualRate.toMonthlyRate(), termInMonths.getValue());
        Result<Money, ?> money = Money.of(payment);
        if (money.isFailure()) {
            return Result.failure(LoanConfigurationError.INVALID_MONTHLY_PAYMENT);
        }
        return of(amount, annualRate, termInMonths, money.getValue());
    }

    /**
     * Builds a configuration from raw numbers. Each field is validated in order and mapped to its own error;
     * missing required fields are reported as {@code INCONSISTENT_PARAMETERS}.
     */
    public static Result<LoanConfiguration, LoanConfigurationError> fromInput(LoanConfigurationInput input) {
        return fromInput(input, CalculationTolerances.DEFAULT);
    }

    public static Result<LoanConfiguration, LoanConfigurationError> fromInput(
            LoanConfigurationInput input, CalculationTolerances tolerances) {
        boolean termProvided = input.termInMonths() != null || input.termInYears() != null;
        if (input.amount() == null || input.annualRate() == null || input.monthlyPayment() == null || !termProvided) {
            return Result.failure(LoanConfigurationError.INCONSISTENT_PARAMETERS);
        }

        Result<LoanAmount, ?> amount = LoanAmount.of(input.amount());
        if (amount.isFailure()) {
            return Result.failure(LoanConfigurationError.INVALID_LOAN_AMOUNT);
        }
        Result<InterestRate, ?> rate = InterestRate.of(input.annualRate());
        if (rate.isFailure()) {
            return Result.failure(LoanConfigurationError.INVALID_INTEREST_RATE);
        }
        Result<MonthCount, TermValidationError> term = input.termInMonths() != null
                ? MonthCount.of(input.termInMonths())
                : YearCount.of(input.termInYears()).flatMap(years -> MonthCount.of(years.toMonths()));
        if (term.isFailure()) {
            return Result.failure(LoanConfigurationError.INVALID_TERM);
        }
        Result<Money, ?> payment = Money.of(input.monthlyPayment());
        if (payment.isFailure()) {
            return Result.failure(LoanConfigurationError.INVALID_MONTHLY_PAYMENT);
        }

        double firstMonthInterest = amount.getValue().toEuros() * rate.getValue().toMonthlyRate();
        double paymentEuros = payment.getValue().toEuros();
        if (paymentEuros <= firstMonthInterest) {
            return Result.failure(LoanConfigurationError.PAYMENT_TOO_LOW);
        }
        if (paymentEuros > amount.getValue().toEuros() + firstMonthInterest) {
            return Result.failure(LoanConfigurationError.PAYMENT_TOO_HIGH);
        }
        return of(amount.getValue(), rate.getValue(), term.getValue(), payment.getValue(), tolerances);
    }

    private static boolean isConsistent(LoanAmount amount, InterestRate annualRate, MonthCount term, Money payment,
                                        CalculationTolerances tolerances) {
        double monthlyRate = annualRate.toMonthlyRate();
        double expected = AnnuityMath.annuityPayment(amount.toEuros(), monthlyRate, term.getValue());
        double tolerance = monthlyRate == 0
                ? tolerances.zeroRateToleranceEuros()
                : tolerances.configurationToleranceEuros();
        return Math.abs(payment.toEuros() - expected) <= tolerance;
    }

    public LoanAmount getAmount() {
        return amount;
    }

    public InterestRate getAnnualRate() {
        return annualRate;
    }

    public MonthCount getTermInMonths() {
        return termInMonths;
    }

    public Money getMonthlyPayment() {
        return monthlyPayment;
    }

    public LoanParameters parameters() {
        return LoanParameters.of(amount.toEuros(), annualRate.getValue(), termInMonths.getValue(), monthlyPayment.toEuros());
    }

    /** Differences {@code other - this}. */
    public LoanConfigurationDifference differenceTo(LoanConfiguration other) {
        LoanParameters a = parameters();
        LoanParameters b = other.parameters();
        return new LoanConfigurationDifference(
                b.amount() - a.amount(),
                b.annualRate() - a.annualRate(),
                b.termInMonths() - a.termInMonths(),
                b.monthlyPayment() - a.monthlyPayment());
    }

    public String format() {
        return "Darlehen: " + amount.format()
                + ", Zinssatz: " + annualRate.format()
                + ", Laufzeit: " + termInMonths.format()
                + ", Monatliche Rate: " + monthlyPayment.format();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        LoanConfiguration that = (LoanConfiguration) o;
        return amount.equals(that.amount)
                && annualRate.equals(that.annualRate)
                && termInMonths.equals(that.termInMonths)
                && monthlyPayment.equals(that.monthlyPayment);
    }

    @Override
    public int hashCode() {
        return Objects.hash(amount, annualRate, termInMonths, monthlyPayment);
    }

    @Override
    public String toString() {
        return format();
    }
}
