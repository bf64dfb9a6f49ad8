package com.baufi.loan;

import com.baufi.common.Result;
import com.baufi.domain.InterestRate;
import com.baufi.domain.LoanAmount;
import com.baufi.domain.Money;
import com.baufi.domain.MonthCount;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;

/**
 * Closed-form annuity calculations on validated configurations. Decimal arithmetic uses 20 significant
 * digits, half-up; logarithms fall back to double precision.
 */
@Component
public class LoanCalculations {

    private static final MathContext MC = new MathContext(20, RoundingMode.HALF_UP);
    private static final BigDecimal TWELVE = BigDecimal.valueOf(12);
    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    private static final BigDecimal RATE_SEARCH_LOWER = new BigDecimal("0.0001");
    private static final BigDecimal RATE_SEARCH_UPPER = new BigDecimal("0.30");
    private static final int RATE_SEARCH_MAX_ITERATIONS = 50;
    private static final BigDecimal RATE_SEARCH_TOLERANCE_EUROS = new BigDecimal("0.01");

    /**
     * Annuity payment of the configuration split for the first month. A zero rate pays amount / term.
     */
    public Result<MonthlyPayment, LoanCalculationError> calculateMonthlyPayment(LoanConfiguration configuration) {
        BigDecimal amount = configuration.getAmount().toMoney().toBigDecimal();
        BigDecimal annualRate = BigDecimal.valueOf(configuration.getAnnualRate().toDecimal());
        int term = configuration.getTermInMonths().getValue();
        return monthlyPayment(amount, annualRate, term);
    }

    private Result<MonthlyPayment, LoanCalculationError> monthlyPayment(BigDecimal amount, BigDecimal annualRate, int term) {
        if (annualRate.signum() == 0) {
            BigDecimal payment = amount.divide(BigDecimal.valueOf(term), MC);
            return MonthlyPayment.of(payment.doubleValue(), 0)
                    .mapError(e -> LoanCalculationError.MATHEMATICAL_ERROR);
        }
        BigDecimal monthlyRate = annualRate.divide(TWELVE, MC);
        BigDecimal payment = annuity(amount, monthlyRate, term);
        if (payment == null) {
            return Result.failure(LoanCalculationError.MATHEMATICAL_ERROR);
        }
        BigDecimal firstInterest = amount.multiply(monthlyRate, MC);
        BigDecimal firstPrincipal = payment.subtract(firstInterest, MC);
        return MonthlyPayment.of(firstPrincipal.doubleValue(), firstInterest.doubleValue())
                .mapError(e -> LoanCalculationError.MATHEMATICAL_ERROR);
    }

    /**
     * Number of payments needed: n = -ln(1 - L*c/P) / ln(1 + c), rounded up.
     */
    public Result<MonthCount, LoanCalculationError> calculateLoanTerm(LoanAmount loanAmount, InterestRate annualRate,
                                                                      Money monthlyPayment) {
        double amount = loanAmount.toEuros();
        double payment = monthlyPayment.toEuros();
        if (payment <= 0) {
            return Result.failure(LoanCalculationError.INSUFFICIENT_PAYMENT);
        }
        double monthlyRate = annualRate.toMonthlyRate();
        if (payment <= amount * monthlyRate) {
            return Result.failure(LoanCalculationError.INSUFFICIENT_PAYMENT);
        }
        double months = -Math.log(1 - amount * monthlyRate / payment) / Math.log(1 + monthlyRate);
        if (!Double.isFinite(months) || months <= 0) {
            return Result.failure(LoanCalculationError.MATHEMATICAL_ERROR);
        }
        return MonthCount.of(Math.ceil(months))
                .mapError(e -> LoanCalculationError.INVALID_PARAMETERS);
    }

    /**
     * Solves the annuity formula for the rate by bisection between 0,01 % and 30 % p.a.
     */
    public Result<InterestRate, LoanCalculationError> calculateInterestRate(LoanAmount loanAmount, Money monthlyPayment,
                                                                            MonthCount termInMonths) {
        BigDecimal amount = loanAmount.toMoney().toBigDecimal();
        BigDecimal payment = monthlyPayment.toBigDecimal();
        int months = termInMonths.getValue();
        if (payment.signum() <= 0) {
            return Result.failure(LoanCalculationError.INVALID_PARAMETERS);
        }

        BigDecimal zeroInterestPayment = amount.divide(BigDecimal.valueOf(months), MC);
        if (payment.subtract(zeroInterestPayment).abs().compareTo(RATE_SEARCH_TOLERANCE_EUROS) < 0) {
            // a zero rate is below the smallest representable InterestRate
            return Result.failure(LoanCalculationError.INVALID_PARAMETERS);
        }
        if (payment.compareTo(zeroInterestPayment) < 0) {
            return Result.failure(LoanCalculationError.INSUFFICIENT_PAYMENT);
        }

        BigDecimal lower = RATE_SEARCH_LOWER;
        BigDecimal upper = RATE_SEARCH_UPPER;
        BigDecimal lowerPayment = annuity(amount, lower.divide(TWELVE, MC), months);
        BigDecimal upperPayment = annuity(amount, upper.divide(TWELVE, MC), months);
        if (lowerPayment == null || upperPayment == null
                || payment.compareTo(lowerPayment) < 0 || payment.compareTo(upperPayment) > 0) {
            return Result.failure(LoanCalculationError.MATHEMATICAL_ERROR);
        }

        for (int i = 0; i < RATE_SEARCH_MAX_ITERATIONS; i++) {
            BigDecimal mid = lower.add(upper).divide(BigDecimal.valueOf(2), MC);
            BigDecimal midPayment = annuity(amount, mid.divide(TWELVE, MC), months);
            if (midPayment == null) {
                return Result.failure(LoanCalculationError.MATHEMATICAL_ERROR);
            }
            BigDecimal error = midPayment.subtract(payment);
            if (error.abs().compareTo(RATE_SEARCH_TOLERANCE_EUROS) < 0) {
                return InterestRate.of(mid.multiply(HUNDRED).doubleValue())
                        .mapError(e -> LoanCalculationError.INVALID_PARAMETERS);
            }
            if (error.signum() > 0) {
                upper = mid;
            } else {
                lower = mid;
            }
        }
        return Result.failure(LoanCalculationError.MATHEMATICAL_ERROR);
    }

    /** Regular payment times term minus principal. */
    public Result<Money, LoanCalculationError> calculateTotalInterest(LoanConfiguration configuration) {
        return calculateMonthlyPayment(configuration).flatMap(payment -> {
            BigDecimal total = payment.getTotal().toBigDecimal()
                    .multiply(BigDecimal.valueOf(configuration.getTermInMonths().getValue()));
            BigDecimal interest = total.subtract(configuration.getAmount().toMoney().toBigDecimal());
            return Money.of(interest).mapError(e -> LoanCalculationError.MATHEMATICAL_ERROR);
        });
    }

    /**
     * Balance after {@code paymentsMade} regular payments: L((1+c)^n - (1+c)^p) / ((1+c)^n - 1).
     */
    public Result<Money, LoanCalculationError> calculateRemainingBalance(LoanConfiguration configuration, int paymentsMade) {
        if (paymentsMade < 0) {
            return Result.failure(LoanCalculationError.INVALID_PARAMETERS);
        }
        int term = configuration.getTermInMonths().getValue();
        if (paymentsMade >= term) {
            return Result.success(Money.ZERO);
        }
        BigDecimal amount = configuration.getAmount().toMoney().toBigDecimal();
        BigDecimal annualRate = BigDecimal.valueOf(configuration.getAnnualRate().toDecimal());
        BigDecimal remaining;
        if (annualRate.signum() == 0) {
            BigDecimal monthlyPrincipal = amount.divide(BigDecimal.valueOf(term), MC);
            remaining = amount.subtract(monthlyPrincipal.multiply(BigDecimal.valueOf(paymentsMade)), MC);
        } else {
            BigDecimal onePlusRate = BigDecimal.ONE.add(annualRate.divide(TWELVE, MC));
            BigDecimal factorTerm = onePlusRate.pow(term, MC);
            BigDecimal factorMade = onePlusRate.pow(paymentsMade, MC);
            remaining = amount.multiply(factorTerm.subtract(factorMade), MC)
                    .divide(factorTerm.subtract(BigDecimal.ONE), MC);
        }
        return Money.of(remaining.max(BigDecimal.ZERO)).mapError(e -> LoanCalculationError.MATHEMATICAL_ERROR);
    }

    /**
     * Months until refinancing costs are recovered by the lower payment of {@code newLoan}. Without costs the
     * first month already breaks even. A break-even beyond the maximum term fails with {@code INVALID_PARAMETERS}.
     */
    public Result<MonthCount, LoanCalculationError> calculateBreakEvenPoint(LoanConfiguration currentLoan,
                                                                            LoanConfiguration newLoan,
                                                                            Money refinancingCosts) {
        Result<MonthlyPayment, LoanCalculationError> current = calculateMonthlyPayment(currentLoan);
        if (current.isFailure()) {
            return Result.failure(current.getError());
        }
        Result<MonthlyPayment, LoanCalculationError> next = calculateMonthlyPayment(newLoan);
        if (next.isFailure()) {
            return Result.failure(next.getError());
        }
        BigDecimal currentPayment = current.getValue().getTotal().toBigDecimal();
        BigDecimal newPayment = next.getValue().getTotal().toBigDecimal();
        if (currentPayment.compareTo(newPayment) <= 0) {
            return Result.failure(LoanCalculationError.INVALID_PARAMETERS);
        }
        BigDecimal savings = currentPayment.subtract(newPayment);
        BigDecimal months = refinancingCosts.toBigDecimal().divide(savings, 0, RoundingMode.CEILING).max(BigDecimal.ONE);
        return MonthCount.of(months.doubleValue()).mapError(e -> LoanCalculationError.INVALID_PARAMETERS);
    }

    /**
     * First-month payment for each variation of {@code baseLoan}; fails on the first invalid variation.
     */
    public Result<List<MonthlyPayment>, LoanCalculationError> calculatePaymentScenarios(LoanConfiguration baseLoan,
                                                                                        List<PaymentScenario> scenarios) {
        List<MonthlyPayment> payments = new ArrayList<>();
        for (PaymentScenario scenario : scenarios) {
            double amount = baseLoan.getAmount().toEuros() * scenario.amountMultiplier();
            double rate = baseLoan.getAnnualRate().getValue() + scenario.rateAdjustment();
            int term = baseLoan.getTermInMonths().getValue() + scenario.termAdjustmentMonths();

            Result<LoanAmount, ?> adjustedAmount = LoanAmount.of(amount);
            Result<InterestRate, ?> adjustedRate = InterestRate.of(rate);
            Result<MonthCount, ?> adjustedTerm = MonthCount.of(term);
            if (adjustedAmount.isFailure() || adjustedRate.isFailure() || adjustedTerm.isFailure()) {
                return Result.failure(LoanCalculationError.INVALID_PARAMETERS);
            }
            Result<MonthlyPayment, LoanCalculationError> payment = monthlyPayment(
                    adjustedAmount.getValue().toMoney().toBigDecimal(),
                    BigDecimal.valueOf(adjustedRate.getValue().toDecimal()),
                    adjustedTerm.getValue().getValue());
            if (payment.isFailure()) {
                return Result.failure(payment.getError());
            }
            payments.add(payment.getValue());
        }
        return Result.success(List.copyOf(payments));
    }

    /** Null when the denominator vanishes. */
    private static BigDecimal annuity(BigDecimal amount, BigDecimal monthlyRate, int term) {
        BigDecimal factor = BigDecimal.ONE.add(monthlyRate).pow(term, MC);
        BigDecimal denominator = factor.subtract(BigDecimal.ONE);
        if (denominator.signum() == 0) {
            return null;
        }
        return amount.multiply(monthlyRate, MC).multiply(factor, MC).divide(denominator, MC);
    }
}
