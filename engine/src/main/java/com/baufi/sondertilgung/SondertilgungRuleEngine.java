package com.baufi.sondertilgung;

import com.baufi.common.Result;
import com.baufi.domain.LoanAmount;
import com.baufi.domain.Money;
import com.baufi.loan.FixedRatePeriod;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Objects;

/**
 * Admissibility and pricing of extra payments under a bank's {@link GermanSondertilgungRules}.
 * <p>
 * The yearly cap counts every existing payment of the same loan-year (year = ceil(month / 12)) together with the
 * candidate and compares the sum with loan × largest allowed tier / 100.
 */
@Service
@Slf4j
public class SondertilgungRuleEngine {

    static final String TIMING_IMMEDIATELY = "Sofort";
    static final String TIMING_BEFORE_PERIOD_END = "Vor Zinsbindungsende";
    static final String TIMING_DURING_PERIOD = "Während der Zinsbindung";

    static final String RISK_LOW = "Niedrig";
    static final String RISK_MEDIUM = "Mittel";
    static final String RISK_HIGH = "Hoch";

    private static final double SHORT_REMAINING_PERIOD_YEARS = 5;
    private static final BigDecimal ESTIMATED_RATE = new BigDecimal("0.03");
    private static final BigDecimal ESTIMATION_YEARS = BigDecimal.TEN;

    public Result<Void, SondertilgungValidationError> validatePayment(GermanSondertilgungRules rules,
                                                                       ExtraPayment payment,
                                                                       LoanAmount originalLoanAmount,
                                                                       List<ExtraPayment> existingPayments) {
        return validatePayment(rules, payment, originalLoanAmount, existingPayments, null, null);
    }

    /**
     * Checks in order: bank offers Sondertilgung at all, minimum amount, maximum amount, yearly cap, grace period.
     * The grace period is only checked when both {@code fixedRatePeriod} and {@code evaluationDate} are given.
     *
     * @param existingPayments payments already planned for this loan; only those of the same loan-year count
     */
    public Result<Void, SondertilgungValidationError> validatePayment(GermanSondertilgungRules rules,
                                                                       ExtraPayment payment,
                                                                       LoanAmount originalLoanAmount,
                                                                       List<ExtraPayment> existingPayments,
                                                                       FixedRatePeriod fixedRatePeriod,
                                                                       LocalDate evaluationDate) {
        Objects.requireNonNull(rules, "rules must not be null");
        Objects.requireNonNull(payment, "payment must not be null");
        Objects.requireNonNull(originalLoanAmount, "originalLoanAmount must not be null");

        if (rules.allowedPercentages().isEmpty()) {
            return Result.failure(SondertilgungValidationError.NOT_ALLOWED_FOR_BANK_TYPE);
        }
        if (payment.getAmount().compareTo(rules.minimumAmount()) < 0) {
            return Result.failure(SondertilgungValidationError.BELOW_MINIMUM_AMOUNT);
        }
        if (rules.maximumAmount() != null && payment.getAmount().compareTo(rules.maximumAmount()) > 0) {
            return Result.failure(SondertilgungValidationError.ABOVE_MAXIMUM_AMOUNT);
        }
        BigDecimal yearlyTotal = yearlyTotal(payment, existingPayments);
        BigDecimal cap = rules.maxYearlyAmount(originalLoanAmount);
        if (yearlyTotal.compareTo(cap) > 0) {
            log.debug("Yearly Sondertilgung {} exceeds cap {} for {} in year {}",
                    yearlyTotal, cap, rules.bankType(), payment.paymentYear());
            return Result.failure(SondertilgungValidationError.EXCEEDS_ALLOWED_PERCENTAGE);
        }
        if (fixedRatePeriod != null && evaluationDate != null) {
            LocalDate graceEnd = fixedRatePeriod.getStartDate()
                    .plusMonths(rules.timingRestrictions().gracePeriodMonths());
            if (evaluationDate.isBefore(graceEnd)) {
                return Result.failure(SondertilgungValidationError.WITHIN_GRACE_PERIOD);
            }
        }
        return Result.success(null);
    }

    /**
     * Calendar checks for the actual payment date.
     *
     * @param loanStartDate month 1 of the loan; blackout periods are counted from here
     */
    public Result<Void, SondertilgungValidationError> validatePaymentDate(GermanSondertilgungRules rules,
                                                                           LocalDate paymentDate,
                                                                           LocalDate loanStartDate) {
        TimingRestrictions timing = rules.timingRestrictions();
        int loanMonth = (int) ChronoUnit.MONTHS.between(loanStartDate.withDayOfMonth(1), paymentDate.withDayOfMonth(1)) + 1;
        for (BlackoutPeriod blackout : timing.blackoutPeriods()) {
            if (blackout.contains(loanMonth)) {
                return Result.failure(SondertilgungValidationError.DURING_BLACKOUT_PERIOD);
            }
        }
        if (!timing.allowedPaymentDates().allows(paymentDate)) {
            return Result.failure(SondertilgungValidationError.INVALID_PAYMENT_DATE);
        }
        return Result.success(null);
    }

    public Result<Void, SondertilgungValidationError> validateNotice(GermanSondertilgungRules rules,
                                                                      LocalDate noticeDate,
                                                                      LocalDate paymentDate) {
        long days = ChronoUnit.DAYS.between(noticeDate, paymentDate);
        if (days < rules.timingRestrictions().noticeRequiredDays()) {
            return Result.failure(SondertilgungValidationError.INSUFFICIENT_NOTICE);
        }
        return Result.success(null);
    }

    /**
     * Fee for {@code payment}. The excess is the part of the loan-year total (including existing payments of that
     * year) above the yearly cap; min/max clamps of the fee structure apply last.
     */
    public Result<Money, SondertilgungValidationError> calculateFees(GermanSondertilgungRules rules,
                                                                     ExtraPayment payment,
                                                                     LoanAmount originalLoanAmount,
                                                                     List<ExtraPayment> existingPayments) {
        BigDecimal excess = yearlyTotal(payment, existingPayments)
                .subtract(rules.maxYearlyAmount(originalLoanAmount))
                .max(BigDecimal.ZERO);
        BigDecimal fee = rules.feeStructure().feeEuros(payment.getAmount().toBigDecimal(), excess);
        return Money.of(fee.setScale(2, RoundingMode.HALF_UP))
                .mapError(e -> SondertilgungValidationError.EXCESSIVE_FEE_AMOUNT);
    }

    /**
     * Largest tier whose euro value fits {@code availableAmount}; the smallest tier when none fits.
     */
    public Result<SondertilgungStrategy, SondertilgungValidationError> recommendStrategy(
            GermanSondertilgungRules rules, LoanAmount originalLoanAmount, Money availableAmount,
            FixedRatePeriod fixedRatePeriod, LocalDate asOf) {
        List<Integer> tiers = rules.allowedPercentages();
        if (tiers.isEmpty()) {
            return Result.failure(SondertilgungValidationError.NOT_ALLOWED_FOR_BANK_TYPE);
        }
        BigDecimal loan = originalLoanAmount.toMoney().toBigDecimal();
        BigDecimal available = availableAmount.toBigDecimal();

        int recommended = tiers.get(0);
        for (int tier : tiers) {
            if (tierAmount(loan, tier).compareTo(available) <= 0) {
                recommended = tier;
            }
        }
        BigDecimal amount = tierAmount(loan, recommended);
        long expectedSavings = amount.multiply(ESTIMATED_RATE).multiply(ESTIMATION_YEARS)
                .setScale(0, RoundingMode.HALF_UP).longValueExact();

        SondertilgungStrategy strategy = new SondertilgungStrategy(recommended, Money.of(amount).orElseThrow(),
                timing(fixedRatePeriod, asOf), expectedSavings, risk(recommended));
        log.debug("Recommended {} % Sondertilgung for {} ({})", recommended, rules.bankType(), strategy.optimalTiming());
        return Result.success(strategy);
    }

    private static String timing(FixedRatePeriod period, LocalDate asOf) {
        if (period == null || asOf == null || !period.isActive(asOf)) {
            return TIMING_IMMEDIATELY;
        }
        return period.remainingYears(asOf) <= SHORT_REMAINING_PERIOD_YEARS
                ? TIMING_BEFORE_PERIOD_END
                : TIMING_DURING_PERIOD;
    }

    private static String risk(int percentage) {
        if (percentage <= 10) {
            return RISK_LOW;
        }
        return percentage <= 20 ? RISK_MEDIUM : RISK_HIGH;
    }

    private static BigDecimal tierAmount(BigDecimal loan, int percentage) {
        return loan.multiply(BigDecimal.valueOf(percentage)).divide(FeeStructure.HUNDRED, 2, RoundingMode.HALF_UP);
    }

    private static BigDecimal yearlyTotal(ExtraPayment payment, List<ExtraPayment> existingPayments) {
        BigDecimal total = payment.getAmount().toBigDecimal();
        if (existingPayments == null) {
            return total;
        }
        int year = payment.paymentYear();
        for (ExtraPayment existing : existingPayments) {
            if (existing.paymentYear() == year) {
                total = total.add(existing.getAmount().toBigDecimal());
            }
        }
        return total;
    }
}
