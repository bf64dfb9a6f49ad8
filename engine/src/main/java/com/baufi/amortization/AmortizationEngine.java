package com.baufi.amortization;

import com.baufi.common.Result;
import com.baufi.config.CaffeineConfig;
import com.baufi.domain.Money;
import com.baufi.domain.PaymentMonth;
import com.baufi.loan.AnnuityMath;
import com.baufi.loan.LoanConfiguration;
import com.baufi.loan.LoanParameters;
import com.baufi.sondertilgung.ExtraPayment;
import com.baufi.sondertilgung.SondertilgungPlan;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalInt;

/**
 * Derives month-by-month balances of an annuity loan under optional extra payments. The schedule is a sequential
 * fold over months, bounded by the contractual term:
 * <ol>
 *   <li>interest = balance × monthly rate (zero-rate loans pay amount / term principal)</li>
 *   <li>principal = payment − interest, capped at the balance; the last contractual month settles the balance</li>
 *   <li>an extra payment of the month reduces the balance further, capped at what is left</li>
 * </ol>
 * Amounts are carried unrounded at {@value #SCALE} decimals so that the principal components add up to the loan.
 */
@Service
@Slf4j
public class AmortizationEngine {

    private static final int SCALE = 10;
    private static final RoundingMode ROUNDING = RoundingMode.HALF_UP;
    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);
    private static final BigDecimal MONTHS_PER_YEAR_PERCENT = BigDecimal.valueOf(1200);

    /** Balances below half a cent are settled in the month they occur. */
    private static final BigDecimal RESIDUE = new BigDecimal("0.005");

    private static final double WORTHWHILE_RETURN_PERCENT = 2.0;

    @Cacheable(cacheNames = CaffeineConfig.AMORTIZATION_SCHEDULE_CACHE)
    public Result<AmortizationSchedule, AmortizationError> generateSchedule(LoanConfiguration configuration) {
        return generateSchedule(configuration.parameters(), List.of());
    }

    public Result<AmortizationSchedule, AmortizationError> generateSchedule(LoanConfiguration configuration,
                                                                            SondertilgungPlan plan) {
        return generateSchedule(configuration.parameters(), plan.getPayments());
    }

    public Result<AmortizationSchedule, AmortizationError> generateSchedule(LoanConfiguration configuration,
                                                                            List<ExtraPayment> extraPayments) {
        return generateSchedule(configuration.parameters(), extraPayments);
    }

    /**
     * Full schedule for raw parameters.
     *
     * @param extraPayments strictly increasing by month; payments after payoff are ignored
     */
    public Result<AmortizationSchedule, AmortizationError> generateSchedule(LoanParameters parameters,
                                                                            List<ExtraPayment> extraPayments) {
        Result<List<AmortizationEntry>, AmortizationError> entries = fold(parameters, extraPayments, parameters.termInMonths());
        if (entries.isFailure()) {
            return Result.failure(entries.getError());
        }
        Result<List<AmortizationEntry>, AmortizationError> baseline = extraPayments.isEmpty()
                ? entries
                : fold(parameters, List.of(), parameters.termInMonths());
        if (baseline.isFailure()) {
            return Result.failure(baseline.getError());
        }
        ScheduleMetrics metrics = metrics(parameters, entries.getValue(), baseline.getValue());
        log.debug("Schedule generated: {} months, total interest {}, {} extra payment(s)",
                metrics.actualTermMonths(), metrics.totalInterestPaid().setScale(2, ROUNDING), extraPayments.size());
        return Result.success(new AmortizationSchedule(parameters, extraPayments, entries.getValue(), metrics));
    }

    private Result<List<AmortizationEntry>, AmortizationError> fold(LoanParameters parameters,
                                                                   List<ExtraPayment> extraPayments,
                                                                   int maxMonths) {
        if (parameters.amount() <= 0 || parameters.termInMonths() < 1 || parameters.monthlyPayment() <= 0
                || parameters.annualRate() < 0) {
            return Result.failure(AmortizationError.INVALID_LOAN_PARAMETERS);
        }
        Map<Integer, BigDecimal> extras = new HashMap<>();
        int previousMonth = 0;
        for (ExtraPayment extra : extraPayments) {
            if (extra.monthNumber() <= previousMonth) {
                return Result.failure(AmortizationError.UNORDERED_EXTRA_PAYMENTS);
            }
            previousMonth = extra.monthNumber();
            extras.put(extra.monthNumber(), extra.getAmount().toBigDecimal());
        }

        int term = parameters.termInMonths();
        BigDecimal amount = BigDecimal.valueOf(parameters.amount());
        BigDecimal payment = BigDecimal.valueOf(parameters.monthlyPayment());
        BigDecimal monthlyRate = BigDecimal.valueOf(parameters.annualRate()).divide(MONTHS_PER_YEAR_PERCENT, MathContext.DECIMAL128);
        boolean zeroRate = monthlyRate.signum() == 0;
        BigDecimal straightLinePrincipal = zeroRate ? amount.divide(BigDecimal.valueOf(term), SCALE, ROUNDING) : null;

        if (!zeroRate && payment.compareTo(amount.multiply(monthlyRate)) <= 0) {
            log.warn("Monthly payment {} does not cover first month's interest on {} at {} %",
                    payment, amount, parameters.annualRate());
            return Result.failure(AmortizationError.PAYMENT_DOES_NOT_COVER_INTEREST);
        }

        List<AmortizationEntry> entries = new ArrayList<>();
        BigDecimal balance = amount;
        BigDecimal cumulativeInterest = BigDecimal.ZERO;
        BigDecimal cumulativePrincipal = BigDecimal.ZERO;
        int lastMonth = Math.min(term, maxMonths);

        for (int month = 1; month <= lastMonth && balance.signum() > 0; month++) {
            BigDecimal startingBalance = balance;
            BigDecimal interest = zeroRate
                    ? BigDecimal.ZERO
                    : balance.multiply(monthlyRate).setScale(SCALE, ROUNDING);
            BigDecimal regularPrincipal = zeroRate ? straightLinePrincipal : payment.subtract(interest);
            if (month == term || regularPrincipal.compareTo(balance) > 0) {
                regularPrincipal = balance;
            }
            BigDecimal extra = extras.getOrDefault(month, BigDecimal.ZERO).min(balance.subtract(regularPrincipal));
            BigDecimal principal = regularPrincipal.add(extra);
            balance = balance.subtract(principal);
            if (balance.compareTo(RESIDUE) < 0) {
                principal = principal.add(balance);
                balance = BigDecimal.ZERO;
            }
            BigDecimal total = interest.add(principal);
            cumulativeInterest = cumulativeInterest.add(interest);
            cumulativePrincipal = cumulativePrincipal.add(principal);

            double principalShare = total.signum() == 0
                    ? 100
                    : principal.multiply(HUNDRED).divide(total, SCALE, ROUNDING).doubleValue();
            entries.add(new AmortizationEntry(month, startingBalance, interest, principal, extra, total, balance,
                    cumulativeInterest, cumulativePrincipal, Math.min(100, principalShare),
                    remainingMonths(parameters, balance, term - month)));
        }
        return Result.success(entries);
    }

    /** Analytic months to repay {@code balance}, never beyond the contractual end. */
    private static int remainingMonths(LoanParameters parameters, BigDecimal balance, int contractualRemaining) {
        if (balance.signum() == 0) {
            return 0;
        }
        double payment = parameters.isZeroRate()
                ? parameters.amount() / parameters.termInMonths()
                : parameters.monthlyPayment();
        OptionalInt months = AnnuityMath.monthsToRepay(balance.doubleValue(), parameters.monthlyRate(), payment);
        return Math.min(months.orElse(contractualRemaining), contractualRemaining);
    }

    private ScheduleMetrics metrics(LoanParameters parameters, List<AmortizationEntry> entries,
                                    List<AmortizationEntry> baseline) {
        AmortizationEntry last = entries.get(entries.size() - 1);
        BigDecimal totalExtra = BigDecimal.ZERO;
        BigDecimal totalPayments = BigDecimal.ZERO;
        BigDecimal largest = entries.get(0).totalPayment();
        BigDecimal smallest = entries.get(0).totalPayment();
        for (AmortizationEntry entry : entries) {
            totalExtra = totalExtra.add(entry.extraPayment());
            totalPayments = totalPayments.add(entry.totalPayment());
            largest = largest.max(entry.totalPayment());
            smallest = smallest.min(entry.totalPayment());
        }
        BigDecimal baselineInterest = baseline.get(baseline.size() - 1).cumulativeInterest();
        BigDecimal interestSaved = baselineInterest.subtract(last.cumulativeInterest()).max(BigDecimal.ZERO);
        int actualTerm = entries.size();
        int termReduction = Math.max(0, baseline.size() - actualTerm);
        double effectiveRate = totalExtra.signum() > 0
                ? interestSaved.multiply(HUNDRED).divide(totalExtra, SCALE, ROUNDING).doubleValue()
                : parameters.annualRate();
        BigDecimal average = totalPayments.divide(BigDecimal.valueOf(actualTerm), SCALE, ROUNDING);
        return new ScheduleMetrics(last.cumulativeInterest(), last.cumulativePrincipal(), totalExtra, totalPayments,
                actualTerm, interestSaved, termReduction, effectiveRate, average, largest, smallest,
                (actualTerm - 1) / 12 + 1, (actualTerm - 1) % 12 + 1);
    }

    public ScheduleComparison compareSchedules(AmortizationSchedule base, AmortizationSchedule comparison) {
        BigDecimal savings = base.totalInterest().subtract(comparison.totalInterest());
        int termReduction = base.actualTermMonths() - comparison.actualTermMonths();
        BigDecimal extraTotal = comparison.metrics().totalExtraPayments();
        double roi = extraTotal.signum() > 0
                ? savings.multiply(HUNDRED).divide(extraTotal, SCALE, ROUNDING).doubleValue()
                : 0;
        return new ScheduleComparison(base, comparison, savings.max(BigDecimal.ZERO), Math.max(0, termReduction),
                roi, savings.signum() > 0 && roi > WORTHWHILE_RETURN_PERCENT);
    }

    public Result<SondertilgungImpact, AmortizationError> analyzeSondertilgungImpact(LoanConfiguration configuration,
                                                                                    String name,
                                                                                    SondertilgungPlan plan) {
        Result<AmortizationSchedule, AmortizationError> base = generateSchedule(configuration.parameters(), List.of());
        if (base.isFailure()) {
            return Result.failure(base.getError());
        }
        return generateSchedule(configuration, plan)
                .map(withPlan -> new SondertilgungImpact(name, plan, compareSchedules(base.getValue(), withPlan)));
    }

    /**
     * Impact of each named plan, best interest saving first.
     */
    public Result<List<SondertilgungImpact>, AmortizationError> compareStrategies(LoanConfiguration configuration,
                                                                                 Map<String, SondertilgungPlan> plans) {
        List<SondertilgungImpact> impacts = new ArrayList<>();
        for (Map.Entry<String, SondertilgungPlan> plan : new LinkedHashMap<>(plans).entrySet()) {
            Result<SondertilgungImpact, AmortizationError> impact =
                    analyzeSondertilgungImpact(configuration, plan.getKey(), plan.getValue());
            if (impact.isFailure()) {
                return Result.failure(impact.getError());
            }
            impacts.add(impact.getValue());
        }
        impacts.sort(Comparator.comparing(
                (SondertilgungImpact i) -> i.comparison().interestSavings()).reversed());
        return Result.success(List.copyOf(impacts));
    }

    /**
     * Largest useful single extra payment in {@code month}: the available funds, at most the balance outstanding
     * at the start of that month.
     */
    public Result<Money, AmortizationError> optimalExtraPayment(LoanConfiguration configuration, PaymentMonth month,
                                                               Money available) {
        return generateSchedule(configuration.parameters(), List.of())
                .flatMap(schedule -> schedule.entry(month))
                .map(entry -> {
                    BigDecimal cap = entry.startingBalance().setScale(2, RoundingMode.DOWN);
                    return Money.of(available.toBigDecimal().min(cap)).orElseThrow();
                });
    }

    public Result<LoanProgress, AmortizationError> queryProgress(LoanConfiguration configuration,
                                                                 List<ExtraPayment> extraPayments,
                                                                 LocalDate startDate, LocalDate asOf) {
        return queryProgress(configuration.parameters(), extraPayments, startDate, asOf, false);
    }

    /**
     * Replays the schedule up to {@code asOf} and derives the rest analytically.
     * Elapsed months are whole calendar months between the two dates (never negative); the remaining term comes from
     * the inverse annuity formula, so the future schedule is only built when {@code includeRemainingSchedule} is set.
     */
    public Result<LoanProgress, AmortizationError> queryProgress(LoanParameters parameters,
                                                                 List<ExtraPayment> extraPayments,
                                                                 LocalDate startDate, LocalDate asOf,
                                                                 boolean includeRemainingSchedule) {
        int monthsElapsed = Math.max(0,
                (asOf.getYear() - startDate.getYear()) * 12 + asOf.getMonthValue() - startDate.getMonthValue());
        int replayed = Math.min(monthsElapsed, parameters.termInMonths());
        int foldLimit = includeRemainingSchedule ? parameters.termInMonths() : replayed;

        Result<List<AmortizationEntry>, AmortizationError> folded = fold(parameters, extraPayments, foldLimit);
        if (folded.isFailure()) {
            return Result.failure(folded.getError());
        }
        List<AmortizationEntry> entries = folded.getValue();
        List<AmortizationEntry> elapsed = entries.subList(0, Math.min(replayed, entries.size()));

        BigDecimal balance = elapsed.isEmpty()
                ? BigDecimal.valueOf(parameters.amount())
                : elapsed.get(elapsed.size() - 1).remainingBalance();
        BigDecimal interestPaid = elapsed.isEmpty()
                ? BigDecimal.ZERO
                : elapsed.get(elapsed.size() - 1).cumulativeInterest();
        int remaining = remainingMonths(parameters, balance, parameters.termInMonths() - replayed);

        BigDecimal regularPayment = BigDecimal.valueOf(parameters.monthlyPayment());
        BigDecimal remainingInterest = regularPayment.multiply(BigDecimal.valueOf(remaining))
                .subtract(balance).max(BigDecimal.ZERO);
        List<AmortizationEntry> future = includeRemainingSchedule
                ? entries.subList(elapsed.size(), entries.size())
                : List.of();
        return Result.success(new LoanProgress(balance, monthsElapsed, remaining, asOf.plusMonths(remaining),
                interestPaid, remainingInterest, future));
    }
}
