package com.baufi.sondertilgung;

import com.baufi.common.Result;
import com.baufi.domain.LoanAmount;
import com.baufi.domain.Money;
import com.baufi.domain.PaymentMonth;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;

/**
 * Scheduled extra payments under a yearly limit, sorted by month with at most one payment per month.
 * A percentage-limited plan needs at least one payment; an unlimited plan may be empty.
 */
public final class SondertilgungPlan {

    private final YearlyLimit yearlyLimit;
    private final List<ExtraPayment> payments;
    private final LoanAmount originalLoanAmount;

    private SondertilgungPlan(YearlyLimit yearlyLimit, List<ExtraPayment> payments, LoanAmount originalLoanAmount) {
        this.yearlyLimit = yearlyLimit;
        this.payments = payments;
        this.originalLoanAmount = originalLoanAmount;
    }

    public static Result<SondertilgungPlan, SondertilgungPlanError> of(YearlyLimit yearlyLimit,
                                                                       List<ExtraPayment> payments,
                                                                       LoanAmount originalLoanAmount) {
        Objects.requireNonNull(yearlyLimit, "yearlyLimit must not be null");
        Objects.requireNonNull(originalLoanAmount, "originalLoanAmount must not be null");
        if (payments == null || payments.isEmpty()) {
            if (yearlyLimit instanceof YearlyLimit.PercentageOfLoan) {
                return Result.failure(SondertilgungPlanError.NO_PAYMENTS);
            }
            return Result.success(new SondertilgungPlan(yearlyLimit, List.of(), originalLoanAmount));
        }
        Set<PaymentMonth> months = new HashSet<>();
        for (ExtraPayment payment : payments) {
            if (payment == null) {
                return Result.failure(SondertilgungPlanError.INVALID_PAYMENT_AMOUNT);
            }
            if (!months.add(payment.getMonth())) {
                return Result.failure(SondertilgungPlanError.DUPLICATE_PAYMENT_MONTH);
            }
        }
        Optional<Double> max = yearlyLimit.maxYearlyAmount(originalLoanAmount);
        if (max.isPresent()) {
            for (double yearTotal : yearlyTotals(payments).values()) {
                if (yearTotal > max.get()) {
                    return Result.failure(SondertilgungPlanError.EXCEEDS_YEARLY_LIMIT);
                }
            }
        }
        List<ExtraPayment> sorted = new ArrayList<>(payments);
        sorted.sort(ExtraPayment.BY_MONTH_THEN_AMOUNT);
        return Result.success(new SondertilgungPlan(yearlyLimit, List.copyOf(sorted), originalLoanAmount));
    }

    private static Map<Integer, Double> yearlyTotals(List<ExtraPayment> payments) {
        Map<Integer, Double> totals = new TreeMap<>();
        for (ExtraPayment payment : payments) {
            totals.merge(payment.paymentYear(), payment.amountInEuros(), Double::sum);
        }
        return totals;
    }

    public YearlyLimit getYearlyLimit() {
        return yearlyLimit;
    }

    public List<ExtraPayment> getPayments() {
        return payments;
    }

    public LoanAmount getOriginalLoanAmount() {
        return originalLoanAmount;
    }

    public boolean canAddPayment(ExtraPayment payment) {
        Optional<Double> max = yearlyLimit.maxYearlyAmount(originalLoanAmount);
        if (max.isEmpty()) {
            return true;
        }
        double used = yearlyTotals(payments).getOrDefault(payment.paymentYear(), 0.0);
        return used + payment.amountInEuros() <= max.get();
    }

    public Result<SondertilgungPlan, SondertilgungPlanError> addPayment(ExtraPayment payment) {
        for (ExtraPayment existing : payments) {
            if (existing.isSameMonth(payment)) {
                return Result.failure(SondertilgungPlanError.DUPLICATE_PAYMENT_MONTH);
            }
        }
        if (!canAddPayment(payment)) {
            return Result.failure(SondertilgungPlanError.EXCEEDS_YEARLY_LIMIT);
        }
        List<ExtraPayment> updated = new ArrayList<>(payments);
        updated.add(payment);
        updated.sort(ExtraPayment.BY_MONTH_THEN_AMOUNT);
        return Result.success(new SondertilgungPlan(yearlyLimit, List.copyOf(updated), originalLoanAmount));
    }

    /** Fails with {@code NO_PAYMENTS} when the last payment of a capped plan would be removed. */
    public Result<SondertilgungPlan, SondertilgungPlanError> removePayment(PaymentMonth month) {
        List<ExtraPayment> updated = new ArrayList<>();
        for (ExtraPayment payment : payments) {
            if (!payment.getMonth().equals(month)) {
                updated.add(payment);
            }
        }
        return of(yearlyLimit, updated, originalLoanAmount);
    }

    /** Remaining room in {@code year}, empty for an unlimited plan. */
    public Optional<Money> remainingYearlyLimit(int year) {
        Optional<Double> max = yearlyLimit.maxYearlyAmount(originalLoanAmount);
        if (max.isEmpty()) {
            return Optional.empty();
        }
        double used = yearlyTotals(payments).getOrDefault(year, 0.0);
        return Optional.of(Money.of(Math.max(0, max.get() - used)).orElseThrow());
    }

    public Money totalExtraPayments() {
        return ExtraPayment.total(payments).orElseThrow();
    }

    public List<YearlyPaymentSummary> yearlySummaries() {
        Map<Integer, List<ExtraPayment>> byYear = new TreeMap<>();
        for (ExtraPayment payment : payments) {
            byYear.computeIfAbsent(payment.paymentYear(), y -> new ArrayList<>()).add(payment);
        }
        List<YearlyPaymentSummary> summaries = new ArrayList<>();
        for (Map.Entry<Integer, List<ExtraPayment>> entry : byYear.entrySet()) {
            Money total = ExtraPayment.total(entry.getValue()).orElseThrow();
            int count = entry.getValue().size();
            Money average = Money.of(total.toEuros() / count).orElseThrow();
            double percent = total.toEuros() / originalLoanAmount.toEuros() * 100;
            summaries.add(new YearlyPaymentSummary(entry.getKey(), total, count, average, percent));
        }
        return List.copyOf(summaries);
    }

    /** "Sondertilgungsplan: 2 Zahlungen, Gesamt: 15.000,00 € (Maximal 5,00 % der Darlehenssumme pro Jahr)" */
    public String format() {
        return "Sondertilgungsplan: " + payments.size() + " Zahlungen, Gesamt: " + totalExtraPayments().format()
                + " (" + yearlyLimit.format() + ")";
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SondertilgungPlan that)) return false;
        return yearlyLimit.equals(that.yearlyLimit)
                && payments.equals(that.payments)
                && originalLoanAmount.equals(that.originalLoanAmount);
    }

    @Override
    public int hashCode() {
        return Objects.hash(yearlyLimit, payments, originalLoanAmount);
    }

    @Override
    public String toString() {
        return format();
    }
}
