package com.baufi.amortization;

import com.baufi.common.Result;
import com.baufi.domain.PaymentMonth;
import com.baufi.loan.LoanParameters;
import com.baufi.sondertilgung.ExtraPayment;

import java.math.BigDecimal;
import java.util.List;

/**
 * Month-by-month repayment of a loan under a set of extra payments. Entries are consecutive from month 1.
 */
public record AmortizationSchedule(
        LoanParameters parameters,
        List<ExtraPayment> extraPayments,
        List<AmortizationEntry> entries,
        ScheduleMetrics metrics
) {

    public AmortizationSchedule {
        extraPayments = List.copyOf(extraPayments);
        entries = List.copyOf(entries);
    }

    public int actualTermMonths() {
        return entries.size();
    }

    public BigDecimal totalInterest() {
        return metrics.totalInterestPaid();
    }

    public boolean isFullyRepaid() {
        return !entries.isEmpty() && entries.get(entries.size() - 1).remainingBalance().signum() == 0;
    }

    public Result<AmortizationEntry, AmortizationError> entry(PaymentMonth month) {
        return entry(month.getValue());
    }

    public Result<AmortizationEntry, AmortizationError> entry(int month) {
        if (month < 1 || month > entries.size()) {
            return Result.failure(AmortizationError.MONTH_NOT_IN_SCHEDULE);
        }
        return Result.success(entries.get(month - 1));
    }

    /** Balance after the payment of {@code month}. */
    public Result<BigDecimal, AmortizationError> remainingBalance(PaymentMonth month) {
        return entry(month).map(AmortizationEntry::remainingBalance);
    }
}
