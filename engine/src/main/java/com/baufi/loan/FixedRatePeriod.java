package com.baufi.loan;

import com.baufi.common.Result;
import com.baufi.domain.InterestRate;
import com.baufi.domain.YearCount;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Objects;

/**
 * Zinsbindung: the interval in which the nominal rate is locked.
 */
public final class FixedRatePeriod {

    public static final List<Integer> TYPICAL_PERIOD_YEARS = List.of(5, 10, 15, 20, 25, 30);

    /** Start dates further back than this are rejected when a reference date is given. */
    public static final int MAX_START_DATE_AGE_YEARS = 5;

    private static final double DAYS_PER_YEAR = 365.25;
    private static final int DAYS_PER_MONTH_APPROX = 30;

    private final YearCount periodYears;
    private final InterestRate initialRate;
    private final FixedRateType rateType;
    private final LocalDate startDate;

    private FixedRatePeriod(YearCount periodYears, InterestRate initialRate, FixedRateType rateType, LocalDate startDate) {
        this.periodYears = periodYears;
        this.initialRate = initialRate;
        this.rateType = rateType;
        this.startDate = startDate;
    }

    public static Result<FixedRatePeriod, FixedRatePeriodError> of(
            double periodYears, double initialRatePercent, FixedRateType rateType, LocalDate startDate) {
        Objects.requireNonNull(rateType, "rateType must not be null");
        Objects.requireNonNull(startDate, "startDate must not be null");
        if (periodYears < YearCount.MIN_YEARS) {
            return Result.failure(FixedRatePeriodError.PERIOD_TOO_SHORT);
        }
        if (periodYears > YearCount.MAX_YEARS) {
            return Result.failure(FixedRatePeriodError.PERIOD_TOO_LONG);
        }
        Result<YearCount, ?> years = YearCount.of(periodYears);
        if (years.isFailure()) {
            return Result.failure(FixedRatePeriodError.INVALID_PERIOD_LENGTH);
        }
        Result<InterestRate, ?> rate = InterestRate.of(initialRatePercent);
        if (rate.isFailure()) {
            return Result.failure(FixedRatePeriodError.INVALID_INTEREST_RATE);
        }
        return Result.success(new FixedRatePeriod(years.getValue(), rate.getValue(), rateType, startDate));
    }

    /**
     * Same as {@link #of(double, double, FixedRateType, LocalDate)}, additionally refusing start dates more than
     * {@value #MAX_START_DATE_AGE_YEARS} years before {@code referenceDate}.
     */
    public static Result<FixedRatePeriod, FixedRatePeriodError> of(
            double periodYears, double initialRatePercent, FixedRateType rateType, LocalDate startDate,
            LocalDate referenceDate) {
        Result<FixedRatePeriod, FixedRatePeriodError> period = of(periodYears, initialRatePercent, rateType, startDate);
        if (period.isSuccess() && startDate.isBefore(referenceDate.minusYears(MAX_START_DATE_AGE_YEARS))) {
            return Result.failure(FixedRatePeriodError.INVALID_START_DATE);
        }
        return period;
    }

    /** Standard German Zinsbindung (initial fixed). */
    public static Result<FixedRatePeriod, FixedRatePeriodError> standard(int years, double ratePercent, LocalDate startDate) {
        return of(years, ratePercent, FixedRateType.INITIAL_FIXED, startDate);
    }

    public YearCount getPeriodYears() {
        return periodYears;
    }

    public InterestRate getInitialRate() {
        return initialRate;
    }

    public FixedRateType getRateType() {
        return rateType;
    }

    public LocalDate getStartDate() {
        return startDate;
    }

    public LocalDate getEndDate() {
        return startDate.plusYears(periodYears.getValue());
    }

    /** Inclusive of start and end date. */
    public boolean isActive(LocalDate date) {
        return !date.isBefore(startDate) && !date.isAfter(getEndDate());
    }

    /** Years left until the lock ends, two decimals; zero outside the period. */
    public double remainingYears(LocalDate date) {
        if (!isActive(date)) {
            return 0;
        }
        long days = ChronoUnit.DAYS.between(date, getEndDate());
        return BigDecimal.valueOf(days / DAYS_PER_YEAR).setScale(2, RoundingMode.HALF_UP).doubleValue();
    }

    public long daysUntilExpiry(LocalDate date) {
        return Math.max(0, ChronoUnit.DAYS.between(date, getEndDate()));
    }

    public boolean isExpiringSoon(LocalDate date) {
        return isExpiringSoon(date, 12);
    }

    /** Months are approximated as 30 days. */
    public boolean isExpiringSoon(LocalDate date, int monthsThreshold) {
        long days = daysUntilExpiry(date);
        return days > 0 && days <= (long) monthsThreshold * DAYS_PER_MONTH_APPROX;
    }

    public boolean isTypicalPeriod() {
        return TYPICAL_PERIOD_YEARS.contains(periodYears.getValue());
    }

    /** "10 Jahre Zinsbindung @ 3,50 %" */
    public String format() {
        return periodYears.format() + " " + rateType.getLabel() + " @ " + initialRate.format();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        FixedRatePeriod that = (FixedRatePeriod) o;
        return periodYears.equals(that.periodYears)
                && initialRate.equals(that.initialRate)
                && rateType == that.rateType
                && startDate.equals(that.startDate);
    }

    @Override
    public int hashCode() {
        return Objects.hash(periodYears, initialRate, rateType, startDate);
    }

    @Override
    public String toString() {
        return format();
    }
}
