package com.baufi.property;

import com.baufi.common.CalculationTolerances;
import com.baufi.common.Result;
import com.baufi.domain.LoanAmount;
import com.baufi.domain.Percentage;

import java.time.LocalDate;
import java.util.Comparator;
import java.util.Objects;

/**
 * Loan balance relative to the current property value, in percent.
 * <p>
 * Maximum LTV for approval: 70 for investment-class property, 90 in premium locations, 80 otherwise. Creation is
 * refused only when the ratio exceeds that maximum by more than the approval buffer; a ratio within the buffer is
 * created but reports {@link #isAcceptableForMortgage()} {@code false}.
 */
public final class LoanToValueRatio {

    public static final double MAX_STANDARD_LTV = 80;
    public static final double MAX_PREMIUM_LOCATION_LTV = 90;
    public static final double MAX_INVESTMENT_PROPERTY_LTV = 70;
    public static final double MIN_PROPERTY_VALUE_FOR_MORTGAGE = 50_000;

    public static final double MORTGAGE_INSURANCE_THRESHOLD = 80;
    public static final double BEST_RATES_THRESHOLD = 60;
    public static final double SAFE_REFINANCING_THRESHOLD = 75;
    public static final double DEFAULT_TARGET_LTV = 80;

    public static final Comparator<LoanToValueRatio> BY_CURRENT_LTV =
            Comparator.comparingDouble(LoanToValueRatio::getCurrentLtv);

    private final Percentage currentLtv;
    private final Percentage originalLtv;
    private final LoanAmount loanAmount;
    private final PropertyValuation propertyValuation;
    private final LtvRiskCategory riskCategory;
    private final LocalDate calculationDate;
    private final CalculationTolerances tolerances;

    private LoanToValueRatio(Percentage currentLtv, Percentage originalLtv, LoanAmount loanAmount,
                             PropertyValuation propertyValuation, LtvRiskCategory riskCategory,
                             LocalDate calculationDate, CalculationTolerances tolerances) {
        this.currentLtv = currentLtv;
        this.originalLtv = originalLtv;
        this.loanAmount = loanAmount;
        this.propertyValuation = propertyValuation;
        this.riskCategory = riskCategory;
        this.calculationDate = calculationDate;
        this.tolerances = tolerances;
    }

    public static Result<LoanToValueRatio, LoanToValueError> of(LoanAmount loanAmount, PropertyValuation valuation,
                                                                LocalDate calculationDate) {
        return of(loanAmount, valuation, loanAmount, calculationDate, CalculationTolerances.DEFAULT);
    }

    /**
     * @param originalLoanAmount loan amount the original LTV is computed from; usually the amount at origination
     */
    public static Result<LoanToValueRatio, LoanToValueError> of(LoanAmount loanAmount, PropertyValuation valuation,
                                                                LoanAmount originalLoanAmount, LocalDate calculationDate,
                                                                CalculationTolerances tolerances) {
        Objects.requireNonNull(loanAmount, "loanAmount must not be null");
        Objects.requireNonNull(valuation, "valuation must not be null");
        Objects.requireNonNull(originalLoanAmount, "originalLoanAmount must not be null");
        Objects.requireNonNull(tolerances, "tolerances must not be null");

        if (!valuation.isAcceptableForMortgage()) {
            return Result.failure(LoanToValueError.PROPERTY_VALUATION_NOT_ACCEPTABLE);
        }
        double propertyValue = valuation.getCurrentValue().toEuros();
        if (propertyValue < MIN_PROPERTY_VALUE_FOR_MORTGAGE) {
            return Result.failure(LoanToValueError.PROPERTY_VALUE_TOO_LOW);
        }

        double currentPercent = loanAmount.toEuros() * 100 / propertyValue;
        double originalPercent = originalLoanAmount.toEuros() * 100 / propertyValue;
        if (currentPercent > maxAllowedLtv(valuation) + tolerances.ltvApprovalBufferPoints()
                || currentPercent > Percentage.MAX) {
            return Result.failure(LoanToValueError.LTV_TOO_HIGH);
        }

        Result<Percentage, ?> current = Percentage.of(currentPercent);
        Result<Percentage, ?> original = Percentage.of(originalPercent);
        if (current.isFailure() || original.isFailure()) {
            return Result.failure(LoanToValueError.INVALID_LOAN_AMOUNT);
        }
        return Result.success(new LoanToValueRatio(current.getValue(), original.getValue(), loanAmount, valuation,
                LtvRiskCategory.classify(currentPercent), calculationDate, tolerances));
    }

    public static double maxAllowedLtv(PropertyValuation valuation) {
        if (valuation.getPropertyType().isInvestmentClass()) {
            return MAX_INVESTMENT_PROPERTY_LTV;
        }
        if (valuation.getLocation().locationQuality() == LocationQuality.PREMIUM) {
            return MAX_PREMIUM_LOCATION_LTV;
        }
        return MAX_STANDARD_LTV;
    }

    public double getCurrentLtv() {
        return currentLtv.getValue();
    }

    public double getOriginalLtv() {
        return originalLtv.getValue();
    }

    public LoanAmount getLoanAmount() {
        return loanAmount;
    }

    public PropertyValuation getPropertyValuation() {
        return propertyValuation;
    }

    public LtvRiskCategory getRiskCategory() {
        return riskCategory;
    }

    public LocalDate getCalculationDate() {
        return calculationDate;
    }

    public double getInterestRatePremium() {
        return riskCategory.getInterestRatePremium();
    }

    public boolean isAcceptableForMortgage() {
        return getCurrentLtv() <= maxAllowedLtv(propertyValuation);
    }

    public boolean requiresMortgageInsurance() {
        return getCurrentLtv() > MORTGAGE_INSURANCE_THRESHOLD;
    }

    public boolean qualifiesForBestRates() {
        return getCurrentLtv() <= BEST_RATES_THRESHOLD;
    }

    public boolean isSafeForRefinancing() {
        return getCurrentLtv() <= SAFE_REFINANCING_THRESHOLD;
    }

    /** Percentage points gained since the original LTV; positive means improvement. */
    public double ltvImprovement() {
        return getOriginalLtv() - getCurrentLtv();
    }

    public boolean hasImproved() {
        return ltvImprovement() > 0;
    }

    public double equity() {
        return Math.max(0, propertyValue() - loanAmount.toEuros());
    }

    public double equityPercentage() {
        return 100 - getCurrentLtv();
    }

    /** Repayment needed so that balance = value * target / 100. */
    public double amountToReachTargetLtv(double targetLtvPercent) {
        return Math.max(0, loanAmount.toEuros() - propertyValue() * targetLtvPercent / 100);
    }

    public double maxAdditionalBorrowing() {
        return maxAdditionalBorrowing(DEFAULT_TARGET_LTV);
    }

    public double maxAdditionalBorrowing(double targetLtvPercent) {
        return Math.max(0, propertyValue() * targetLtvPercent / 100 - loanAmount.toEuros());
    }

    /** Refinancing: the current amount becomes the original. */
    public Result<LoanToValueRatio, LoanToValueError> updateWithNewLoanAmount(LoanAmount newLoanAmount, LocalDate date) {
        return of(newLoanAmount, propertyValuation, loanAmount, date, tolerances);
    }

    /** Revaluation: the previous current LTV becomes the original. */
    public Result<LoanToValueRatio, LoanToValueError> updateWithNewValuation(PropertyValuation newValuation, LocalDate date) {
        Result<LoanToValueRatio, LoanToValueError> updated = of(loanAmount, newValuation, loanAmount, date, tolerances);
        if (updated.isFailure()) {
            return updated;
        }
        LoanToValueRatio ratio = updated.getValue();
        return Result.success(new LoanToValueRatio(ratio.currentLtv, currentLtv, loanAmount, newValuation,
                ratio.riskCategory, date, tolerances));
    }

    private double propertyValue() {
        return propertyValuation.getCurrentValue().toEuros();
    }

    /** "LTV: 80,00 % (Risiko: Mittel)" */
    public String format() {
        return "LTV: " + currentLtv.format() + " (Risiko: " + riskCategory.getLabel() + ")";
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof LoanToValueRatio that)) return false;
        return currentLtv.equals(that.currentLtv)
                && originalLtv.equals(that.originalLtv)
                && loanAmount.equals(that.loanAmount)
                && propertyValuation.equals(that.propertyValuation)
                && Objects.equals(calculationDate, that.calculationDate);
    }

    @Override
    public int hashCode() {
        return Objects.hash(currentLtv, originalLtv, loanAmount, propertyValuation, calculationDate);
    }

    @Override
    public String toString() {
        return format();
    }
}
