package com.baufi.property;

import com.baufi.common.Result;
import com.baufi.domain.Money;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.Comparator;
import java.util.Objects;
import java.util.Optional;

/**
 * Appraised value of a property at a given date. Checks run in a fixed order: value ranges, valuation date,
 * value decrease against the purchase price, location.
 */
public final class PropertyValuation {

    public static final double MIN_PROPERTY_VALUE = 10_000;
    public static final double MAX_PROPERTY_VALUE = 50_000_000;
    public static final int MAX_VALUATION_AGE_MONTHS = 24;
    public static final double MAX_VALUE_DECREASE_PERCENT = 50;
    public static final double DEFAULT_CONSERVATISM_PERCENT = 10;

    private static final double DAYS_PER_YEAR = 365.25;
    private static final double DAYS_PER_MONTH = 30.44;

    public static final Comparator<PropertyValuation> BY_CURRENT_VALUE =
            Comparator.comparing(PropertyValuation::getCurrentValue);
    public static final Comparator<PropertyValuation> BY_VALUATION_DATE =
            Comparator.comparing(PropertyValuation::getValuationDate);

    private final Money currentValue;
    private final Money originalPurchasePrice;
    private final LocalDate valuationDate;
    private final ValuationMethod valuationMethod;
    private final PropertyType propertyType;
    private final PropertyLocation location;
    private final String valuerCertification;
    private final String notes;

    private PropertyValuation(Money currentValue, Money originalPurchasePrice, LocalDate valuationDate,
                              ValuationMethod valuationMethod, PropertyType propertyType, PropertyLocation location,
                              String valuerCertification, String notes) {
        this.currentValue = currentValue;
        this.originalPurchasePrice = originalPurchasePrice;
        this.valuationDate = valuationDate;
        this.valuationMethod = valuationMethod;
        this.propertyType = propertyType;
        this.location = location;
        this.valuerCertification = valuerCertification;
        this.notes = notes;
    }

    public static Result<PropertyValuation, PropertyValuationError> of(
            double currentValue, double originalPurchasePrice, LocalDate valuationDate,
            ValuationMethod valuationMethod, PropertyType propertyType, PropertyLocation location,
            LocalDate evaluationDate) {
        return of(currentValue, originalPurchasePrice, valuationDate, valuationMethod, propertyType, location,
                evaluationDate, null, null);
    }

    /**
     * @param evaluationDate date against which future and outdated valuations are judged
     */
    public static Result<PropertyValuation, PropertyValuationError> of(
            double currentValue, double originalPurchasePrice, LocalDate valuationDate,
            ValuationMethod valuationMethod, PropertyType propertyType, PropertyLocation location,
            LocalDate evaluationDate, String valuerCertification, String notes) {
        Objects.requireNonNull(evaluationDate, "evaluationDate must not be null");
        if (!inRange(currentValue)) {
            return Result.failure(PropertyValuationError.INVALID_CURRENT_VALUE);
        }
        if (!inRange(originalPurchasePrice)) {
            return Result.failure(PropertyValuationError.INVALID_PURCHASE_PRICE);
        }
        Result<Money, ?> current = Money.of(currentValue);
        Result<Money, ?> purchase = Money.of(originalPurchasePrice);
        if (current.isFailure() || purchase.isFailure()) {
            return Result.failure(PropertyValuationError.INVALID_CURRENT_VALUE);
        }
        if (valuationDate == null) {
            return Result.failure(PropertyValuationError.INVALID_VALUATION_DATE);
        }
        if (valuationDate.isAfter(evaluationDate)) {
            return Result.failure(PropertyValuationError.FUTURE_VALUATION_DATE);
        }
        if (valuationDate.isBefore(evaluationDate.minusMonths(MAX_VALUATION_AGE_MONTHS))) {
            return Result.failure(PropertyValuationError.VALUATION_TOO_OLD);
        }
        if (currentValue < originalPurchasePrice) {
            double decreasePercent = (originalPurchasePrice - currentValue) / originalPurchasePrice * 100;
            if (decreasePercent > MAX_VALUE_DECREASE_PERCENT) {
                return Result.failure(PropertyValuationError.VALUE_DECREASE_TOO_SEVERE);
            }
        }
        if (location == null || !location.isComplete()) {
            return Result.failure(PropertyValuationError.INVALID_LOCATION);
        }
        if (valuationMethod == null || propertyType == null) {
            return Result.failure(PropertyValuationError.UNSUPPORTED_VALUATION_METHOD);
        }
        return Result.success(new PropertyValuation(current.getValue(), purchase.getValue(), valuationDate,
                valuationMethod, propertyType, location, valuerCertification, notes));
    }

    private static boolean inRange(double value) {
        return Double.isFinite(value) && value >= MIN_PROPERTY_VALUE && value <= MAX_PROPERTY_VALUE;
    }

    public Money getCurrentValue() {
        return currentValue;
    }

    public Money getOriginalPurchasePrice() {
        return originalPurchasePrice;
    }

    public LocalDate getValuationDate() {
        return valuationDate;
    }

    public ValuationMethod getValuationMethod() {
        return valuationMethod;
    }

    public PropertyType getPropertyType() {
        return propertyType;
    }

    public PropertyLocation getLocation() {
        return location;
    }

    public Optional<String> getValuerCertification() {
        return Optional.ofNullable(valuerCertification);
    }

    public Optional<String> getNotes() {
        return Optional.ofNullable(notes);
    }

    /** Signed euro difference between current value and purchase price. */
    public double valueChange() {
        return currentValue.toEuros() - originalPurchasePrice.toEuros();
    }

    public double valueChangePercentage() {
        return valueChange() / originalPurchasePrice.toEuros() * 100;
    }

    public boolean hasAppreciated() {
        return currentValue.compareTo(originalPurchasePrice) > 0;
    }

    public boolean hasDepreciated() {
        return currentValue.compareTo(originalPurchasePrice) < 0;
    }

    /**
     * Compound annual growth rate in percent, spreading the change since purchase over the years between the
     * valuation date and {@code asOf}. Zero when no time has passed.
     */
    public double annualAppreciationRate(LocalDate asOf) {
        double years = ChronoUnit.DAYS.between(valuationDate, asOf) / DAYS_PER_YEAR;
        if (years <= 0) {
            return 0;
        }
        return (Math.pow(currentValue.toEuros() / originalPurchasePrice.toEuros(), 1 / years) - 1) * 100;
    }

    public boolean isCurrentEnoughForMortgage(LocalDate asOf) {
        double monthsOld = ChronoUnit.DAYS.between(valuationDate, asOf) / DAYS_PER_MONTH;
        return monthsOld <= MAX_VALUATION_AGE_MONTHS;
    }

    public int reliabilityScore() {
        return valuationMethod.getReliabilityScore();
    }

    public boolean isAcceptableForMortgage() {
        return valuationMethod.isAcceptableForMortgage();
    }

    public Result<PropertyValuation, PropertyValuationError> conservative() {
        return conservative(DEFAULT_CONSERVATISM_PERCENT);
    }

    /**
     * Copy with the current value reduced by {@code conservatismPercent}. The date checks are evaluated at the
     * original valuation date, so only the value rules can fail.
     */
    public Result<PropertyValuation, PropertyValuationError> conservative(double conservatismPercent) {
        double reduced = currentValue.toEuros() * (1 - conservatismPercent / 100);
        String note = "Konservative Schätzung (" + conservatismPercent + " % Abschlag)"
                + (notes == null ? "" : ". " + notes);
        return of(reduced, originalPurchasePrice.toEuros(), valuationDate, valuationMethod, propertyType, location,
                valuationDate, valuerCertification, note);
    }

    /** Same postal code, city and property type. */
    public boolean isSameProperty(PropertyValuation other) {
        return location.postalCode().equals(other.location.postalCode())
                && location.city().equals(other.location.city())
                && propertyType == other.propertyType;
    }

    /** "Eigenheim in München: 500.000,00 € (Bankgutachten)" */
    public String format() {
        return propertyType.getLabel() + " in " + location.city() + ": " + currentValue.format()
                + " (" + valuationMethod.getLabel() + ")";
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof PropertyValuation that)) return false;
        return currentValue.equals(that.currentValue)
                && originalPurchasePrice.equals(that.originalPurchasePrice)
                && valuationDate.equals(that.valuationDate)
                && valuationMethod == that.valuationMethod
                && propertyType == that.propertyType
                && location.equals(that.location);
    }

    @Override
    public int hashCode() {
        return Objects.hash(currentValue, originalPurchasePrice, valuationDate, valuationMethod, propertyType, location);
    }

    @Override
    public String toString() {
        return format();
    }
}
