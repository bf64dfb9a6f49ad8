package com.baufi.sondertilgung;

import com.baufi.domain.LoanAmount;
import com.baufi.domain.Money;
import lombok.With;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * Sondertilgung terms of one bank. {@code allowedPercentages} is a discrete menu of yearly tiers; the yearly cap is
 * always the largest tier. Standard rule sets come from {@link BankRuleRegistry}; custom sets are derived with the
 * {@code with*} methods.
 *
 * @param maximumAmount largest single payment, or null for no limit
 */
@With
public record GermanSondertilgungRules(
        GermanBankType bankType,
        List<Integer> allowedPercentages,
        Money minimumAmount,
        Money maximumAmount,
        TimingRestrictions timingRestrictions,
        FeeStructure feeStructure,
        SpecialConditions specialConditions
) {

    public static final int UNLIMITED_PERCENTAGE = 100;

    public GermanSondertilgungRules {
        Objects.requireNonNull(bankType, "bankType must not be null");
        Objects.requireNonNull(minimumAmount, "minimumAmount must not be null");
        Objects.requireNonNull(timingRestrictions, "timingRestrictions must not be null");
        Objects.requireNonNull(feeStructure, "feeStructure must not be null");
        Objects.requireNonNull(specialConditions, "specialConditions must not be null");
        allowedPercentages = allowedPercentages == null
                ? List.of()
                : allowedPercentages.stream().distinct().sorted().toList();
    }

    public OptionalInt maxAllowedPercentage() {
        return allowedPercentages.stream().mapToInt(Integer::intValue).max();
    }

    public Optional<Money> maximumPaymentAmount() {
        return Optional.ofNullable(maximumAmount);
    }

    /** Euro cap per loan-year: loan × largest tier / 100. Zero when no tier is offered. */
    public BigDecimal maxYearlyAmount(LoanAmount originalLoanAmount) {
        int percentage = maxAllowedPercentage().orElse(0);
        return originalLoanAmount.toMoney().toBigDecimal()
                .multiply(BigDecimal.valueOf(percentage))
                .divide(FeeStructure.HUNDRED, 2, RoundingMode.HALF_UP);
    }

    public boolean supportsUnlimitedSondertilgung() {
        return allowedPercentages.contains(UNLIMITED_PERCENTAGE);
    }
}
