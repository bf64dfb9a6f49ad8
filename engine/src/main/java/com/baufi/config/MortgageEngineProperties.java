package com.baufi.config;

import com.baufi.common.CalculationTolerances;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Overridable tolerances and thresholds of the calculation engine.
 */
@ConfigurationProperties(prefix = "baufi.engine")
@Validated
@NoArgsConstructor
@Getter
@Setter
public class MortgageEngineProperties {

    /** Max deviation of a stated monthly payment from the annuity payment, in euros. */
    @PositiveOrZero
    private double configurationToleranceEuros = CalculationTolerances.DEFAULT_CONFIGURATION_TOLERANCE_EUROS;

    /** Same for zero-rate (straight line) loans. */
    @PositiveOrZero
    private double zeroRateToleranceEuros = CalculationTolerances.DEFAULT_ZERO_RATE_TOLERANCE_EUROS;

    /** Percentage points an LTV may exceed the max allowed LTV before creation is refused. */
    @PositiveOrZero
    private double ltvApprovalBufferPoints = CalculationTolerances.DEFAULT_LTV_APPROVAL_BUFFER_POINTS;

    @Valid
    private Portfolio portfolio = new Portfolio();

    @Valid
    private Affordability affordability = new Affordability();

    public CalculationTolerances toTolerances() {
        return new CalculationTolerances(configurationToleranceEuros, zeroRateToleranceEuros, ltvApprovalBufferPoints);
    }

    @NoArgsConstructor
    @Getter
    @Setter
    public static class Portfolio {

        /** Refinancing is suggested when a loan's rate exceeds the portfolio average by this many points. */
        @PositiveOrZero
        private double refinancingRateSpread = 1.0;

        /** Loans below this amount are consolidation candidates. */
        @PositiveOrZero
        private double consolidationThresholdEuros = 100_000;

        @PositiveOrZero
        private double highInterestRate = 5.0;
    }

    @NoArgsConstructor
    @Getter
    @Setter
    public static class Affordability {

        @DecimalMin("1")
        @DecimalMax("100")
        private double maxPaymentToIncomePercent = 35;
    }
}
