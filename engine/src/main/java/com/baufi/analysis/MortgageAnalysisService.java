package com.baufi.analysis;

import com.baufi.amortization.AmortizationEngine;
import com.baufi.amortization.AmortizationEntry;
import com.baufi.amortization.AmortizationSchedule;
import com.baufi.common.Result;
import com.baufi.config.CaffeineConfig;
import com.baufi.config.MortgageEngineProperties;
import com.baufi.domain.InterestRate;
import com.baufi.domain.LoanAmount;
import com.baufi.domain.Money;
import com.baufi.domain.MonthCount;
import com.baufi.loan.LoanCalculations;
import com.baufi.loan.LoanConfiguration;
import com.baufi.loan.LoanScenario;
import com.baufi.loan.MonthlyPayment;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Loan-level analysis on top of the closed-form calculations and the amortization engine.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class MortgageAnalysisService {

    private static final int MONTHS_PER_YEAR = 12;

    private final LoanCalculations loanCalculations;
    private final AmortizationEngine amortizationEngine;
    private final MortgageEngineProperties properties;

    @Cacheable(cacheNames = CaffeineConfig.LOAN_ANALYSIS_CACHE)
    public Result<LoanAnalysis, AnalysisError> analyzeLoan(LoanConfiguration configuration) {
        Result<MonthlyPayment, ?> firstMonth = loanCalculations.calculateMonthlyPayment(configuration);
        if (firstMonth.isFailure()) {
            return Result.failure(AnalysisError.CALCULATION_FAILED);
        }
        Result<AmortizationSchedule, ?> schedule = amortizationEngine.generateSchedule(configuration);
        if (schedule.isFailure()) {
            return Result.failure(AnalysisError.INVALID_CONFIGURATION);
        }
        List<AmortizationEntry> entries = schedule.getValue().entries();
        BigDecimal firstYearInterest = BigDecimal.ZERO;
        BigDecimal firstYearPrincipal = BigDecimal.ZERO;
        for (AmortizationEntry entry : entries.subList(0, Math.min(MONTHS_PER_YEAR, entries.size()))) {
            firstYearInterest = firstYearInterest.add(entry.interestComponent());
            firstYearPrincipal = firstYearPrincipal.add(entry.principalComponent());
        }
        BigDecimal totalInterest = schedule.getValue().totalInterest();
        BigDecimal totalCost = totalInterest.add(configuration.getAmount().toMoney().toBigDecimal());

        LoanAnalysis analysis = new LoanAnalysis(configuration, firstMonth.getValue(),
                money(totalInterest), money(totalCost), money(firstYearInterest), money(firstYearPrincipal),
                schedule.getValue().actualTermMonths());
        log.debug("Analysed loan {}: total interest {}", configuration, analysis.totalInterest());
        return Result.success(analysis);
    }

    /**
     * Analyses every scenario and ranks them by total cost.
     */
    public Result<ScenarioComparison, AnalysisError> compareScenarios(List<LoanScenario> scenarios) {
        if (scenarios.isEmpty()) {
            return Result.failure(AnalysisError.NO_SCENARIOS);
        }
        List<ScenarioComparison.ScenarioResult> results = new ArrayList<>();
        for (LoanScenario scenario : scenarios) {
            Result<LoanAnalysis, AnalysisError> analysis = analyzeLoan(scenario.configuration());
            if (analysis.isFailure()) {
                return Result.failure(analysis.getError());
            }
            results.add(new ScenarioComparison.ScenarioResult(scenario.name(), analysis.getValue()));
        }
        results.sort(Comparator.comparing(r -> r.analysis().totalCost()));
        Money cheapest = results.get(0).analysis().totalCost();
        Money mostExpensive = results.get(results.size() - 1).analysis().totalCost();
        Money savings = mostExpensive.subtract(cheapest).orElseThrow();
        return Result.success(new ScenarioComparison(results, savings));
    }

    /**
     * Checks the regular payment against the configured share of net income (35 % unless overridden).
     */
    public Result<AffordabilityAssessment, AnalysisError> assessAffordability(Money monthlyNetIncome,
                                                                              LoanConfiguration configuration) {
        if (monthlyNetIncome.isZero()) {
            return Result.failure(AnalysisError.INVALID_INCOME);
        }
        double limitPercent = properties.getAffordability().getMaxPaymentToIncomePercent();
        Money payment = configuration.getMonthlyPayment();
        double ratio = payment.toBigDecimal()
                .multiply(BigDecimal.valueOf(100))
                .divide(monthlyNetIncome.toBigDecimal(), 2, RoundingMode.HALF_UP)
                .doubleValue();
        Result<Money, ?> maxPayment = monthlyNetIncome.multiply(limitPercent / 100);
        if (maxPayment.isFailure()) {
            return Result.failure(AnalysisError.CALCULATION_FAILED);
        }
        return Result.success(new AffordabilityAssessment(monthlyNetIncome, payment, ratio, maxPayment.getValue(),
                ratio <= limitPercent));
    }

    /**
     * Analysis of an annuity loan built from raw numbers.
     */
    public Result<LoanAnalysis, AnalysisError> quickEstimate(double amount, double annualRatePercent, int years) {
        Result<LoanAmount, ?> loanAmount = LoanAmount.of(amount);
        Result<InterestRate, ?> rate = InterestRate.of(annualRatePercent);
        Result<MonthCount, ?> term = MonthCount.of(years * MONTHS_PER_YEAR);
        if (loanAmount.isFailure() || rate.isFailure() || term.isFailure()) {
            return Result.failure(AnalysisError.INVALID_CONFIGURATION);
        }
        return LoanConfiguration.withAnnuityPayment(loanAmount.getValue(), rate.getValue(), term.getValue())
                .mapError(e -> AnalysisError.INVALID_CONFIGURATION)
                .flatMap(this::analyzeLoan);
    }

    private static Money money(BigDecimal euros) {
        return Money.of(euros.setScale(2, RoundingMode.HALF_UP)).orElseThrow();
    }
}
