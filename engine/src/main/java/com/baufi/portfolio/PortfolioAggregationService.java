package com.baufi.portfolio;

import com.baufi.amortization.AmortizationEngine;
import com.baufi.amortization.AmortizationEntry;
import com.baufi.amortization.AmortizationError;
import com.baufi.amortization.AmortizationSchedule;
import com.baufi.amortization.LoanProgress;
import com.baufi.common.GermanFormat;
import com.baufi.common.Result;
import com.baufi.config.AsyncConfig;
import com.baufi.config.CaffeineConfig;
import com.baufi.config.MortgageEngineProperties;
import com.baufi.domain.Money;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.LocalDate;
import java.time.YearMonth;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Portfolio-level view over all stored mortgages. Only active mortgages count towards totals, suggestions and
 * projections. Balances of independent loans are computed in parallel on portfolio-executor and joined.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class PortfolioAggregationService {

    public static final int DEFAULT_PROJECTION_MONTHS = 12;

    private final MortgageRepository mortgageRepository;
    private final AmortizationEngine amortizationEngine;
    private final MortgageEngineProperties properties;
    private final ApplicationEventPublisher applicationEventPublisher;
    private final Clock clock;
    @Qualifier(AsyncConfig.PORTFOLIO_EXECUTOR)
    private final Executor portfolioExecutor;

    public Result<Mortgage, RepositoryError> saveMortgage(Mortgage mortgage) {
        Result<Mortgage, RepositoryError> saved = mortgageRepository.save(mortgage);
        if (saved.isSuccess()) {
            log.info("Mortgage saved: {} ({})", saved.getValue().id(), saved.getValue().name());
            applicationEventPublisher.publishEvent(new PortfolioChangedEvent(
                    this, saved.getValue().id(), PortfolioChangedEvent.ChangeType.SAVED));
        }
        return saved;
    }

    public Result<Void, RepositoryError> deleteMortgage(String id) {
        Result<Void, RepositoryError> deleted = mortgageRepository.delete(id);
        if (deleted.isSuccess()) {
            log.info("Mortgage deleted: {}", id);
            applicationEventPublisher.publishEvent(new PortfolioChangedEvent(
                    this, id, PortfolioChangedEvent.ChangeType.DELETED));
        }
        return deleted;
    }

    /** Summary as of today; shares cache entries with {@link #summarize(LocalDate)}. */
    @Cacheable(cacheNames = CaffeineConfig.PORTFOLIO_SUMMARY_CACHE, key = "#root.target.today()",
            unless = "#result.isFailure()")
    public Result<PortfolioSummary, PortfolioError> summarize() {
        return summarize(today());
    }

    public LocalDate today() {
        return LocalDate.now(clock);
    }

    @Cacheable(cacheNames = CaffeineConfig.PORTFOLIO_SUMMARY_CACHE, unless = "#result.isFailure()")
    public Result<PortfolioSummary, PortfolioError> summarize(LocalDate asOf) {
        Result<List<Mortgage>, RepositoryError> all = mortgageRepository.findAll();
        if (all.isFailure()) {
            log.warn("Portfolio summary failed: repository returned {}", all.getError());
            return Result.failure(PortfolioError.REPOSITORY_FAILURE);
        }
        List<Mortgage> active = active(all.getValue());

        BigDecimal totalPrincipal = BigDecimal.ZERO;
        BigDecimal totalPayment = BigDecimal.ZERO;
        BigDecimal weightedRate = BigDecimal.ZERO;
        for (Mortgage mortgage : active) {
            BigDecimal amount = mortgage.configuration().getAmount().toMoney().toBigDecimal();
            totalPrincipal = totalPrincipal.add(amount);
            totalPayment = totalPayment.add(mortgage.configuration().getMonthlyPayment().toBigDecimal());
            weightedRate = weightedRate.add(amount.multiply(BigDecimal.valueOf(mortgage.configuration().getAnnualRate().getValue())));
        }
        double averageRate = totalPrincipal.signum() == 0
                ? 0
                : weightedRate.divide(totalPrincipal, 2, RoundingMode.HALF_UP).doubleValue();

        Result<BigDecimal, PortfolioError> balance = totalCurrentBalance(active, asOf);
        if (balance.isFailure()) {
            return Result.failure(balance.getError());
        }

        Result<Money, ?> principalMoney = Money.of(totalPrincipal);
        Result<Money, ?> paymentMoney = Money.of(totalPayment);
        Result<Money, ?> balanceMoney = Money.of(balance.getValue().setScale(2, RoundingMode.HALF_UP));
        if (principalMoney.isFailure() || paymentMoney.isFailure() || balanceMoney.isFailure()) {
            return Result.failure(PortfolioError.CALCULATION_FAILED);
        }
        PortfolioSummary summary = new PortfolioSummary(all.getValue().size(), active.size(),
                principalMoney.getValue(), paymentMoney.getValue(), averageRate, balanceMoney.getValue(), asOf);
        log.info("Portfolio summary as of {}: {} active of {} mortgages, principal {}, balance {}",
                asOf, summary.activeMortgages(), summary.totalMortgages(),
                summary.totalPrincipal().format(), summary.totalCurrentBalance().format());
        return Result.success(summary);
    }

    private Result<BigDecimal, PortfolioError> totalCurrentBalance(List<Mortgage> active, LocalDate asOf) {
        List<CompletableFuture<Result<LoanProgress, AmortizationError>>> futures = new ArrayList<>();
        for (Mortgage mortgage : active) {
            futures.add(CompletableFuture.supplyAsync(
                    () -> amortizationEngine.queryProgress(mortgage.configuration().parameters(),
                            mortgage.extraPayments(), mortgage.startDate(), asOf, false),
                    portfolioExecutor));
        }
        CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();

        BigDecimal total = BigDecimal.ZERO;
        for (int i = 0; i < futures.size(); i++) {
            Result<LoanProgress, AmortizationError> progress = futures.get(i).join();
            if (progress.isFailure()) {
                log.warn("Progress of mortgage {} failed: {}", active.get(i).id(), progress.getError());
                return Result.failure(PortfolioError.CALCULATION_FAILED);
            }
            total = total.add(progress.getValue().currentBalance());
        }
        return Result.success(total);
    }

    /**
     * Suggestions per active mortgage: refinancing when its rate exceeds the plain average rate by the configured
     * spread, consolidation below the configured amount, and a warning above the high-interest threshold.
     */
    public Result<List<PortfolioOptimization>, PortfolioError> optimizations() {
        Result<List<Mortgage>, RepositoryError> all = mortgageRepository.findAll();
        if (all.isFailure()) {
            return Result.failure(PortfolioError.REPOSITORY_FAILURE);
        }
        List<Mortgage> active = active(all.getValue());
        if (active.isEmpty()) {
            return Result.success(List.of());
        }
        MortgageEngineProperties.Portfolio thresholds = properties.getPortfolio();
        double averageRate = active.stream()
                .mapToDouble(m -> m.configuration().getAnnualRate().getValue())
                .average()
                .orElse(0);

        List<PortfolioOptimization> suggestions = new ArrayList<>();
        for (Mortgage mortgage : active) {
            double rate = mortgage.configuration().getAnnualRate().getValue();
            if (rate > averageRate + thresholds.getRefinancingRateSpread()) {
                suggestions.add(new PortfolioOptimization(mortgage.id(), mortgage.name(),
                        PortfolioOptimization.Type.REFINANCING,
                        "Zinssatz " + GermanFormat.percent(rate, 2) + " liegt über dem Durchschnitt von "
                                + GermanFormat.percent(averageRate, 2)));
            }
            if (mortgage.configuration().getAmount().toEuros() < thresholds.getConsolidationThresholdEuros()) {
                suggestions.add(new PortfolioOptimization(mortgage.id(), mortgage.name(),
                        PortfolioOptimization.Type.CONSOLIDATION,
                        "Darlehensbetrag unter " + GermanFormat.euros(thresholds.getConsolidationThresholdEuros())));
            }
            if (rate > thresholds.getHighInterestRate()) {
                suggestions.add(new PortfolioOptimization(mortgage.id(), mortgage.name(),
                        PortfolioOptimization.Type.HIGH_INTEREST,
                        "Zinssatz über " + GermanFormat.percent(thresholds.getHighInterestRate(), 2)));
            }
        }
        return Result.success(List.copyOf(suggestions));
    }

    public Result<CashFlowProjection, PortfolioError> projectCashFlow() {
        return projectCashFlow(YearMonth.now(clock), DEFAULT_PROJECTION_MONTHS);
    }

    /**
     * Payments of all active mortgages for {@code months} calendar months starting at {@code firstMonth}.
     * Loan month k of a mortgage falls k calendar months after its start month.
     */
    public Result<CashFlowProjection, PortfolioError> projectCashFlow(YearMonth firstMonth, int months) {
        Result<List<Mortgage>, RepositoryError> all = mortgageRepository.findAll();
        if (all.isFailure()) {
            return Result.failure(PortfolioError.REPOSITORY_FAILURE);
        }
        List<Mortgage> active = active(all.getValue());
        List<AmortizationSchedule> schedules = new ArrayList<>();
        for (Mortgage mortgage : active) {
            Result<AmortizationSchedule, AmortizationError> schedule = amortizationEngine.generateSchedule(
                    mortgage.configuration().parameters(), mortgage.extraPayments());
            if (schedule.isFailure()) {
                log.warn("Schedule of mortgage {} failed: {}", mortgage.id(), schedule.getError());
                return Result.failure(PortfolioError.CALCULATION_FAILED);
            }
            schedules.add(schedule.getValue());
        }

        List<CashFlowProjection.MonthlyCashFlow> flows = new ArrayList<>();
        for (int offset = 0; offset < months; offset++) {
            YearMonth month = firstMonth.plusMonths(offset);
            BigDecimal payment = BigDecimal.ZERO;
            BigDecimal interest = BigDecimal.ZERO;
            BigDecimal principal = BigDecimal.ZERO;
            BigDecimal balance = BigDecimal.ZERO;
            for (int i = 0; i < active.size(); i++) {
                int loanMonth = (int) ChronoUnit.MONTHS.between(YearMonth.from(active.get(i).startDate()), month);
                Result<AmortizationEntry, AmortizationError> entry = schedules.get(i).entry(loanMonth);
                if (entry.isFailure()) {
                    continue;
                }
                payment = payment.add(entry.getValue().totalPayment());
                interest = interest.add(entry.getValue().interestComponent());
                principal = principal.add(entry.getValue().principalComponent());
                balance = balance.add(entry.getValue().remainingBalance());
            }
            Result<Money, ?> paymentMoney = Money.of(payment.setScale(2, RoundingMode.HALF_UP));
            Result<Money, ?> interestMoney = Money.of(interest.setScale(2, RoundingMode.HALF_UP));
            Result<Money, ?> principalMoney = Money.of(principal.setScale(2, RoundingMode.HALF_UP));
            Result<Money, ?> balanceMoney = Money.of(balance.setScale(2, RoundingMode.HALF_UP));
            if (paymentMoney.isFailure() || interestMoney.isFailure() || principalMoney.isFailure()
                    || balanceMoney.isFailure()) {
                return Result.failure(PortfolioError.CALCULATION_FAILED);
            }
            flows.add(new CashFlowProjection.MonthlyCashFlow(month, paymentMoney.getValue(), interestMoney.getValue(),
                    principalMoney.getValue(), balanceMoney.getValue()));
        }
        return Result.success(new CashFlowProjection(flows));
    }

    private static List<Mortgage> active(List<Mortgage> mortgages) {
        return mortgages.stream().filter(Mortgage::active).toList();
    }
}
