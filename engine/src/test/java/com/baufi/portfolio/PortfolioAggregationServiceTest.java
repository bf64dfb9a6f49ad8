package com.baufi.portfolio;

import com.baufi.amortization.AmortizationEngine;
import com.baufi.amortization.AmortizationSchedule;
import com.baufi.common.Result;
import com.baufi.config.MortgageEngineProperties;
import com.baufi.domain.InterestRate;
import com.baufi.domain.LoanAmount;
import com.baufi.domain.Money;
import com.baufi.domain.MonthCount;
import com.baufi.loan.LoanConfiguration;
import com.baufi.sondertilgung.GermanBankType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.context.ApplicationEventPublisher;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.YearMonth;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class PortfolioAggregationServiceTest {

    private static final LocalDate START = LocalDate.of(2024, 1, 1);
    private static final Clock CLOCK = Clock.fixed(Instant.parse("2025-01-15T10:00:00Z"), ZoneOffset.UTC);

    @Mock
    MortgageRepository mortgageRepository;
    @Mock
    ApplicationEventPublisher applicationEventPublisher;

    private final AmortizationEngine amortizationEngine = new AmortizationEngine();
    private PortfolioAggregationService service;

    private Mortgage home;
    private Mortgage smallExpensive;
    private Mortgage closed;

    @BeforeEach
    void setUp() {
        service = new PortfolioAggregationService(mortgageRepository, amortizationEngine,
                new MortgageEngineProperties(), applicationEventPublisher, CLOCK, Runnable::run);

        home = mortgage("home", "Eigenheim", 300_000, 3.5, MonthCount.TWENTY_FIVE_YEARS, true);
        smallExpensive = mortgage("small", "Modernisierung", 50_000, 6.0, MonthCount.of(120).orElseThrow(), true);
        closed = mortgage("closed", "Altvertrag", 200_000, 4.0, MonthCount.FIFTEEN_YEARS, false);
    }

    private static Mortgage mortgage(String id, String name, double amount, double rate, MonthCount term,
                                     boolean active) {
        LoanConfiguration configuration = LoanConfiguration.withAnnuityPayment(LoanAmount.of(amount).orElseThrow(),
                InterestRate.of(rate).orElseThrow(), term).orElseThrow();
        return Mortgage.builder()
                .id(id)
                .name(name)
                .bankType(GermanBankType.SPARKASSE)
                .configuration(configuration)
                .startDate(START)
                .active(active)
                .build();
    }

    private static BigDecimal cents(BigDecimal value) {
        return value.setScale(2, RoundingMode.HALF_UP);
    }

    @Nested
    @DisplayName("summarize")
    class Summarize {

        @Test
        @DisplayName("totals over active mortgages with principal-weighted average rate")
        void activeMortgagesOnly() {
            when(mortgageRepository.findAll()).thenReturn(Result.success(List.of(home, smallExpensive, closed)));

            PortfolioSummary summary = service.summarize().orElseThrow();

            assertThat(summary.totalMortgages()).isEqualTo(3);
            assertThat(summary.activeMortgages()).isEqualTo(2);
            assertThat(summary.totalPrincipal()).isEqualTo(Money.of(350_000).orElseThrow());
            assertThat(summary.totalMonthlyPayment().getCents()).isEqualTo(
                    home.configuration().getMonthlyPayment().getCents()
                            + smallExpensive.configuration().getMonthlyPayment().getCents());
            // (300k * 3.5 + 50k * 6.0) / 350k = 3.857
            assertThat(summary.averageInterestRate()).isEqualTo(3.86);
            assertThat(summary.asOf()).isEqualTo(LocalDate.of(2025, 1, 15));
        }

        @Test
        @DisplayName("current balance is the sum of balances after twelve payments")
        void currentBalance() {
            when(mortgageRepository.findAll()).thenReturn(Result.success(List.of(home, smallExpensive)));

            PortfolioSummary summary = service.summarize(LocalDate.of(2025, 1, 15)).orElseThrow();

            BigDecimal expected = balanceAfter(home, 12).add(balanceAfter(smallExpensive, 12));
            assertThat(summary.totalCurrentBalance().toBigDecimal()).isEqualByComparingTo(cents(expected));
        }

        @Test
        void emptyPortfolio() {
            when(mortgageRepository.findAll()).thenReturn(Result.success(List.of()));

            PortfolioSummary summary = service.summarize().orElseThrow();

            assertThat(summary.totalMortgages()).isZero();
            assertThat(summary.averageInterestRate()).isZero();
            assertThat(summary.totalCurrentBalance().isZero()).isTrue();
        }

        @Test
        void repositoryFailure() {
            when(mortgageRepository.findAll()).thenReturn(Result.failure(RepositoryError.SERIALIZATION_ERROR));

            assertThat(service.summarize().getError()).isEqualTo(PortfolioError.REPOSITORY_FAILURE);
        }

        private BigDecimal balanceAfter(Mortgage mortgage, int month) {
            AmortizationSchedule schedule = amortizationEngine.generateSchedule(mortgage.configuration()).orElseThrow();
            return schedule.entry(month).orElseThrow().remainingBalance();
        }
    }

    @Nested
    @DisplayName("optimizations")
    class Optimizations {

        @Test
        @DisplayName("small expensive loan gets refinancing, consolidation and high-interest hints")
        void suggestionsForOutlier() {
            when(mortgageRepository.findAll()).thenReturn(Result.success(List.of(home, smallExpensive, closed)));

            List<PortfolioOptimization> suggestions = service.optimizations().orElseThrow();

            assertThat(suggestions).extracting(PortfolioOptimization::mortgageId).containsOnly("small");
            assertThat(suggestions).extracting(PortfolioOptimization::type).containsExactly(
                    PortfolioOptimization.Type.REFINANCING,
                    PortfolioOptimization.Type.CONSOLIDATION,
                    PortfolioOptimization.Type.HIGH_INTEREST);
        }

        @Test
        void uniformPortfolio_noSuggestions() {
            when(mortgageRepository.findAll()).thenReturn(Result.success(List.of(home)));

            assertThat(service.optimizations().orElseThrow()).isEmpty();
        }
    }

    @Nested
    @DisplayName("projectCashFlow")
    class ProjectCashFlow {

        @Test
        @DisplayName("first payment falls one month after the start month")
        void followsSchedules() {
            when(mortgageRepository.findAll()).thenReturn(Result.success(List.of(home, smallExpensive, closed)));

            CashFlowProjection projection = service.projectCashFlow(YearMonth.of(2024, 1), 3).orElseThrow();

            assertThat(projection.months()).extracting(CashFlowProjection.MonthlyCashFlow::month)
                    .containsExactly(YearMonth.of(2024, 1), YearMonth.of(2024, 2), YearMonth.of(2024, 3));
            assertThat(projection.months().get(0).totalPayment().isZero()).isTrue();

            AmortizationSchedule homeSchedule = amortizationEngine.generateSchedule(home.configuration()).orElseThrow();
            AmortizationSchedule smallSchedule = amortizationEngine.generateSchedule(smallExpensive.configuration())
                    .orElseThrow();
            CashFlowProjection.MonthlyCashFlow february = projection.months().get(1);
            assertThat(february.interest().toBigDecimal()).isEqualByComparingTo(cents(
                    homeSchedule.entry(1).orElseThrow().interestComponent()
                            .add(smallSchedule.entry(1).orElseThrow().interestComponent())));
            assertThat(february.remainingBalance().toBigDecimal()).isEqualByComparingTo(cents(
                    homeSchedule.entry(1).orElseThrow().remainingBalance()
                            .add(smallSchedule.entry(1).orElseThrow().remainingBalance())));
        }

        @Test
        void defaultHorizonStartsAtCurrentMonth() {
            when(mortgageRepository.findAll()).thenReturn(Result.success(List.of(home)));

            CashFlowProjection projection = service.projectCashFlow().orElseThrow();

            assertThat(projection.months()).hasSize(PortfolioAggregationService.DEFAULT_PROJECTION_MONTHS);
            assertThat(projection.months().get(0).month()).isEqualTo(YearMonth.of(2025, 1));
            assertThat(projection.months()).allSatisfy(flow -> assertThat(flow.totalPayment().isZero()).isFalse());
        }

        @Test
        void paidOffLoansContributeNothing() {
            when(mortgageRepository.findAll()).thenReturn(Result.success(List.of(smallExpensive)));

            CashFlowProjection projection = service.projectCashFlow(YearMonth.of(2034, 1), 3).orElseThrow();

            assertThat(projection.months().get(0).totalPayment().isZero()).isFalse();
            assertThat(projection.months().get(1).totalPayment().isZero()).isTrue();
            assertThat(projection.months().get(2).remainingBalance().isZero()).isTrue();
        }
    }

    @Nested
    @DisplayName("changes")
    class Changes {

        @Test
        @DisplayName("successful save publishes a SAVED event")
        void save_publishesEvent() {
            when(mortgageRepository.save(home)).thenReturn(Result.success(home));

            assertThat(service.saveMortgage(home).isSuccess()).isTrue();

            ArgumentCaptor<PortfolioChangedEvent> event = ArgumentCaptor.forClass(PortfolioChangedEvent.class);
            verify(applicationEventPublisher).publishEvent(event.capture());
            assertThat(event.getValue().getMortgageId()).isEqualTo("home");
            assertThat(event.getValue().getChangeType()).isEqualTo(PortfolioChangedEvent.ChangeType.SAVED);
        }

        @Test
        void failedSave_noEvent() {
            when(mortgageRepository.save(home)).thenReturn(Result.failure(RepositoryError.SERIALIZATION_ERROR));

            assertThat(service.saveMortgage(home).getError()).isEqualTo(RepositoryError.SERIALIZATION_ERROR);
            verifyNoInteractions(applicationEventPublisher);
        }

        @Test
        void delete_publishesEventOnlyWhenFound() {
            when(mortgageRepository.delete("home")).thenReturn(Result.success(null));
            when(mortgageRepository.delete("missing")).thenReturn(Result.failure(RepositoryError.NOT_FOUND));

            service.deleteMortgage("missing");
            verify(applicationEventPublisher, never()).publishEvent(any(PortfolioChangedEvent.class));

            service.deleteMortgage("home");
            ArgumentCaptor<PortfolioChangedEvent> event = ArgumentCaptor.forClass(PortfolioChangedEvent.class);
            verify(applicationEventPublisher).publishEvent(event.capture());
            assertThat(event.getValue().getChangeType()).isEqualTo(PortfolioChangedEvent.ChangeType.DELETED);
        }
    }
}
