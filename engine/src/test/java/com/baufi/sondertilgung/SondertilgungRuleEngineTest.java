package com.baufi.sondertilgung;

import com.baufi.domain.LoanAmount;
import com.baufi.domain.Money;
import com.baufi.loan.FixedRatePeriod;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class SondertilgungRuleEngineTest {

    private static final LoanAmount LOAN = LoanAmount.of(300_000).orElseThrow();

    private final BankRuleRegistry registry = new BankRuleRegistry();
    private final SondertilgungRuleEngine engine = new SondertilgungRuleEngine();

    private static ExtraPayment payment(int month, double euros) {
        return ExtraPayment.of(month, euros).orElseThrow();
    }

    private static Money euros(double amount) {
        return Money.of(amount).orElseThrow();
    }

    @Nested
    @DisplayName("validatePayment")
    class ValidatePayment {

        @Test
        @DisplayName("existing payments of the same loan-year count towards the cap")
        void yearlyCapIncludesExistingPayments() {
            GermanSondertilgungRules online = registry.rulesFor(GermanBankType.ONLINE_BANK);

            assertThat(engine.validatePayment(online, payment(12, 90_000), LOAN, List.of(payment(6, 75_000))).getError())
                    .isEqualTo(SondertilgungValidationError.EXCEEDS_ALLOWED_PERCENTAGE);
            assertThat(engine.validatePayment(online, payment(13, 90_000), LOAN, List.of(payment(6, 75_000))).isSuccess())
                    .isTrue();
            assertThat(engine.validatePayment(online, payment(12, 75_000), LOAN, List.of(payment(6, 75_000))).isSuccess())
                    .isTrue();
        }

        @Test
        void amountBounds() {
            GermanSondertilgungRules sparkasse = registry.rulesFor(GermanBankType.SPARKASSE);

            assertThat(engine.validatePayment(sparkasse, payment(3, 500), LOAN, List.of()).getError())
                    .isEqualTo(SondertilgungValidationError.BELOW_MINIMUM_AMOUNT);
            assertThat(engine.validatePayment(sparkasse.withMaximumAmount(euros(10_000)), payment(3, 20_000), LOAN, null)
                    .getError())
                    .isEqualTo(SondertilgungValidationError.ABOVE_MAXIMUM_AMOUNT);
            assertThat(engine.validatePayment(sparkasse, payment(3, 30_000), LOAN, null).isSuccess()).isTrue();
        }

        @Test
        void bankWithoutTiersRejectsEverything() {
            GermanSondertilgungRules none = registry.rulesFor(GermanBankType.SPARKASSE).withAllowedPercentages(List.of());
            assertThat(engine.validatePayment(none, payment(3, 5_000), LOAN, List.of()).getError())
                    .isEqualTo(SondertilgungValidationError.NOT_ALLOWED_FOR_BANK_TYPE);
        }

        @Test
        void gracePeriodCountsFromFixedRateStart() {
            GermanSondertilgungRules sparkasse = registry.rulesFor(GermanBankType.SPARKASSE);
            FixedRatePeriod period = FixedRatePeriod.standard(10, 3.5, LocalDate.of(2024, 1, 1)).orElseThrow();

            assertThat(engine.validatePayment(sparkasse, payment(6, 5_000), LOAN, List.of(), period,
                    LocalDate.of(2024, 6, 1)).getError())
                    .isEqualTo(SondertilgungValidationError.WITHIN_GRACE_PERIOD);
            assertThat(engine.validatePayment(sparkasse, payment(13, 5_000), LOAN, List.of(), period,
                    LocalDate.of(2025, 1, 1)).isSuccess()).isTrue();
            assertThat(engine.validatePayment(sparkasse, payment(6, 5_000), LOAN, List.of(), null,
                    LocalDate.of(2024, 6, 1)).isSuccess()).isTrue();
        }
    }

    @Test
    void paymentDateRestrictions() {
        GermanSondertilgungRules sparkasse = registry.rulesFor(GermanBankType.SPARKASSE);
        LocalDate start = LocalDate.of(2024, 1, 15);

        assertThat(engine.validatePaymentDate(sparkasse, LocalDate.of(2024, 2, 29), start).isSuccess()).isTrue();
        assertThat(engine.validatePaymentDate(sparkasse, LocalDate.of(2024, 2, 28), start).getError())
                .isEqualTo(SondertilgungValidationError.INVALID_PAYMENT_DATE);

        GermanSondertilgungRules blackout = sparkasse.withTimingRestrictions(new TimingRestrictions(0, 0,
                PaymentDateRestriction.ANY_TIME, List.of(new BlackoutPeriod(1, 12, "Erstes Darlehensjahr"))));
        assertThat(engine.validatePaymentDate(blackout, LocalDate.of(2024, 12, 31), start).getError())
                .isEqualTo(SondertilgungValidationError.DURING_BLACKOUT_PERIOD);
        assertThat(engine.validatePaymentDate(blackout, LocalDate.of(2025, 1, 2), start).isSuccess()).isTrue();
    }

    @Test
    void paymentDatePredicates() {
        assertThat(PaymentDateRestriction.QUARTER_END.allows(LocalDate.of(2024, 6, 30))).isTrue();
        assertThat(PaymentDateRestriction.QUARTER_END.allows(LocalDate.of(2024, 5, 31))).isFalse();
        assertThat(PaymentDateRestriction.YEAR_END.allows(LocalDate.of(2024, 12, 31))).isTrue();
        assertThat(PaymentDateRestriction.YEAR_END.allows(LocalDate.of(2024, 11, 30))).isFalse();
    }

    @Test
    void noticePeriod() {
        GermanSondertilgungRules sparkasse = registry.rulesFor(GermanBankType.SPARKASSE);
        LocalDate notice = LocalDate.of(2024, 1, 1);

        assertThat(engine.validateNotice(sparkasse, notice, LocalDate.of(2024, 1, 31)).isSuccess()).isTrue();
        assertThat(engine.validateNotice(sparkasse, notice, LocalDate.of(2024, 1, 30)).getError())
                .isEqualTo(SondertilgungValidationError.INSUFFICIENT_NOTICE);
    }

    @Nested
    @DisplayName("calculateFees")
    class CalculateFees {

        @Test
        @DisplayName("Bausparkasse charges base rate plus penalty on the part above 5 %")
        void bausparkasseTieredFee() {
            GermanSondertilgungRules bausparkasse = registry.rulesFor(GermanBankType.BAUSPARKASSE);
            assertThat(engine.calculateFees(bausparkasse, payment(12, 20_000), LOAN, List.of()).orElseThrow())
                    .isEqualTo(euros(200));
            assertThat(engine.calculateFees(bausparkasse, payment(12, 10_000), LOAN, List.of()).orElseThrow())
                    .isEqualTo(euros(50));
        }

        @Test
        void excessIncludesEarlierPaymentsOfTheYear() {
            GermanSondertilgungRules bausparkasse = registry.rulesFor(GermanBankType.BAUSPARKASSE);
            // 10k + 10k in year 1 against a 15k cap: 5k excess on the second payment
            assertThat(engine.calculateFees(bausparkasse, payment(12, 10_000), LOAN, List.of(payment(3, 10_000)))
                    .orElseThrow())
                    .isEqualTo(euros(150));
        }

        @Test
        void otherBanks() {
            assertThat(engine.calculateFees(registry.rulesFor(GermanBankType.ONLINE_BANK), payment(12, 20_000), LOAN, null)
                    .orElseThrow().isZero()).isTrue();
            assertThat(engine.calculateFees(registry.rulesFor(GermanBankType.SPARKASSE), payment(12, 20_000), LOAN, null)
                    .orElseThrow()).isEqualTo(euros(200));
            assertThat(engine.calculateFees(registry.rulesFor(GermanBankType.HYPOTHEKENBANK), payment(12, 20_000), LOAN,
                    null).orElseThrow()).isEqualTo(euros(500));
        }
    }

    @Nested
    @DisplayName("recommendStrategy")
    class RecommendStrategy {

        private final GermanSondertilgungRules online = registry.rulesFor(GermanBankType.ONLINE_BANK);

        @Test
        void largestAffordableTier() {
            SondertilgungStrategy strategy = engine.recommendStrategy(online, LOAN, euros(70_000), null, null)
                    .orElseThrow();

            assertThat(strategy.recommendedPercentage()).isEqualTo(20);
            assertThat(strategy.recommendedAmount()).isEqualTo(euros(60_000));
            assertThat(strategy.expectedSavings()).isEqualTo(18_000L);
            assertThat(strategy.riskAssessment()).isEqualTo(SondertilgungRuleEngine.RISK_MEDIUM);
            assertThat(strategy.optimalTiming()).isEqualTo(SondertilgungRuleEngine.TIMING_IMMEDIATELY);
        }

        @Test
        void smallestTierWhenNothingFits() {
            SondertilgungStrategy strategy = engine.recommendStrategy(online, LOAN, euros(10_000), null, null)
                    .orElseThrow();
            assertThat(strategy.recommendedPercentage()).isEqualTo(10);
            assertThat(strategy.riskAssessment()).isEqualTo(SondertilgungRuleEngine.RISK_LOW);
            assertThat(engine.recommendStrategy(online, LOAN, euros(200_000), null, null).orElseThrow()
                    .riskAssessment()).isEqualTo(SondertilgungRuleEngine.RISK_HIGH);
        }

        @Test
        void timingFollowsFixedRatePeriod() {
            FixedRatePeriod period = FixedRatePeriod.standard(10, 3.5, LocalDate.of(2024, 1, 1)).orElseThrow();

            assertThat(engine.recommendStrategy(online, LOAN, euros(70_000), period, LocalDate.of(2025, 1, 1))
                    .orElseThrow().optimalTiming()).isEqualTo(SondertilgungRuleEngine.TIMING_DURING_PERIOD);
            assertThat(engine.recommendStrategy(online, LOAN, euros(70_000), period, LocalDate.of(2031, 1, 1))
                    .orElseThrow().optimalTiming()).isEqualTo(SondertilgungRuleEngine.TIMING_BEFORE_PERIOD_END);
            assertThat(engine.recommendStrategy(online, LOAN, euros(70_000), period, LocalDate.of(2035, 1, 1))
                    .orElseThrow().optimalTiming()).isEqualTo(SondertilgungRuleEngine.TIMING_IMMEDIATELY);
        }

        @Test
        void noTiers() {
            assertThat(engine.recommendStrategy(online.withAllowedPercentages(List.of()), LOAN, euros(70_000), null, null)
                    .getError()).isEqualTo(SondertilgungValidationError.NOT_ALLOWED_FOR_BANK_TYPE);
        }
    }
}
