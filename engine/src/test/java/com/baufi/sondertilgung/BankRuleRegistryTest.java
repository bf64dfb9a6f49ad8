package com.baufi.sondertilgung;

import com.baufi.domain.LoanAmount;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class BankRuleRegistryTest {

    private final BankRuleRegistry registry = new BankRuleRegistry();

    @Test
    void coversEveryBankType() {
        assertThat(registry.availableBankTypes()).containsExactlyInAnyOrder(GermanBankType.values());
    }

    @ParameterizedTest
    @CsvSource({
            "SPARKASSE, 10, 12, 30, MONTH_END",
            "VOLKSBANK, 10, 12, 30, MONTH_END",
            "GENOSSENSCHAFTSBANK, 10, 12, 30, MONTH_END",
            "PRIVATBANK, 20, 6, 14, ANY_TIME",
            "ONLINE_BANK, 50, 3, 7, ANY_TIME",
            "BAUSPARKASSE, 5, 24, 60, YEAR_END",
            "HYPOTHEKENBANK, 20, 6, 30, QUARTER_END"
    })
    void standardTerms(GermanBankType bankType, int maxPercentage, int graceMonths, int noticeDays,
                       PaymentDateRestriction dates) {
        GermanSondertilgungRules rules = registry.rulesFor(bankType);

        assertThat(rules.bankType()).isEqualTo(bankType);
        assertThat(rules.maxAllowedPercentage()).hasValue(maxPercentage);
        assertThat(rules.timingRestrictions().gracePeriodMonths()).isEqualTo(graceMonths);
        assertThat(rules.timingRestrictions().noticeRequiredDays()).isEqualTo(noticeDays);
        assertThat(rules.timingRestrictions().allowedPaymentDates()).isEqualTo(dates);
        assertThat(rules.minimumAmount()).isEqualTo(BankRuleRegistry.STANDARD_MINIMUM_AMOUNT);
        assertThat(rules.maximumPaymentAmount()).isEmpty();
    }

    @Test
    void feeStructures() {
        assertThat(registry.rulesFor(GermanBankType.ONLINE_BANK).feeStructure()).isInstanceOf(FeeStructure.NoFee.class);
        assertThat(registry.rulesFor(GermanBankType.BAUSPARKASSE).feeStructure())
                .isEqualTo(new FeeStructure.TieredFee(0.5, 2.0));
        assertThat(registry.rulesFor(GermanBankType.GENOSSENSCHAFTSBANK).feeStructure())
                .isEqualTo(new FeeStructure.PercentageFee(0.75));
    }

    @Test
    void percentagesAreSortedAndNoneUnlimited() {
        assertThat(registry.availablePercentages(GermanBankType.ONLINE_BANK)).containsExactly(10, 20, 50);
        for (GermanBankType bankType : GermanBankType.values()) {
            assertThat(registry.supportsUnlimitedSondertilgung(bankType)).isFalse();
        }
    }

    @Test
    void derivedRulesLeaveTableUntouched() {
        GermanSondertilgungRules custom = registry.rulesFor(GermanBankType.SPARKASSE)
                .withAllowedPercentages(List.of(100, 5, 5));

        assertThat(custom.allowedPercentages()).containsExactly(5, 100);
        assertThat(custom.supportsUnlimitedSondertilgung()).isTrue();
        assertThat(registry.rulesFor(GermanBankType.SPARKASSE).allowedPercentages()).containsExactly(5, 10);
    }

    @Test
    void yearlyCapUsesLargestTier() {
        LoanAmount loan = LoanAmount.of(300_000).orElseThrow();
        assertThat(registry.rulesFor(GermanBankType.ONLINE_BANK).maxYearlyAmount(loan)).isEqualByComparingTo("150000");
        assertThat(registry.rulesFor(GermanBankType.BAUSPARKASSE).maxYearlyAmount(loan)).isEqualByComparingTo("15000");
        assertThat(registry.rulesFor(GermanBankType.SPARKASSE).withAllowedPercentages(List.of()).maxYearlyAmount(loan))
                .isEqualByComparingTo("0");
    }
}
