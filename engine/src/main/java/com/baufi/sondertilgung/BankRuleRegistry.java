package com.baufi.sondertilgung;

import com.baufi.domain.Money;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Standard Sondertilgung rule sets of the German bank types. The table is built once and never changes.
 */
@Component
public class BankRuleRegistry {

    public static final Money STANDARD_MINIMUM_AMOUNT = Money.ofCents(100_000).orElseThrow();

    private static final Map<GermanBankType, GermanSondertilgungRules> RULES = buildRules();

    private static Map<GermanBankType, GermanSondertilgungRules> buildRules() {
        Map<GermanBankType, GermanSondertilgungRules> rules = new EnumMap<>(GermanBankType.class);
        rules.put(GermanBankType.SPARKASSE, standard(GermanBankType.SPARKASSE, List.of(5, 10),
                TimingRestrictions.of(12, 30, PaymentDateRestriction.MONTH_END),
                FeeStructure.percentage(1.0)));
        rules.put(GermanBankType.VOLKSBANK, standard(GermanBankType.VOLKSBANK, List.of(5, 10),
                TimingRestrictions.of(12, 30, PaymentDateRestriction.MONTH_END),
                FeeStructure.percentage(1.0)));
        rules.put(GermanBankType.GENOSSENSCHAFTSBANK, standard(GermanBankType.GENOSSENSCHAFTSBANK, List.of(5, 10),
                TimingRestrictions.of(12, 30, PaymentDateRestriction.MONTH_END),
                FeeStructure.percentage(0.75)));
        rules.put(GermanBankType.PRIVATBANK, standard(GermanBankType.PRIVATBANK, List.of(5, 10, 20),
                TimingRestrictions.of(6, 14, PaymentDateRestriction.ANY_TIME),
                FeeStructure.fixed(Money.ofCents(25_000).orElseThrow())));
        rules.put(GermanBankType.ONLINE_BANK, standard(GermanBankType.ONLINE_BANK, List.of(10, 20, 50),
                TimingRestrictions.of(3, 7, PaymentDateRestriction.ANY_TIME),
                FeeStructure.none()));
        rules.put(GermanBankType.BAUSPARKASSE, standard(GermanBankType.BAUSPARKASSE, List.of(5),
                TimingRestrictions.of(24, 60, PaymentDateRestriction.YEAR_END),
                FeeStructure.tiered(0.5, 2.0)));
        rules.put(GermanBankType.HYPOTHEKENBANK, standard(GermanBankType.HYPOTHEKENBANK, List.of(10, 20),
                TimingRestrictions.of(6, 30, PaymentDateRestriction.QUARTER_END),
                FeeStructure.fixed(Money.ofCents(50_000).orElseThrow())));
        return Collections.unmodifiableMap(rules);
    }

    private static GermanSondertilgungRules standard(GermanBankType bankType, List<Integer> percentages,
                                                     TimingRestrictions timing, FeeStructure fees) {
        return new GermanSondertilgungRules(bankType, percentages, STANDARD_MINIMUM_AMOUNT, null, timing, fees,
                SpecialConditions.STANDARD);
    }

    public GermanSondertilgungRules rulesFor(GermanBankType bankType) {
        Objects.requireNonNull(bankType, "bankType must not be null");
        return RULES.get(bankType);
    }

    public Set<GermanBankType> availableBankTypes() {
        return RULES.keySet();
    }

    public List<Integer> availablePercentages(GermanBankType bankType) {
        return rulesFor(bankType).allowedPercentages();
    }

    public boolean supportsUnlimitedSondertilgung(GermanBankType bankType) {
        return rulesFor(bankType).supportsUnlimitedSondertilgung();
    }
}
