package com.baufi.property;

/**
 * How a property value was established. Only bank, independent and insurance valuations are accepted for lending.
 */
public enum ValuationMethod {
    BANK_APPRAISAL("Bankgutachten", 95, true),
    INDEPENDENT_APPRAISAL("Unabhängiges Gutachten", 90, true),
    INSURANCE_VALUATION("Versicherungswert", 80, true),
    COMPARATIVE_MARKET_ANALYSIS("Vergleichswertanalyse", 70, false),
    ONLINE_ESTIMATE("Online-Schätzung", 60, false),
    SELF_ASSESSMENT("Eigene Schätzung", 40, false);

    private final String label;
    private final int reliabilityScore;
    private final boolean acceptableForMortgage;

    ValuationMethod(String label, int reliabilityScore, boolean acceptableForMortgage) {
        this.label = label;
        this.reliabilityScore = reliabilityScore;
        this.acceptableForMortgage = acceptableForMortgage;
    }

    public String getLabel() {
        return label;
    }

    public int getReliabilityScore() {
        return reliabilityScore;
    }

    public boolean isAcceptableForMortgage() {
        return acceptableForMortgage;
    }
}
