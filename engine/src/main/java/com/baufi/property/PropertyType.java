package com.baufi.property;

/**
 * Property types of the German residential and commercial market.
 */
public enum PropertyType {
    EIGENHEIM("Eigenheim", false),
    EIGENTUMSWOHNUNG("Eigentumswohnung", false),
    REIHENHAUS("Reihenhaus", false),
    DOPPELHAUSHAELFTE("Doppelhaushälfte", false),
    MEHRFAMILIENHAUS("Mehrfamilienhaus", true),
    BAUGRUNDSTUECK("Baugrundstück", false),
    GEWERBEIMMOBILIE("Gewerbeimmobilie", true);

    private final String label;
    private final boolean investmentClass;

    PropertyType(String label, boolean investmentClass) {
        this.label = label;
        this.investmentClass = investmentClass;
    }

    public String getLabel() {
        return label;
    }

    /** Investment-class objects get a lower maximum LTV. */
    public boolean isInvestmentClass() {
        return investmentClass;
    }
}
