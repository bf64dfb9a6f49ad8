package com.baufi.loan;

/**
 * Kinds of rate lock offered by German lenders.
 */
public enum FixedRateType {
    /** Festzins: fixed for the whole period. */
    FIXED("Festzins"),
    /** Zinsbindung: fixed initially, renegotiated afterwards. */
    INITIAL_FIXED("Zinsbindung"),
    /** Zinsobergrenze: variable with a rate cap. */
    CAP_FIXED("Zinsobergrenze");

    private final String label;

    FixedRateType(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }
}
