package com.baufi.sondertilgung;

/**
 * Bank categories with distinct Sondertilgung policies.
 */
public enum GermanBankType {
    SPARKASSE("Sparkasse"),
    VOLKSBANK("Volksbank/Raiffeisenbank"),
    PRIVATBANK("Private Geschäftsbank"),
    BAUSPARKASSE("Bausparkasse"),
    HYPOTHEKENBANK("Hypothekenbank"),
    ONLINE_BANK("Online-Bank"),
    GENOSSENSCHAFTSBANK("Genossenschaftsbank");

    private final String label;

    GermanBankType(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }
}
