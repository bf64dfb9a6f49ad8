package com.baufi.property;

/**
 * LTV risk bands; each band's upper bound is inclusive.
 */
public enum LtvRiskCategory {
    VERY_LOW("Sehr niedrig", 60, 0.0, "Sehr niedrig (≤60%) - Beste Konditionen"),
    LOW("Niedrig", 70, 0.10, "Niedrig (60-70%) - Gute Konditionen"),
    MEDIUM("Mittel", 80, 0.25, "Mittel (70-80%) - Standard Konditionen"),
    HIGH("Hoch", 90, 0.50, "Hoch (80-90%) - Erhöhte Zinsen"),
    VERY_HIGH("Sehr hoch", Double.POSITIVE_INFINITY, 1.00, "Sehr hoch (>90%) - Hohe Zinsen, schwierige Finanzierung");

    private final String label;
    private final double upperBoundPercent;
    private final double interestRatePremium;
    private final String description;

    LtvRiskCategory(String label, double upperBoundPercent, double interestRatePremium, String description) {
        this.label = label;
        this.upperBoundPercent = upperBoundPercent;
        this.interestRatePremium = interestRatePremium;
        this.description = description;
    }

    public static LtvRiskCategory classify(double ltvPercent) {
        for (LtvRiskCategory category : values()) {
            if (ltvPercent <= category.upperBoundPercent) {
                return category;
            }
        }
        return VERY_HIGH;
    }

    public String getLabel() {
        return label;
    }

    /** Surcharge on the nominal rate in percentage points. */
    public double getInterestRatePremium() {
        return interestRatePremium;
    }

    public String getDescription() {
        return description;
    }
}
