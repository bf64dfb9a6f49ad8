package com.baufi.property;

public enum LocationQuality {
    PREMIUM("Erstklassige Lage (Top-Städte)"),
    GOOD("Gute Wohnlage"),
    AVERAGE("Normale Wohnlage"),
    BELOW_AVERAGE("Einfache Lage"),
    RURAL("Ländliche Lage");

    private final String description;

    LocationQuality(String description) {
        this.description = description;
    }

    public String getDescription() {
        return description;
    }
}
