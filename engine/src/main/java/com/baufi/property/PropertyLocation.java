package com.baufi.property;

import java.util.regex.Pattern;

/**
 * Address part relevant for valuation. {@code state} is the Bundesland.
 */
public record PropertyLocation(String city, String state, String postalCode, LocationQuality locationQuality) {

    private static final Pattern GERMAN_POSTAL_CODE = Pattern.compile("\\d{5}");

    public static boolean isValidGermanPostalCode(String postalCode) {
        return postalCode != null && GERMAN_POSTAL_CODE.matcher(postalCode).matches();
    }

    boolean isComplete() {
        return !isBlank(city) && !isBlank(state) && isValidGermanPostalCode(postalCode) && locationQuality != null;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
