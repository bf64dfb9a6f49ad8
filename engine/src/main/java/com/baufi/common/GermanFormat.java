package com.baufi.common;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.text.DecimalFormat;
import java.text.DecimalFormatSymbols;
import java.util.Locale;

/**
 * Locale-fixed German number output: "." groups thousands, "," separates decimals, units follow
 * the number after a no-break space ("1.234,56 €", "3,50 %").
 * DecimalFormat is not thread-safe, so every call builds its own instance.
 */
public final class GermanFormat {

    public static final char NO_BREAK_SPACE = '\u00A0';

    private static final DecimalFormatSymbols SYMBOLS = DecimalFormatSymbols.getInstance(Locale.GERMANY);

    private GermanFormat() {
    }

    /** "1.234,56 €" */
    public static String euros(BigDecimal amount) {
        return decimal(amount, 2) + NO_BREAK_SPACE + "€";
    }

    public static String euros(double amount) {
        return euros(BigDecimal.valueOf(amount));
    }

    /**
     * Percent value (0-100 scale) with fixed precision: {@code percent(3.5, 2)} gives "3,50 %".
     * Rounds the shortest decimal form of the fraction {@code percentValue / 100}, so 1.005 gives "1,00 %"
     * and 2.675 gives "2,68 %".
     */
    public static String percent(double percentValue, int decimals) {
        BigDecimal fraction = BigDecimal.valueOf(percentValue / 100);
        return decimal(fraction.movePointRight(2), decimals) + NO_BREAK_SPACE + "%";
    }

    public static String decimal(double value, int decimals) {
        return decimal(BigDecimal.valueOf(value), decimals);
    }

    public static String decimal(BigDecimal value, int decimals) {
        if (decimals < 0) {
            throw new IllegalArgumentException("decimals must be >= 0, got: " + decimals);
        }
        DecimalFormat format = new DecimalFormat(pattern(decimals), SYMBOLS);
        format.setRoundingMode(RoundingMode.HALF_UP);
        return format.format(value.setScale(decimals, RoundingMode.HALF_UP));
    }

    /** Whole number with thousands grouping: "1.234.567". */
    public static String integer(long value) {
        DecimalFormat format = new DecimalFormat("#,##0", SYMBOLS);
        return format.format(value);
    }

    private static String pattern(int decimals) {
        if (decimals == 0) {
            return "#,##0";
        }
        return "#,##0." + "0".repeat(decimals);
    }
}
