package com.baufi.sondertilgung;

/**
 * Loan months (1-based, inclusive) in which no extra payment is accepted.
 */
public record BlackoutPeriod(int startMonth, int endMonth, String reason) {

    public BlackoutPeriod {
        if (startMonth < 1 || endMonth < startMonth) {
            throw new IllegalArgumentException("invalid blackout period " + startMonth + ".." + endMonth);
        }
    }

    public boolean contains(int loanMonth) {
        return loanMonth >= startMonth && loanMonth <= endMonth;
    }
}
