package com.baufi.portfolio;

import java.util.List;

/**
 * JSON snapshot of a {@link Mortgage}: raw numbers only, so reading it back goes through validation again.
 */
record StoredMortgage(
        String id,
        String name,
        String bankType,
        double amount,
        double annualRate,
        int termInMonths,
        double monthlyPayment,
        String startDate,
        boolean active,
        List<StoredExtraPayment> extraPayments
) {

    record StoredExtraPayment(int month, double amount) {
    }
}
