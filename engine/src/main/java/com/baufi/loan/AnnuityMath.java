package com.baufi.loan;

import java.util.OptionalInt;

/**
 * Closed-form annuity formulas. All rates are monthly decimals (0.035 / 12 for 3,5 % p.a.).
 */
public final class AnnuityMath {

    /** Slack for floating point noise before rounding a month count up. */
    private static final double MONTH_EPSILON = 1e-6;

    private AnnuityMath() {
    }

    /**
     * P = L * c(1+c)^n / ((1+c)^n - 1); straight line L / n when c is zero.
     */
    public static double annuityPayment(double principal, double monthlyRate, int numberOfPayments) {
        if (monthlyRate == 0) {
            return principal / numberOfPayments;
        }
        double factor = Math.pow(1 + monthlyRate, numberOfPayments);
        return principal * monthlyRate * factor / (factor - 1);
    }

    /**
     * Outstanding balance after {@code paymentsMade} regular annuity payments.
     */
    public static double remainingBalance(double principal, double monthlyRate, int numberOfPayments, int paymentsMade) {
        if (paymentsMade >= numberOfPayments) {
            return 0;
        }
        if (monthlyRate == 0) {
            return principal * (1 - (double) paymentsMade / numberOfPayments);
        }
        double total = Math.pow(1 + monthlyRate, numberOfPayments);
        double made = Math.pow(1 + monthlyRate, paymentsMade);
        return principal * (total - made) / (total - 1);
    }

    /**
     * Inverse annuity: months needed to repay {@code balance} with {@code payment},
     * ceil(-log(1 - balance*c/payment) / log(1+c)). Empty when the payment does not cover the interest.
     */
    public static OptionalInt monthsToRepay(double balance, double monthlyRate, double payment) {
        if (balance <= 0) {
            return OptionalInt.of(0);
        }
        if (payment <= 0) {
            return OptionalInt.empty();
        }
        if (monthlyRate == 0) {
            return OptionalInt.of(Math.max(1, (int) Math.ceil(balance / payment - MONTH_EPSILON)));
        }
        if (payment <= balance * monthlyRate) {
            return OptionalInt.empty();
        }
        double months = -Math.log(1 - balance * monthlyRate / payment) / Math.log(1 + monthlyRate);
        return OptionalInt.of(Math.max(1, (int) Math.ceil(months - MONTH_EPSILON)));
    }
}
