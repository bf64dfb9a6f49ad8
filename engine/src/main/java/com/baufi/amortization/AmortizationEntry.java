package com.baufi.amortization;

import com.baufi.domain.Money;

import java.math.BigDecimal;

/**
 * One month of a schedule. Amounts are unrounded euros; {@code principalComponent} includes the extra payment,
 * so {@code interestComponent + principalComponent == totalPayment}.
 *
 * @param remainingMonths months still needed after this one at the regular payment
 */
public record AmortizationEntry(
        int month,
        BigDecimal startingBalance,
        BigDecimal interestComponent,
        BigDecimal principalComponent,
        BigDecimal extraPayment,
        BigDecimal totalPayment,
        BigDecimal remainingBalance,
        BigDecimal cumulativeInterest,
        BigDecimal cumulativePrincipal,
        double principalPercentage,
        int remainingMonths
) {

    public BigDecimal regularPrincipal() {
        return principalComponent.subtract(extraPayment);
    }

    public boolean hasExtraPayment() {
        return extraPayment.signum() > 0;
    }

    public Money remainingBalanceAsMoney() {
        return Money.of(remainingBalance).orElseThrow();
    }

    public Money totalPaymentAsMoney() {
        return Money.of(totalPayment).orElseThrow();
    }
}
