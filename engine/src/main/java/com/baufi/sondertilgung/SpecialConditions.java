package com.baufi.sondertilgung;

/**
 * Contractual exceptions a bank may grant on top of its standard rules.
 */
public record SpecialConditions(boolean hardshipWaiver, boolean inheritanceException, boolean bonusPaymentAllowance,
                                boolean refinancingGracePeriod, boolean firstTimeHomeBuyerBenefits) {

    public static final SpecialConditions STANDARD = new SpecialConditions(true, true, true, false, false);
}
