package com.baufi.sondertilgung;

import com.baufi.domain.Money;

/**
 * Recommended yearly Sondertilgung tier.
 *
 * @param expectedSavings rough interest saving in whole euros (3 % p.a. over 10 years)
 * @param optimalTiming   "Sofort", "Vor Zinsbindungsende" or "Während der Zinsbindung"
 * @param riskAssessment  liquidity risk label: "Niedrig", "Mittel" or "Hoch"
 */
public record SondertilgungStrategy(int recommendedPercentage, Money recommendedAmount, String optimalTiming,
                                    long expectedSavings, String riskAssessment) {
}
