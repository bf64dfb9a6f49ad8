package com.baufi.amortization;

import com.baufi.sondertilgung.SondertilgungPlan;

/**
 * Schedule with a plan's extra payments compared to the plain annuity.
 */
public record SondertilgungImpact(String name, SondertilgungPlan plan, ScheduleComparison comparison) {
}
