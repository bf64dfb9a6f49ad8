package com.baufi.analysis;

import com.baufi.domain.Money;

import java.util.List;

/**
 * Scenarios ranked by total cost, cheapest first.
 *
 * @param maximumSavings total cost of the most expensive scenario minus the cheapest
 */
public record ScenarioComparison(List<ScenarioResult> ranking, Money maximumSavings) {

    public ScenarioComparison {
        ranking = List.copyOf(ranking);
    }

    public ScenarioResult cheapest() {
        return ranking.get(0);
    }

    public record ScenarioResult(String name, LoanAnalysis analysis) {
    }
}
