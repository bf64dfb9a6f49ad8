package com.baufi.loan;

import java.util.Objects;

/**
 * Named configuration used when comparing alternatives.
 */
public record LoanScenario(String name, LoanConfiguration configuration, String description) {

    public LoanScenario {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(configuration, "configuration must not be null");
    }

    public static LoanScenario of(String name, LoanConfiguration configuration) {
        return new LoanScenario(name, configuration, null);
    }
}
