package com.baufi.loan;

import lombok.Builder;

/**
 * Raw form input. Any field may be missing; {@code termInMonths} wins over {@code termInYears}.
 */
@Builder
public record LoanConfigurationInput(
        Double amount,
        Double annualRate,
        Double termInMonths,
        Double termInYears,
        Double monthlyPayment
) {
}
