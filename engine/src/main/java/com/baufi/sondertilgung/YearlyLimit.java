package com.baufi.sondertilgung;

import com.baufi.domain.LoanAmount;
import com.baufi.domain.Percentage;

import java.util.Objects;
import java.util.Optional;

/**
 * Yearly cap on extra payments of a {@link SondertilgungPlan}.
 */
public sealed interface YearlyLimit permits YearlyLimit.PercentageOfLoan, YearlyLimit.Unlimited {

    static YearlyLimit percentageOfLoan(Percentage percentage) {
        return new PercentageOfLoan(percentage);
    }

    static YearlyLimit unlimited() {
        return Unlimited.INSTANCE;
    }

    /** Maximum euros per loan-year, empty when unlimited. */
    Optional<Double> maxYearlyAmount(LoanAmount originalLoanAmount);

    String format();

    record PercentageOfLoan(Percentage percentage) implements YearlyLimit {

        public PercentageOfLoan {
            Objects.requireNonNull(percentage, "percentage must not be null");
        }

        @Override
        public Optional<Double> maxYearlyAmount(LoanAmount originalLoanAmount) {
            return Optional.of(originalLoanAmount.toEuros() * percentage.toDecimal());
        }

        @Override
        public String format() {
            return "Maximal " + percentage.format() + " der Darlehenssumme pro Jahr";
        }
    }

    final class Unlimited implements YearlyLimit {

        private static final Unlimited INSTANCE = new Unlimited();

        private Unlimited() {
        }

        @Override
        public Optional<Double> maxYearlyAmount(LoanAmount originalLoanAmount) {
            return Optional.empty();
        }

        @Override
        public String format() {
            return "Unbegrenzte Sondertilgungen";
        }

        @Override
        public String toString() {
            return "Unlimited";
        }
    }
}
