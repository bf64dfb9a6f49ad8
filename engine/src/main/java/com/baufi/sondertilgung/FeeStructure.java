package com.baufi.sondertilgung;

import com.baufi.domain.Money;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Objects;

/**
 * Pricing of an extra payment. Rates are percentages (0-100).
 * {@code excessAmount} is the part of the yearly total above the bank's percentage cap.
 */
public sealed interface FeeStructure permits FeeStructure.NoFee, FeeStructure.PercentageFee, FeeStructure.FixedFee,
        FeeStructure.TieredFee, FeeStructure.ExcessOnlyFee, FeeStructure.BoundedFee {

    int SCALE = 10;
    BigDecimal HUNDRED = BigDecimal.valueOf(100);

    BigDecimal feeEuros(BigDecimal paymentAmount, BigDecimal excessAmount);

    static FeeStructure none() {
        return new NoFee();
    }

    static FeeStructure percentage(double rate) {
        return new PercentageFee(rate);
    }

    static FeeStructure fixed(Money amount) {
        return new FixedFee(amount);
    }

    static FeeStructure tiered(double baseRate, double excessRate) {
        return new TieredFee(baseRate, excessRate);
    }

    static FeeStructure excessOnly(double excessRate) {
        return new ExcessOnlyFee(excessRate);
    }

    /** Clamps this structure's fee into [minimumFee, maximumFee]; either bound may be null. */
    default FeeStructure bounded(Money minimumFee, Money maximumFee) {
        return new BoundedFee(this, minimumFee, maximumFee);
    }

    private static BigDecimal percentOf(BigDecimal amount, double rate) {
        return amount.multiply(BigDecimal.valueOf(rate)).divide(HUNDRED, SCALE, RoundingMode.HALF_UP);
    }

    record NoFee() implements FeeStructure {
        @Override
        public BigDecimal feeEuros(BigDecimal paymentAmount, BigDecimal excessAmount) {
            return BigDecimal.ZERO;
        }
    }

    record PercentageFee(double rate) implements FeeStructure {
        @Override
        public BigDecimal feeEuros(BigDecimal paymentAmount, BigDecimal excessAmount) {
            return percentOf(paymentAmount, rate);
        }
    }

    record FixedFee(Money amount) implements FeeStructure {
        public FixedFee {
            Objects.requireNonNull(amount, "amount must not be null");
        }

        @Override
        public BigDecimal feeEuros(BigDecimal paymentAmount, BigDecimal excessAmount) {
            return amount.toBigDecimal();
        }
    }

    /** Base rate on the whole payment plus a penalty rate on the excess. */
    record TieredFee(double baseRate, double excessRate) implements FeeStructure {
        @Override
        public BigDecimal feeEuros(BigDecimal paymentAmount, BigDecimal excessAmount) {
            return percentOf(paymentAmount, baseRate).add(percentOf(excessAmount, excessRate));
        }
    }

    record ExcessOnlyFee(double excessRate) implements FeeStructure {
        @Override
        public BigDecimal feeEuros(BigDecimal paymentAmount, BigDecimal excessAmount) {
            return percentOf(excessAmount, excessRate);
        }
    }

    record BoundedFee(FeeStructure base, Money minimumFee, Money maximumFee) implements FeeStructure {
        public BoundedFee {
            Objects.requireNonNull(base, "base must not be null");
        }

        @Override
        public BigDecimal feeEuros(BigDecimal paymentAmount, BigDecimal excessAmount) {
            BigDecimal fee = base.feeEuros(paymentAmount, excessAmount);
            if (minimumFee != null) {
                fee = fee.max(minimumFee.toBigDecimal());
            }
            if (maximumFee != null) {
                fee = fee.min(maximumFee.toBigDecimal());
            }
            return fee;
        }
    }
}
