package com.baufi.sondertilgung;

import java.util.List;
import java.util.Objects;

/**
 * @param gracePeriodMonths  months after the start of the fixed-rate period without extra payments
 * @param noticeRequiredDays days of notice the bank expects before a payment
 */
public record TimingRestrictions(int gracePeriodMonths, int noticeRequiredDays,
                                 PaymentDateRestriction allowedPaymentDates, List<BlackoutPeriod> blackoutPeriods) {

    public TimingRestrictions {
        Objects.requireNonNull(allowedPaymentDates, "allowedPaymentDates must not be null");
        blackoutPeriods = blackoutPeriods == null ? List.of() : List.copyOf(blackoutPeriods);
    }

    public static TimingRestrictions of(int gracePeriodMonths, int noticeRequiredDays,
                                        PaymentDateRestriction allowedPaymentDates) {
        return new TimingRestrictions(gracePeriodMonths, noticeRequiredDays, allowedPaymentDates, List.of());
    }
}
