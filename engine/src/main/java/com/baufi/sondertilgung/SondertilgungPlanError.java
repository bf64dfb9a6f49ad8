package com.baufi.sondertilgung;

public enum SondertilgungPlanError {
    EXCEEDS_YEARLY_LIMIT,
    DUPLICATE_PAYMENT_MONTH,
    INVALID_PAYMENT_AMOUNT,
    NO_PAYMENTS
}
