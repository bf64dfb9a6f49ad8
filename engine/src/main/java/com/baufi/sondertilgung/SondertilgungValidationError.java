package com.baufi.sondertilgung;

public enum SondertilgungValidationError {
    EXCEEDS_ALLOWED_PERCENTAGE,
    BELOW_MINIMUM_AMOUNT,
    ABOVE_MAXIMUM_AMOUNT,
    WITHIN_GRACE_PERIOD,
    INSUFFICIENT_NOTICE,
    INVALID_PAYMENT_DATE,
    DURING_BLACKOUT_PERIOD,
    EXCESSIVE_FEE_AMOUNT,
    NOT_ALLOWED_FOR_BANK_TYPE
}
