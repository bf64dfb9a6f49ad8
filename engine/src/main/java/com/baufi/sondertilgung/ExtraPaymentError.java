package com.baufi.sondertilgung;

public enum ExtraPaymentError {
    INVALID_PAYMENT_MONTH,
    INVALID_AMOUNT,
    AMOUNT_TOO_LARGE
}
