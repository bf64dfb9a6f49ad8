package com.baufi.property;

public enum PropertyValuationError {
    INVALID_CURRENT_VALUE,
    INVALID_PURCHASE_PRICE,
    INVALID_VALUATION_DATE,
    FUTURE_VALUATION_DATE,
    VALUATION_TOO_OLD,
    VALUE_DECREASE_TOO_SEVERE,
    INVALID_LOCATION,
    UNSUPPORTED_VALUATION_METHOD
}
