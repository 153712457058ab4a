package com.flagship.pharmacy_ledger.document;

public enum PaymentMode {
    CASH,
    CARD,
    UPI,
    INSURANCE
}
