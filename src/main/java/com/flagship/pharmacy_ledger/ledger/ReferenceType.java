package com.flagship.pharmacy_ledger.ledger;

public enum ReferenceType {
    POS,
    SUPPLIER_INVOICE,
    BANK_STATEMENT,
    MANUAL
}
