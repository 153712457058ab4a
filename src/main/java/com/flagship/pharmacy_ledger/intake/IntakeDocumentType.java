package com.flagship.pharmacy_ledger.intake;

/**
 * Kinds of candidate records the upstream document pipeline publishes.
 */
public enum IntakeDocumentType {
    POS_RECEIPT,
    SUPPLIER_INVOICE,
    BANK_STATEMENT_LINE
}
