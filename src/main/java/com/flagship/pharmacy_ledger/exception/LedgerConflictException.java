package com.flagship.pharmacy_ledger.exception;

/**
 * Thrown by the ledger store when entries for a reference are already recorded.
 */
public class LedgerConflictException extends LedgerException {

    private final String referenceType;
    private final String referenceId;

    public LedgerConflictException(String referenceType, String referenceId) {
        super(String.format("Ledger already holds entries for reference %s/%s", referenceType, referenceId));
        this.referenceType = referenceType;
        this.referenceId = referenceId;
    }

    public String getReferenceType() {
        return referenceType;
    }

    public String getReferenceId() {
        return referenceId;
    }
}
