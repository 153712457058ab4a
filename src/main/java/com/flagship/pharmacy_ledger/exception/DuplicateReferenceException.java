package com.flagship.pharmacy_ledger.exception;

public class DuplicateReferenceException extends AlreadyAppliedException {

    private final String referenceType;
    private final String referenceId;

    public DuplicateReferenceException(String referenceType, String referenceId) {
        super(String.format("Reference %s/%s has already been applied", referenceType, referenceId));
        this.referenceType = referenceType;
        this.referenceId = referenceId;
    }

    public String getReferenceType() {
        return referenceType;
    }

    public String getReferenceId() {
        return referenceId;
    }

    @Override
    public String getExternalId() {
        return referenceType + "/" + referenceId;
    }
}
