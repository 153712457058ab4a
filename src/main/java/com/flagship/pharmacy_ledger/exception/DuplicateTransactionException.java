package com.flagship.pharmacy_ledger.exception;

public class DuplicateTransactionException extends AlreadyAppliedException {

    private final String tranId;

    public DuplicateTransactionException(String tranId) {
        super("Bank transaction already imported: " + tranId);
        this.tranId = tranId;
    }

    public String getTranId() {
        return tranId;
    }

    @Override
    public String getExternalId() {
        return tranId;
    }
}
