package com.flagship.pharmacy_ledger.exception;

public class ResourceNotFoundException extends LedgerException {

    public ResourceNotFoundException(String message) {
        super(message);
    }
}
