package com.flagship.pharmacy_ledger.exception;

/**
 * A movement would take a batch below zero units. Nothing is appended.
 */
public class InsufficientStockException extends LedgerException {

    private final String batchKey;
    private final long requested;
    private final long available;

    public InsufficientStockException(String batchKey, long requested, long available) {
        super(String.format("Insufficient stock for batch %s: requested=%d, available=%d",
                batchKey, requested, available));
        this.batchKey = batchKey;
        this.requested = requested;
        this.available = available;
    }

    public String getBatchKey() {
        return batchKey;
    }

    public long getRequested() {
        return requested;
    }

    public long getAvailable() {
        return available;
    }
}
