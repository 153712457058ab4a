package com.flagship.pharmacy_ledger.exception;

/**
 * Base type for every failure the reconciliation engine reports to its callers.
 *
 * All subtypes are unchecked: a failed operation never leaves partial state behind,
 * so callers decide per type whether to retry, ignore or surface the failure.
 */
public abstract class LedgerException extends RuntimeException {

    protected LedgerException(String message) {
        super(message);
    }

    protected LedgerException(String message, Throwable cause) {
        super(message, cause);
    }
}
