package com.flagship.pharmacy_ledger.exception;

/**
 * An external event was submitted again after it had already been applied.
 *
 * Not a business failure: the first submission's effect stands and the duplicate is a no-op.
 */
public abstract class AlreadyAppliedException extends LedgerException {

    protected AlreadyAppliedException(String message) {
        super(message);
    }

    /**
     * Identifier of the already-applied event, as the producer knows it.
     */
    public abstract String getExternalId();
}
