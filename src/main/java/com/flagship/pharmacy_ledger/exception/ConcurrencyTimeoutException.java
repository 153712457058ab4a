package com.flagship.pharmacy_ledger.exception;

/**
 * The entity lock could not be obtained within the retry budget.
 *
 * Safe to retry: nothing from the failed attempt was committed.
 */
public class ConcurrencyTimeoutException extends LedgerException {

    private final int attempts;

    public ConcurrencyTimeoutException(String operation, int attempts, Throwable cause) {
        super(String.format("Operation %s could not acquire its entity locks after %d attempt(s)",
                operation, attempts), cause);
        this.attempts = attempts;
    }

    public int getAttempts() {
        return attempts;
    }
}
