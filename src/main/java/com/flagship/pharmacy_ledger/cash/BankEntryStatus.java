package com.flagship.pharmacy_ledger.cash;

/**
 * Review state of an imported statement line.
 *
 * IMPORTED -> APPROVED and IMPORTED -> FLAGGED; both targets are terminal. A line is
 * FLAGGED when imported with a mismatching declared balance, never later.
 */
public enum BankEntryStatus {
    IMPORTED,
    APPROVED,
    FLAGGED;

    public boolean canTransitionTo(BankEntryStatus target) {
        return this == IMPORTED && target == APPROVED;
    }
}
