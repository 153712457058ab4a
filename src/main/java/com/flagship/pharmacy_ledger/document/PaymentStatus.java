package com.flagship.pharmacy_ledger.document;

/**
 * Settlement state of a sale or invoice: PENDING -> PARTIAL -> PAID, or PENDING -> PAID.
 */
public enum PaymentStatus {
    PENDING,
    PARTIAL,
    PAID;

    public boolean canTransitionTo(PaymentStatus target) {
        return switch (this) {
            case PENDING -> target == PARTIAL || target == PAID;
            case PARTIAL -> target == PAID;
            case PAID -> false;
        };
    }
}
