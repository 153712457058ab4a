package com.flagship.pharmacy_ledger.exception;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * The running balance printed on a statement line disagrees with the ledger.
 *
 * The line is kept as a FLAGGED entry for manual resolution and never reaches the ledger.
 */
public class BalanceMismatchException extends LedgerException {

    private final String tranId;
    private final UUID flaggedEntryId;
    private final BigDecimal declaredBalance;
    private final BigDecimal computedBalance;

    public BalanceMismatchException(String tranId, UUID flaggedEntryId,
                                    BigDecimal declaredBalance, BigDecimal computedBalance) {
        super(String.format("Statement balance mismatch for %s: declared=%s, computed=%s",
                tranId, declaredBalance.toPlainString(), computedBalance.toPlainString()));
        this.tranId = tranId;
        this.flaggedEntryId = flaggedEntryId;
        this.declaredBalance = declaredBalance;
        this.computedBalance = computedBalance;
    }

    public String getTranId() {
        return tranId;
    }

    public UUID getFlaggedEntryId() {
        return flaggedEntryId;
    }

    public BigDecimal getDeclaredBalance() {
        return declaredBalance;
    }

    public BigDecimal getComputedBalance() {
        return computedBalance;
    }
}
