package com.flagship.pharmacy_ledger.ledger;

/**
 * The two independent ledgers. Each has its own movement table.
 */
public enum LedgerDomain {
    STOCK("stock_movements"),
    CASH("cash_movements");

    private final String table;

    LedgerDomain(String table) {
        this.table = table;
    }

    public String table() {
        return table;
    }
}
