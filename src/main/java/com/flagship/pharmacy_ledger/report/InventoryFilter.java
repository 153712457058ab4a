package com.flagship.pharmacy_ledger.report;

public enum InventoryFilter {
    FULL,
    LOW_STOCK,
    EXPIRING
}
