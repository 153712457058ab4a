package com.flagship.pharmacy_ledger.stock;

import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * A batch with its quantity as folded from the ledger.
 */
@Value
public class StockPosition {
    BatchKey batch;
    String manufacturer;
    LocalDate expiryDate;
    long currentQuantity;
    int reorderLevel;
    String location;
    BigDecimal costPrice;
    BigDecimal sellingPrice;

    public boolean isBelowReorderLevel() {
        return currentQuantity < reorderLevel;
    }

    public boolean isExpiredOn(LocalDate date) {
        return expiryDate.isBefore(date);
    }
}
