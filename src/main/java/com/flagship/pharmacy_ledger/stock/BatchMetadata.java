package com.flagship.pharmacy_ledger.stock;

import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * Descriptive data of a batch, taken from the receipt that first brings it in.
 * Later receipts may refresh the selling price and location.
 */
@Value
public class BatchMetadata {
    String manufacturer;
    LocalDate expiryDate;
    String location;
    Integer reorderLevel;       // null means the configured default
    BigDecimal sellingPrice;

    public static BatchMetadata of(String manufacturer, LocalDate expiryDate) {
        return new BatchMetadata(manufacturer, expiryDate, null, null, null);
    }
}
