package com.flagship.pharmacy_ledger.stock;

import lombok.Value;

import java.math.BigDecimal;

/**
 * One line of a sale or receipt. {@code metadata} is only read for receipts.
 */
@Value
public class StockLine {
    BatchKey batch;
    long quantity;
    BigDecimal unitPrice;
    BatchMetadata metadata;

    public static StockLine sale(BatchKey batch, long quantity, BigDecimal unitPrice) {
        validate(batch, quantity, unitPrice);
        return new StockLine(batch, quantity, unitPrice, null);
    }

    public static StockLine receipt(BatchKey batch, long quantity, BigDecimal unitCost, BatchMetadata metadata) {
        validate(batch, quantity, unitCost);
        return new StockLine(batch, quantity, unitCost, metadata);
    }

    private static void validate(BatchKey batch, long quantity, BigDecimal price) {
        if (batch == null) {
            throw new IllegalArgumentException("Batch cannot be null");
        }
        if (quantity <= 0) {
            throw new IllegalArgumentException("Quantity must be positive, got " + quantity);
        }
        if (price != null && price.signum() < 0) {
            throw new IllegalArgumentException("Price cannot be negative");
        }
    }
}
