package com.flagship.pharmacy_ledger.stock;

import com.flagship.pharmacy_ledger.ledger.Reference;
import lombok.Value;

import java.time.Instant;
import java.util.List;

/**
 * A proposed receipt of goods: one IN movement per line.
 */
@Value
public class ReceiptEvent {
    Reference reference;
    Instant occurredAt;
    List<StockLine> lines;
    String remarks;

    public static ReceiptEvent of(Reference reference, Instant occurredAt, List<StockLine> lines, String remarks) {
        if (reference == null || occurredAt == null) {
            throw new IllegalArgumentException("Reference and occurredAt are required");
        }
        if (lines == null || lines.isEmpty()) {
            throw new IllegalArgumentException("A receipt needs at least one line");
        }
        for (StockLine line : lines) {
            if (line.getMetadata() == null || line.getMetadata().getExpiryDate() == null) {
                throw new IllegalArgumentException("Receipt line for " + line.getBatch() + " needs an expiry date");
            }
        }
        return new ReceiptEvent(reference, occurredAt, List.copyOf(lines), remarks);
    }
}
