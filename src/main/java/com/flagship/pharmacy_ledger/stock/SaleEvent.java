package com.flagship.pharmacy_ledger.stock;

import com.flagship.pharmacy_ledger.ledger.Reference;
import lombok.Value;

import java.time.Instant;
import java.util.List;

/**
 * A proposed sale: one OUT movement per line, applied all together or not at all.
 */
@Value
public class SaleEvent {
    Reference reference;
    Instant occurredAt;
    List<StockLine> lines;
    String remarks;

    public static SaleEvent of(Reference reference, Instant occurredAt, List<StockLine> lines, String remarks) {
        if (reference == null || occurredAt == null) {
            throw new IllegalArgumentException("Reference and occurredAt are required");
        }
        if (lines == null || lines.isEmpty()) {
            throw new IllegalArgumentException("A sale needs at least one line");
        }
        return new SaleEvent(reference, occurredAt, List.copyOf(lines), remarks);
    }
}
