package com.flagship.pharmacy_ledger.stock;

import com.flagship.pharmacy_ledger.ledger.LedgerEntry;
import com.flagship.pharmacy_ledger.ledger.Reference;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * Outcome of an applied stock event.
 */
@Value
public class StockMovementResult {
    Reference reference;
    List<LedgerEntry> entries;
    Map<String, Long> quantitiesAfter;
    List<ExpiredBatchWarning> warnings;

    public long quantityAfter(BatchKey batch) {
        Long quantity = quantitiesAfter.get(batch.entityKey());
        if (quantity == null) {
            throw new IllegalArgumentException("Batch " + batch + " is not part of this movement");
        }
        return quantity;
    }

    public boolean hasWarnings() {
        return !warnings.isEmpty();
    }
}
