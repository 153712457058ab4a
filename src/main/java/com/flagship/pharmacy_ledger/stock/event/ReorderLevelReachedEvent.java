package com.flagship.pharmacy_ledger.stock.event;

import com.flagship.pharmacy_ledger.outbox.LedgerEvent;
import lombok.Value;

import java.time.Instant;

/**
 * A sale took a batch below its reorder level. Consumed by replenishment.
 */
@Value
public class ReorderLevelReachedEvent implements LedgerEvent {
    String batchKey;
    String medicineName;
    String batchNumber;
    long currentQuantity;
    int reorderLevel;
    Instant detectedAt;

    @Override
    public String getAggregateType() {
        return AGGREGATE_STOCK;
    }

    @Override
    public String getAggregateId() {
        return batchKey;
    }

    @Override
    public String getEventType() {
        return "ReorderLevelReached";
    }
}
