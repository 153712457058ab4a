package com.flagship.pharmacy_ledger.stock.event;

import com.flagship.pharmacy_ledger.ledger.LedgerEntry;
import com.flagship.pharmacy_ledger.outbox.LedgerEvent;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

@Value
public class StockMovementRecordedEvent implements LedgerEvent {
    UUID entryId;
    long sequenceNumber;
    String batchKey;
    String kind;
    BigDecimal quantity;
    String referenceType;
    String referenceId;
    long quantityAfter;
    Instant occurredAt;

    public static StockMovementRecordedEvent from(LedgerEntry entry, long quantityAfter) {
        return new StockMovementRecordedEvent(
                entry.getEntryId(),
                entry.getSequenceNumber(),
                entry.getEntityKey(),
                entry.getKind().name(),
                entry.getSignedAmount(),
                entry.getReference().getType().name(),
                entry.getReference().getId(),
                quantityAfter,
                entry.getOccurredAt());
    }

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
        return "StockMovementRecorded";
    }
}
