package com.flagship.pharmacy_ledger.outbox;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * An event waiting in, or already drained from, the outbox.
 *
 * Written atomically with the ledger append it describes, published later by
 * {@link OutboxPublisher}.
 */
@Value
public class OutboxEvent {
    UUID id;
    String aggregateType;      // StockPosition or BankAccount
    String aggregateId;        // entity key
    String eventType;
    String payload;            // JSON
    Instant createdAt;
    Instant publishedAt;       // null until published
    int retryCount;
    String lastError;
    Long sequenceNumber;

    public static OutboxEvent create(String aggregateType, String aggregateId,
                                     String eventType, String payload, Instant createdAt) {
        return new OutboxEvent(
            UUID.randomUUID(),
            aggregateType,
            aggregateId,
            eventType,
            payload,
            createdAt,
            null,
            0,
            null,
            null   // assigned by database
        );
    }

    public boolean isPublished() {
        return publishedAt != null;
    }
}
