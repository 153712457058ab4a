package com.flagship.pharmacy_ledger.ledger;

import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * A recorded movement. Immutable: corrections are new compensating entries.
 *
 * Ledger order is (occurredAt, recordedAt, sequenceNumber).
 */
@Value
public class LedgerEntry {
    long sequenceNumber;
    UUID entryId;
    LedgerDomain domain;
    String entityKey;
    BigDecimal signedAmount;
    MovementKind kind;
    Reference reference;
    int lineNumber;
    Instant occurredAt;
    Instant recordedAt;
    String remarks;
}
