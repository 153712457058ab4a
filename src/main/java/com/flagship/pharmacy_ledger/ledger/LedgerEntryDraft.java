package com.flagship.pharmacy_ledger.ledger;

import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * A movement proposed for appending. The store assigns id, sequence number and recorded time.
 */
@Value
public class LedgerEntryDraft {
    LedgerDomain domain;
    String entityKey;
    BigDecimal signedAmount;
    MovementKind kind;
    Reference reference;
    int lineNumber;
    Instant occurredAt;
    String remarks;

    public static LedgerEntryDraft of(String entityKey, BigDecimal signedAmount, MovementKind kind,
                                      Reference reference, int lineNumber, Instant occurredAt,
                                      String remarks) {
        if (entityKey == null || entityKey.isBlank()) {
            throw new IllegalArgumentException("Entity key cannot be blank");
        }
        if (signedAmount == null) {
            throw new IllegalArgumentException("Amount cannot be null");
        }
        if (kind == null || reference == null || occurredAt == null) {
            throw new IllegalArgumentException("Kind, reference and occurredAt are required");
        }
        if (!kind.accepts(signedAmount)) {
            throw new IllegalArgumentException(
                    String.format("Amount %s is not valid for a %s movement", signedAmount.toPlainString(), kind));
        }
        if (lineNumber < 0) {
            throw new IllegalArgumentException("Line number cannot be negative");
        }
        return new LedgerEntryDraft(kind.domain(), entityKey, signedAmount, kind, reference,
                lineNumber, occurredAt, remarks);
    }
}
