package com.flagship.pharmacy_ledger.stock.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.pharmacy_ledger.ledger.LedgerEntry;
import com.flagship.pharmacy_ledger.ledger.MovementKind;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class LedgerEntryResponse {

    @JsonProperty("entry_id")
    UUID entryId;

    @JsonProperty("sequence_number")
    long sequenceNumber;

    @JsonProperty("entity_key")
    String entityKey;

    @JsonProperty("kind")
    MovementKind kind;

    @JsonProperty("signed_amount")
    BigDecimal signedAmount;

    @JsonProperty("reference")
    String reference;

    @JsonProperty("line_number")
    int lineNumber;

    @JsonProperty("occurred_at")
    Instant occurredAt;

    @JsonProperty("recorded_at")
    Instant recordedAt;

    @JsonProperty("remarks")
    String remarks;

    public static LedgerEntryResponse from(LedgerEntry entry) {
        return LedgerEntryResponse.builder()
            .entryId(entry.getEntryId())
            .sequenceNumber(entry.getSequenceNumber())
            .entityKey(entry.getEntityKey())
            .kind(entry.getKind())
            .signedAmount(entry.getSignedAmount())
            .reference(entry.getReference().toString())
            .lineNumber(entry.getLineNumber())
            .occurredAt(entry.getOccurredAt())
            .recordedAt(entry.getRecordedAt())
            .remarks(entry.getRemarks())
            .build();
    }
}
