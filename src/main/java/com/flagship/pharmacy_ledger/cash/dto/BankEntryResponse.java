package com.flagship.pharmacy_ledger.cash.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.pharmacy_ledger.cash.BankEntryStatus;
import com.flagship.pharmacy_ledger.cash.BankLedgerEntry;
import com.flagship.pharmacy_ledger.cash.Direction;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class BankEntryResponse {

    @JsonProperty("entry_id")
    UUID entryId;

    @JsonProperty("tran_id")
    String tranId;

    @JsonProperty("account_id")
    String accountId;

    @JsonProperty("occurred_at")
    Instant occurredAt;

    @JsonProperty("direction")
    Direction direction;

    @JsonProperty("amount")
    BigDecimal amount;

    @JsonProperty("running_balance")
    BigDecimal runningBalance;

    @JsonProperty("declared_balance")
    BigDecimal declaredBalance;

    @JsonProperty("description")
    String description;

    @JsonProperty("linked_reference_type")
    String linkedReferenceType;

    @JsonProperty("linked_reference_id")
    String linkedReferenceId;

    @JsonProperty("status")
    BankEntryStatus status;

    @JsonProperty("flag_reason")
    String flagReason;

    @JsonProperty("corrects_entry_id")
    UUID correctsEntryId;

    @JsonProperty("approved_by")
    String approvedBy;

    @JsonProperty("approved_at")
    Instant approvedAt;

    @JsonProperty("imported_at")
    Instant importedAt;

    public static BankEntryResponse from(BankLedgerEntry entry) {
        return BankEntryResponse.builder()
            .entryId(entry.getEntryId())
            .tranId(entry.getTranId())
            .accountId(entry.getAccountId())
            .occurredAt(entry.getOccurredAt())
            .direction(entry.getDirection())
            .amount(entry.getAmount())
            .runningBalance(entry.getRunningBalance())
            .declaredBalance(entry.getDeclaredBalance())
            .description(entry.getDescription())
            .linkedReferenceType(entry.getLinkedReferenceType())
            .linkedReferenceId(entry.getLinkedReferenceId())
            .status(entry.getStatus())
            .flagReason(entry.getFlagReason())
            .correctsEntryId(entry.getCorrectsEntryId())
            .approvedBy(entry.getApprovedBy())
            .approvedAt(entry.getApprovedAt())
            .importedAt(entry.getImportedAt())
            .build();
    }
}
