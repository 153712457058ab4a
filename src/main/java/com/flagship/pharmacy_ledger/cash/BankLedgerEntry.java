package com.flagship.pharmacy_ledger.cash;

import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * A statement line as the ledger knows it.
 *
 * For IMPORTED and APPROVED entries {@code runningBalance} is the account balance right
 * after the line. FLAGGED entries never reached the ledger and carry no running balance.
 */
@Value
public class BankLedgerEntry {
    UUID entryId;
    String tranId;
    String accountId;
    Long ledgerSequenceNumber;
    Instant occurredAt;
    Direction direction;
    BigDecimal amount;
    BigDecimal runningBalance;
    BigDecimal declaredBalance;
    String description;
    String linkedReferenceType;
    String linkedReferenceId;
    BankEntryStatus status;
    String flagReason;
    UUID correctsEntryId;
    String approvedBy;
    Instant approvedAt;
    Instant importedAt;

    public boolean isApproved() {
        return approvedAt != null;
    }
}
