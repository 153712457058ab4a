package com.flagship.pharmacy_ledger.cash.event;

import com.flagship.pharmacy_ledger.outbox.LedgerEvent;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

@Value
public class BankEntryApprovedEvent implements LedgerEvent {
    UUID entryId;
    String tranId;
    String accountId;
    String approvedBy;
    Instant approvedAt;

    @Override
    public String getAggregateType() {
        return AGGREGATE_CASH;
    }

    @Override
    public String getAggregateId() {
        return accountId;
    }

    @Override
    public String getEventType() {
        return "BankEntryApproved";
    }
}
