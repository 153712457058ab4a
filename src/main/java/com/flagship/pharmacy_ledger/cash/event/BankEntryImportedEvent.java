package com.flagship.pharmacy_ledger.cash.event;

import com.flagship.pharmacy_ledger.cash.BankLedgerEntry;
import com.flagship.pharmacy_ledger.outbox.LedgerEvent;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

@Value
public class BankEntryImportedEvent implements LedgerEvent {
    UUID entryId;
    String tranId;
    String accountId;
    String direction;
    BigDecimal amount;
    BigDecimal runningBalance;
    UUID correctsEntryId;
    Instant occurredAt;

    public static BankEntryImportedEvent from(BankLedgerEntry entry) {
        return new BankEntryImportedEvent(entry.getEntryId(), entry.getTranId(), entry.getAccountId(),
                entry.getDirection().name(), entry.getAmount(), entry.getRunningBalance(),
                entry.getCorrectsEntryId(), entry.getOccurredAt());
    }

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
        return "BankEntryImported";
    }
}
