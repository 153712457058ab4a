package com.flagship.pharmacy_ledger.cash.event;

import com.flagship.pharmacy_ledger.outbox.LedgerEvent;
import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

@Value
public class BankEntryFlaggedEvent implements LedgerEvent {
    UUID entryId;
    String tranId;
    String accountId;
    BigDecimal declaredBalance;
    BigDecimal computedBalance;
    String reason;

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
        return "BankEntryFlagged";
    }
}
