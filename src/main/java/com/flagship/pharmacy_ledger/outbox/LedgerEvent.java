package com.flagship.pharmacy_ledger.outbox;

import com.fasterxml.jackson.annotation.JsonIgnore;

/**
 * An event the ledger publishes through the outbox.
 *
 * The aggregate id is the Kafka key, so events of one batch or one account stay ordered.
 */
public interface LedgerEvent {

    String AGGREGATE_STOCK = "StockPosition";
    String AGGREGATE_CASH = "BankAccount";

    @JsonIgnore
    String getAggregateType();

    @JsonIgnore
    String getAggregateId();

    String getEventType();
}
