package com.flagship.pharmacy_ledger.projection;

import com.flagship.pharmacy_ledger.ledger.LedgerDomain;
import lombok.Value;

import java.math.BigDecimal;

/**
 * Result of comparing a cached projection with a fold of the ledger up to the same sequence number.
 */
@Value
public class ProjectionCheck {
    LedgerDomain domain;
    String entityKey;
    BigDecimal cached;
    BigDecimal folded;
    long lastSequenceNumber;

    public boolean isDrifted() {
        return cached.compareTo(folded) != 0;
    }
}
