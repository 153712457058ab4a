package com.flagship.pharmacy_ledger.projection;

import com.flagship.pharmacy_ledger.ledger.LedgerDomain;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Cached fold of an entity's movements up to {@code lastSequenceNumber}.
 *
 * A cache only: the ledger is the truth and the cache can always be rebuilt from it.
 * Opening balances are not part of the cached value.
 */
@Value
public class Projection {
    LedgerDomain domain;
    String entityKey;
    BigDecimal balance;
    long lastSequenceNumber;
    Instant updatedAt;

    public static Projection empty(LedgerDomain domain, String entityKey) {
        return new Projection(domain, entityKey, BigDecimal.ZERO, 0L, null);
    }
}
