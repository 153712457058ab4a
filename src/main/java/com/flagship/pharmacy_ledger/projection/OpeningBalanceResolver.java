package com.flagship.pharmacy_ledger.projection;

import com.flagship.pharmacy_ledger.ledger.LedgerDomain;

import java.math.BigDecimal;

/**
 * Supplies the value an entity starts from before its first movement.
 *
 * Domains without an implementation start at zero.
 */
public interface OpeningBalanceResolver {

    LedgerDomain domain();

    BigDecimal openingBalance(String entityKey);
}
