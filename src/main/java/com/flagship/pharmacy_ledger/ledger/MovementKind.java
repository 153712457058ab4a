package com.flagship.pharmacy_ledger.ledger;

import java.math.BigDecimal;

/**
 * Kind of a ledger movement and the sign its amount must carry.
 */
public enum MovementKind {
    IN(LedgerDomain.STOCK, 1),
    OUT(LedgerDomain.STOCK, -1),
    ADJUST(LedgerDomain.STOCK, 0),
    CR(LedgerDomain.CASH, 1),
    DR(LedgerDomain.CASH, -1);

    private final LedgerDomain domain;
    // 0 means either sign
    private final int sign;

    MovementKind(LedgerDomain domain, int sign) {
        this.domain = domain;
        this.sign = sign;
    }

    public LedgerDomain domain() {
        return domain;
    }

    public boolean accepts(BigDecimal signedAmount) {
        int actual = signedAmount.signum();
        if (actual == 0) {
            return false;
        }
        return sign == 0 || actual == sign;
    }
}
