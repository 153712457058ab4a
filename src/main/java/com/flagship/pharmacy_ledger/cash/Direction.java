package com.flagship.pharmacy_ledger.cash;

import com.flagship.pharmacy_ledger.ledger.MovementKind;

import java.math.BigDecimal;

/**
 * Side of a bank statement line: CR adds to the balance, DR takes from it.
 */
public enum Direction {
    CR,
    DR;

    public MovementKind movementKind() {
        return this == CR ? MovementKind.CR : MovementKind.DR;
    }

    public BigDecimal signed(BigDecimal amount) {
        return this == CR ? amount : amount.negate();
    }
}
