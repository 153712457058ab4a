package com.flagship.pharmacy_ledger.document;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class PaymentStatusTest {

    @Test
    void testForwardTransitionsOnly() {
        assertTrue(PaymentStatus.PENDING.canTransitionTo(PaymentStatus.PARTIAL));
        assertTrue(PaymentStatus.PENDING.canTransitionTo(PaymentStatus.PAID));
        assertTrue(PaymentStatus.PARTIAL.canTransitionTo(PaymentStatus.PAID));

        assertFalse(PaymentStatus.PARTIAL.canTransitionTo(PaymentStatus.PENDING));
        assertFalse(PaymentStatus.PAID.canTransitionTo(PaymentStatus.PARTIAL));
        assertFalse(PaymentStatus.PENDING.canTransitionTo(PaymentStatus.PENDING));
    }
}
