package com.flagship.pharmacy_ledger.idempotency;

import com.flagship.pharmacy_ledger.ledger.LedgerDomain;
import com.flagship.pharmacy_ledger.ledger.LedgerTransactionExecutor;
import com.flagship.pharmacy_ledger.ledger.ReferenceType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.transaction.IllegalTransactionStateException;

import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Claims against the database only (Redis is disabled for tests).
 */
@SpringBootTest
class IdempotencyGuardTest {

    @Autowired
    private IdempotencyGuard guard;

    @Autowired
    private LedgerTransactionExecutor executor;

    private String referenceId;

    @BeforeEach
    void setUp() {
        referenceId = "R-" + UUID.randomUUID().toString().substring(0, 8);
    }

    private boolean claim(ReferenceType type, String id) {
        return executor.execute("test.claim", () -> guard.claim(type, id, LedgerDomain.STOCK));
    }

    @Test
    @DisplayName("First claim wins, later claims see it")
    void testClaimOnce() {
        assertFalse(guard.isClaimed(ReferenceType.POS, referenceId));

        assertTrue(claim(ReferenceType.POS, referenceId));
        assertFalse(claim(ReferenceType.POS, referenceId));
        assertTrue(guard.isClaimed(ReferenceType.POS, referenceId));
    }

    @Test
    @DisplayName("A claim disappears with its rolled back transaction")
    void testClaimRollsBack() {
        assertThrows(IllegalStateException.class, () -> executor.execute("test.claim", () -> {
            assertTrue(guard.claim(ReferenceType.SUPPLIER_INVOICE, referenceId, LedgerDomain.STOCK));
            throw new IllegalStateException("business failure after claim");
        }));

        assertFalse(guard.isClaimed(ReferenceType.SUPPLIER_INVOICE, referenceId));
        assertTrue(claim(ReferenceType.SUPPLIER_INVOICE, referenceId));
    }

    @Test
    @DisplayName("The same id under another reference type is a different event")
    void testClaimsAreScopedByType() {
        assertTrue(claim(ReferenceType.POS, referenceId));
        assertTrue(claim(ReferenceType.BANK_STATEMENT, referenceId));
    }

    @Test
    @DisplayName("Claims need a transaction and a usable reference")
    void testClaimPreconditions() {
        assertThrows(IllegalTransactionStateException.class,
                () -> guard.claim(ReferenceType.POS, referenceId, LedgerDomain.STOCK));
        assertThrows(IllegalArgumentException.class, () -> claim(ReferenceType.POS, " "));
        assertThrows(IllegalArgumentException.class, () -> claim(null, referenceId));
        assertThrows(IllegalArgumentException.class, () -> guard.isClaimed(ReferenceType.POS, null));
    }
}
