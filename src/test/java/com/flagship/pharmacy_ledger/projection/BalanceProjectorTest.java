package com.flagship.pharmacy_ledger.projection;

import com.flagship.pharmacy_ledger.config.LedgerProperties;
import com.flagship.pharmacy_ledger.ledger.LedgerDomain;
import com.flagship.pharmacy_ledger.ledger.LedgerEntry;
import com.flagship.pharmacy_ledger.ledger.LedgerEntryDraft;
import com.flagship.pharmacy_ledger.ledger.LedgerStore;
import com.flagship.pharmacy_ledger.ledger.LedgerTransactionExecutor;
import com.flagship.pharmacy_ledger.ledger.MovementKind;
import com.flagship.pharmacy_ledger.ledger.Reference;
import com.flagship.pharmacy_ledger.ledger.ReferenceType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Cached projections against full folds of the ledger.
 */
@SpringBootTest
class BalanceProjectorTest {

    @Autowired
    private BalanceProjector projector;

    @Autowired
    private LedgerStore ledgerStore;

    @Autowired
    private EntityLockManager lockManager;

    @Autowired
    private ProjectionCacheRepository cacheRepository;

    @Autowired
    private LedgerTransactionExecutor executor;

    @Autowired
    private LedgerProperties properties;

    private String entityKey;
    private String suffix;
    private Instant base;

    @BeforeEach
    void setUp() {
        suffix = UUID.randomUUID().toString().substring(0, 8);
        entityKey = "amoxicillin-250|B-" + suffix;
        base = Instant.now().minus(5, ChronoUnit.DAYS).truncatedTo(ChronoUnit.SECONDS);
    }

    private BigDecimal appendAndFold(String referenceId, String amount, MovementKind kind, int dayOffset) {
        return executor.execute("test.fold", () -> {
            Projection locked = lockManager.lock(LedgerDomain.STOCK, entityKey);
            List<LedgerEntry> appended = ledgerStore.append(List.of(LedgerEntryDraft.of(entityKey,
                    new BigDecimal(amount), kind, Reference.of(ReferenceType.POS, referenceId), 1,
                    base.plus(dayOffset, ChronoUnit.DAYS), null)));
            return projector.foldForward(locked, appended);
        });
    }

    private void appendWithoutFold(String referenceId, String amount) {
        executor.run("test.append", () -> {
            lockManager.lock(LedgerDomain.STOCK, entityKey);
            ledgerStore.append(List.of(LedgerEntryDraft.of(entityKey, new BigDecimal(amount), MovementKind.IN,
                    Reference.of(ReferenceType.SUPPLIER_INVOICE, referenceId), 1, base, null)));
        });
    }

    @Test
    @DisplayName("foldForward keeps the cache equal to a full fold")
    void testFoldForward() {
        assertEquals(0, new BigDecimal("100").compareTo(appendAndFold("P1-" + suffix, "100", MovementKind.IN, 0)));
        assertEquals(0, new BigDecimal("70").compareTo(appendAndFold("P2-" + suffix, "-30", MovementKind.OUT, 1)));

        Projection cached = cacheRepository.find(LedgerDomain.STOCK, entityKey).orElseThrow();
        assertEquals(0, new BigDecimal("70").compareTo(cached.getBalance()));
        assertEquals(0, new BigDecimal("70").compareTo(projector.recompute(LedgerDomain.STOCK, entityKey)));
        assertFalse(projector.verify(LedgerDomain.STOCK, entityKey).isDrifted());
    }

    @Test
    @DisplayName("Reads catch up on entries the cache has not folded yet")
    void testStaleCacheCatchUp() {
        appendAndFold("P3-" + suffix, "10", MovementKind.IN, 0);
        appendWithoutFold("INV-P4-" + suffix, "15");

        assertEquals(0, new BigDecimal("10").compareTo(
                cacheRepository.find(LedgerDomain.STOCK, entityKey).orElseThrow().getBalance()));
        assertEquals(0, new BigDecimal("25").compareTo(projector.current(LedgerDomain.STOCK, entityKey)));
        assertFalse(projector.verify(LedgerDomain.STOCK, entityKey).isDrifted(),
                "a lagging cache is not drift");

        assertEquals(0, new BigDecimal("35").compareTo(appendAndFold("P5-" + suffix, "10", MovementKind.IN, 1)));
    }

    @Test
    @DisplayName("A corrupted cache is detected and rebuilt from the ledger")
    void testDriftRepair() {
        appendAndFold("P6-" + suffix, "40", MovementKind.IN, 0);
        Projection cached = cacheRepository.find(LedgerDomain.STOCK, entityKey).orElseThrow();
        cacheRepository.update(LedgerDomain.STOCK, entityKey, new BigDecimal("999"),
                cached.getLastSequenceNumber(), Instant.now());

        ProjectionCheck check = projector.verify(LedgerDomain.STOCK, entityKey);
        assertTrue(check.isDrifted());
        assertEquals(0, new BigDecimal("40").compareTo(check.getFolded()));

        ProjectionAuditor auditor = new ProjectionAuditor(cacheRepository, projector, executor, properties);
        assertTrue(auditor.auditOne(LedgerDomain.STOCK, entityKey));
        assertFalse(auditor.auditOne(LedgerDomain.STOCK, entityKey));

        assertEquals(0, new BigDecimal("40").compareTo(projector.current(LedgerDomain.STOCK, entityKey)));
    }

    @Test
    @DisplayName("As-of values fold only entries that occurred by then")
    void testAsOf() {
        appendAndFold("P7-" + suffix, "20", MovementKind.IN, 0);
        appendAndFold("P8-" + suffix, "-5", MovementKind.OUT, 2);

        assertEquals(0, BigDecimal.ZERO.compareTo(projector.asOf(LedgerDomain.STOCK, entityKey, base.minusSeconds(1))));
        assertEquals(0, new BigDecimal("20").compareTo(projector.asOf(LedgerDomain.STOCK, entityKey, base)));
        assertEquals(0, new BigDecimal("15").compareTo(
                projector.asOf(LedgerDomain.STOCK, entityKey, base.plus(3, ChronoUnit.DAYS))));
    }

    @Test
    @DisplayName("lockAll locks every key once, in ascending order")
    void testLockAllOrder() {
        String a = "a-" + suffix;
        String b = "b-" + suffix;
        String c = "c-" + suffix;

        Map<String, Projection> locked = executor.execute("test.lock",
                () -> lockManager.lockAll(LedgerDomain.STOCK, List.of(c, a, b, a)));

        assertEquals(List.of(a, b, c), List.copyOf(locked.keySet()));
        assertTrue(cacheRepository.find(LedgerDomain.STOCK, b).isPresent());
    }
}
