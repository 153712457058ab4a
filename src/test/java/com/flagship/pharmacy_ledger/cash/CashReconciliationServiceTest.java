package com.flagship.pharmacy_ledger.cash;

import com.flagship.pharmacy_ledger.exception.AlreadyApprovedException;
import com.flagship.pharmacy_ledger.exception.BalanceMismatchException;
import com.flagship.pharmacy_ledger.exception.DuplicateTransactionException;
import com.flagship.pharmacy_ledger.exception.ResourceNotFoundException;
import com.flagship.pharmacy_ledger.ledger.LedgerDomain;
import com.flagship.pharmacy_ledger.ledger.LedgerStore;
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
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Bank ledger behaviour: balance continuity, duplicate lines, flagging and approval.
 */
@SpringBootTest
class CashReconciliationServiceTest {

    @Autowired
    private CashReconciliationService cashService;

    @Autowired
    private LedgerStore ledgerStore;

    private String accountId;
    private String suffix;
    private Instant opened;

    @BeforeEach
    void setUp() {
        suffix = UUID.randomUUID().toString().substring(0, 8);
        accountId = "HDFC-" + suffix;
        opened = Instant.now().minus(30, ChronoUnit.DAYS).truncatedTo(ChronoUnit.SECONDS);
        cashService.openAccount(accountId, "HDFC Current " + suffix, new BigDecimal("100000.00"), opened);
    }

    private StatementLine line(String tranId, int dayOffset, Direction direction, String amount, String declared) {
        return StatementLine.of(accountId, tranId + "-" + suffix, opened.plus(dayOffset, ChronoUnit.DAYS),
                direction, new BigDecimal(amount), "Statement line " + tranId,
                declared == null ? null : new BigDecimal(declared), null);
    }

    @Test
    @DisplayName("Opening 100000, CR 5000, DR 20000, replaying the first line changes nothing")
    void testBalanceContinuityAndDuplicate() {
        BankLedgerEntry credit = cashService.importStatementEntry(line("T1", 1, Direction.CR, "5000.00", null));
        assertEquals(0, new BigDecimal("105000.00").compareTo(credit.getRunningBalance()));
        assertEquals(BankEntryStatus.IMPORTED, credit.getStatus());

        BankLedgerEntry debit = cashService.importStatementEntry(line("T2", 2, Direction.DR, "20000.00", "85000.00"));
        assertEquals(0, new BigDecimal("85000.00").compareTo(debit.getRunningBalance()));

        DuplicateTransactionException e = assertThrows(DuplicateTransactionException.class,
                () -> cashService.importStatementEntry(line("T1", 1, Direction.CR, "5000.00", null)));
        assertEquals("T1-" + suffix, e.getExternalId());

        assertEquals(0, new BigDecimal("85000.00").compareTo(cashService.balance(accountId)));
        assertEquals(2, ledgerStore.read(LedgerDomain.CASH, accountId).stream().count());
    }

    @Test
    @DisplayName("A declared balance mismatch is kept as FLAGGED and leaves the balance untouched")
    void testMismatchFlagged() {
        cashService.importStatementEntry(line("M1", 1, Direction.CR, "1000.00", "101000.00"));

        BalanceMismatchException e = assertThrows(BalanceMismatchException.class,
                () -> cashService.importStatementEntry(line("M2", 2, Direction.DR, "500.00", "99999.00")));
        assertEquals(0, new BigDecimal("100500.00").compareTo(e.getComputedBalance()));

        BankLedgerEntry flagged = cashService.findEntry(e.getFlaggedEntryId()).orElseThrow();
        assertEquals(BankEntryStatus.FLAGGED, flagged.getStatus());
        assertNull(flagged.getRunningBalance());
        assertNotNull(flagged.getFlagReason());

        assertEquals(0, new BigDecimal("101000.00").compareTo(cashService.balance(accountId)));
        assertThrows(DuplicateTransactionException.class,
                () -> cashService.importStatementEntry(line("M2", 2, Direction.DR, "500.00", "100500.00")),
                "a flagged line keeps its transaction id");
    }

    @Test
    @DisplayName("Resolving a flagged line imports a linked correction and leaves the original intact")
    void testResolveFlagged() {
        BalanceMismatchException e = assertThrows(BalanceMismatchException.class,
                () -> cashService.importStatementEntry(line("F1", 1, Direction.CR, "250.00", "100000.00")));

        StatementLine corrected = line("F1", 1, Direction.CR, "250.00", "100250.00");
        BankLedgerEntry correction = cashService.resolveFlagged(e.getFlaggedEntryId(), corrected, "accountant");

        assertEquals("F1-" + suffix + "-R1", correction.getTranId());
        assertEquals(e.getFlaggedEntryId(), correction.getCorrectsEntryId());
        assertEquals(BankEntryStatus.IMPORTED, correction.getStatus());
        assertEquals(0, new BigDecimal("100250.00").compareTo(cashService.balance(accountId)));

        assertEquals(BankEntryStatus.FLAGGED,
                cashService.findEntry(e.getFlaggedEntryId()).orElseThrow().getStatus());
        assertThrows(IllegalStateException.class,
                () -> cashService.resolveFlagged(e.getFlaggedEntryId(), corrected, "accountant"));
        assertThrows(IllegalStateException.class,
                () -> cashService.resolveFlagged(correction.getEntryId(), corrected, "accountant"),
                "only FLAGGED entries can be resolved");
    }

    @Test
    @DisplayName("Approval is set exactly once, whoever tries the second time")
    void testApproveOnce() {
        BankLedgerEntry entry = cashService.importStatementEntry(line("A1", 1, Direction.CR, "10.00", null));

        BankLedgerEntry approved = cashService.approve(entry.getEntryId(), "manager-1");
        assertEquals(BankEntryStatus.APPROVED, approved.getStatus());
        assertEquals("manager-1", approved.getApprovedBy());
        assertNotNull(approved.getApprovedAt());

        AlreadyApprovedException e = assertThrows(AlreadyApprovedException.class,
                () -> cashService.approve(entry.getEntryId(), "manager-2"));
        assertEquals("manager-1", e.getApprovedBy());

        BankLedgerEntry reloaded = cashService.findEntry(entry.getEntryId()).orElseThrow();
        assertEquals("manager-1", reloaded.getApprovedBy());
        assertEquals(approved.getApprovedAt(), reloaded.getApprovedAt());
    }

    @Test
    @DisplayName("Flagged entries cannot be approved and unknown entries are not found")
    void testApproveRejections() {
        BalanceMismatchException e = assertThrows(BalanceMismatchException.class,
                () -> cashService.importStatementEntry(line("X1", 1, Direction.CR, "10.00", "1.00")));

        assertThrows(IllegalStateException.class, () -> cashService.approve(e.getFlaggedEntryId(), "manager"));
        assertThrows(ResourceNotFoundException.class, () -> cashService.approve(UUID.randomUUID(), "manager"));
        assertThrows(IllegalArgumentException.class, () -> cashService.approve(e.getFlaggedEntryId(), " "));
    }

    @Test
    @DisplayName("Unreconciled queue holds IMPORTED entries in statement order across pages")
    void testUnreconciledOrder() {
        BankLedgerEntry first = cashService.importStatementEntry(line("U1", 1, Direction.CR, "1.00", null));
        BankLedgerEntry second = cashService.importStatementEntry(line("U2", 2, Direction.CR, "2.00", null));
        BankLedgerEntry third = cashService.importStatementEntry(line("U3", 3, Direction.DR, "1.50", null));
        BankLedgerEntry fourth = cashService.importStatementEntry(line("U4", 4, Direction.CR, "4.00", null));
        cashService.approve(second.getEntryId(), "manager");

        List<UUID> queue = cashService.unreconciled(accountId).stream()
                .map(BankLedgerEntry::getEntryId)
                .collect(Collectors.toList());

        assertEquals(List.of(first.getEntryId(), third.getEntryId(), fourth.getEntryId()), queue);
        assertTrue(cashService.unreconciled(null).stream()
                .anyMatch(entry -> entry.getEntryId().equals(fourth.getEntryId())));
    }

    @Test
    @DisplayName("Back-dated lines and lines before the account opened are rejected")
    void testBackDatedRejected() {
        cashService.importStatementEntry(line("B1", 5, Direction.CR, "100.00", null));

        assertThrows(IllegalArgumentException.class,
                () -> cashService.importStatementEntry(line("B2", 4, Direction.CR, "100.00", null)));
        assertThrows(IllegalArgumentException.class,
                () -> cashService.importStatementEntry(line("B3", -1, Direction.CR, "100.00", null)));

        BankLedgerEntry sameDay = cashService.importStatementEntry(line("B4", 5, Direction.DR, "50.00", null));
        assertEquals(0, new BigDecimal("100050.00").compareTo(sameDay.getRunningBalance()));
    }

    @Test
    @DisplayName("Balance as of a past instant folds only earlier lines")
    void testBalanceAsOf() {
        cashService.importStatementEntry(line("H1", 1, Direction.CR, "300.00", null));
        cashService.importStatementEntry(line("H2", 3, Direction.DR, "100.00", null));

        assertEquals(0, new BigDecimal("100000.00").compareTo(cashService.balanceAsOf(accountId, opened)));
        assertEquals(0, new BigDecimal("100300.00")
                .compareTo(cashService.balanceAsOf(accountId, opened.plus(2, ChronoUnit.DAYS))));
        assertEquals(0, new BigDecimal("100200.00").compareTo(cashService.balance(accountId)));
    }

    @Test
    @DisplayName("Opening an existing account or importing to an unknown one fails")
    void testAccountErrors() {
        assertThrows(IllegalStateException.class,
                () -> cashService.openAccount(accountId, "Again", BigDecimal.ZERO, opened));
        assertThrows(ResourceNotFoundException.class, () -> cashService.importStatementEntry(
                StatementLine.of("NOPE-" + suffix, "N1-" + suffix, Instant.now(), Direction.CR,
                        BigDecimal.ONE, "x", null, null)));
        assertThrows(ResourceNotFoundException.class, () -> cashService.balance("NOPE-" + suffix));
    }

    @Test
    @DisplayName("A linked reference is kept on the imported entry")
    void testLinkedReference() {
        StatementLine linked = StatementLine.of(accountId, "L1-" + suffix, opened.plus(1, ChronoUnit.DAYS),
                Direction.DR, new BigDecimal("1200.00"), "NEFT to Medico Distributors", null,
                Reference.of(ReferenceType.SUPPLIER_INVOICE, "INV-" + suffix));

        BankLedgerEntry entry = cashService.importStatementEntry(linked);

        assertEquals("SUPPLIER_INVOICE", entry.getLinkedReferenceType());
        assertEquals("INV-" + suffix, entry.getLinkedReferenceId());
    }

    @Test
    @DisplayName("Amounts and balances finer than one paisa are rejected")
    void testSubPaisaAmountsRejected() {
        assertThrows(IllegalArgumentException.class, () -> line("P1", 1, Direction.CR, "0.005", null));
        assertThrows(IllegalArgumentException.class, () -> line("P2", 1, Direction.CR, "1.00", "100001.001"));
        assertThrows(IllegalArgumentException.class, () -> cashService.openAccount("SBI-" + suffix, "SBI Current",
                new BigDecimal("100.001"), opened));

        BankLedgerEntry entry = cashService.importStatementEntry(line("P3", 1, Direction.CR, "0.5000", null));
        assertEquals(0, new BigDecimal("100000.50").compareTo(entry.getRunningBalance()));
        assertEquals(0, entry.getRunningBalance().compareTo(cashService.balance(accountId)));
        assertEquals(1, ledgerStore.read(LedgerDomain.CASH, accountId).stream().count());
    }

    @Test
    @DisplayName("Concurrent resolutions of one flagged line apply exactly one correction")
    void testConcurrentResolveFlagged() throws InterruptedException {
        BalanceMismatchException e = assertThrows(BalanceMismatchException.class,
                () -> cashService.importStatementEntry(line("C1", 1, Direction.CR, "100.00", "1.00")));
        UUID flaggedId = e.getFlaggedEntryId();

        int threads = 8;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        CountDownLatch done = new CountDownLatch(threads);
        AtomicInteger accepted = new AtomicInteger();
        AtomicInteger refused = new AtomicInteger();
        List<Throwable> unexpected = Collections.synchronizedList(new ArrayList<>());

        for (int i = 0; i < threads; i++) {
            StatementLine corrected = line("C1-FIX" + i, 1, Direction.CR, "100.00", null);
            pool.submit(() -> {
                try {
                    start.await();
                    cashService.resolveFlagged(flaggedId, corrected, "accountant");
                    accepted.incrementAndGet();
                } catch (IllegalStateException ex) {
                    refused.incrementAndGet();
                } catch (InterruptedException ex) {
                    Thread.currentThread().interrupt();
                } catch (RuntimeException ex) {
                    unexpected.add(ex);
                } finally {
                    done.countDown();
                }
            });
        }
        start.countDown();
        assertTrue(done.await(60, TimeUnit.SECONDS));
        pool.shutdown();

        assertTrue(unexpected.isEmpty(), "unexpected failures: " + unexpected);
        assertEquals(1, accepted.get());
        assertEquals(threads - 1, refused.get());
        assertEquals(0, new BigDecimal("100100.00").compareTo(cashService.balance(accountId)));
        assertEquals(1, ledgerStore.read(LedgerDomain.CASH, accountId).stream().count());
    }
}
