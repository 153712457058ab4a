package com.flagship.pharmacy_ledger.concurrency;

import com.flagship.pharmacy_ledger.cash.BankLedgerEntry;
import com.flagship.pharmacy_ledger.cash.CashReconciliationService;
import com.flagship.pharmacy_ledger.cash.Direction;
import com.flagship.pharmacy_ledger.cash.StatementLine;
import com.flagship.pharmacy_ledger.exception.AlreadyAppliedException;
import com.flagship.pharmacy_ledger.exception.InsufficientStockException;
import com.flagship.pharmacy_ledger.ledger.LedgerDomain;
import com.flagship.pharmacy_ledger.ledger.LedgerStore;
import com.flagship.pharmacy_ledger.ledger.Reference;
import com.flagship.pharmacy_ledger.ledger.ReferenceType;
import com.flagship.pharmacy_ledger.outbox.OutboxService;
import com.flagship.pharmacy_ledger.stock.BatchKey;
import com.flagship.pharmacy_ledger.stock.BatchMetadata;
import com.flagship.pharmacy_ledger.stock.StockReconciliationService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
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

import static org.junit.jupiter.api.Assertions.*;

/**
 * Try to break the ledgers under real row locks: oversells, racing duplicates,
 * interleaved statement lines and direct mutation of recorded rows.
 */
@SpringBootTest
@Testcontainers(disabledWithoutDocker = true)
class PostgresConcurrencyTest {

    @Container
    static PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:16")
            .withDatabaseName("pharmacy_ledger_test")
            .withUsername("test")
            .withPassword("test");

    @DynamicPropertySource
    static void configureProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url", postgres::getJdbcUrl);
        registry.add("spring.datasource.username", postgres::getUsername);
        registry.add("spring.datasource.password", postgres::getPassword);
        registry.add("spring.datasource.driver-class-name", () -> "org.postgresql.Driver");
        registry.add("ledger.read.page-size", () -> "500");
    }

    @Autowired
    private StockReconciliationService stockService;

    @Autowired
    private CashReconciliationService cashService;

    @Autowired
    private LedgerStore ledgerStore;

    @Autowired
    private OutboxService outboxService;

    @Autowired
    private JdbcTemplate jdbcTemplate;

    private String suffix;
    private BatchKey batch;

    @BeforeEach
    void setUp() {
        suffix = UUID.randomUUID().toString().substring(0, 8);
        batch = BatchKey.of("Paracetamol 500-" + suffix, "PCM-1");
        stockService.receive(batch, 10, new BigDecimal("1.00"),
                Reference.of(ReferenceType.SUPPLIER_INVOICE, "INV-" + suffix),
                new BatchMetadata("Cipla", LocalDate.now().plusYears(1), "Rack A", 2, null));
    }

    private static void runConcurrently(int threads, Runnable task) throws InterruptedException {
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        CountDownLatch done = new CountDownLatch(threads);
        for (int i = 0; i < threads; i++) {
            pool.submit(() -> {
                try {
                    start.await();
                    task.run();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                } finally {
                    done.countDown();
                }
            });
        }
        start.countDown();
        assertTrue(done.await(60, TimeUnit.SECONDS), "workers did not finish in time");
        pool.shutdown();
    }

    @Test
    @DisplayName("Concurrent sales never take a batch below zero")
    void testConcurrentOversell() throws InterruptedException {
        AtomicInteger sold = new AtomicInteger();
        AtomicInteger rejected = new AtomicInteger();
        List<Throwable> unexpected = Collections.synchronizedList(new ArrayList<>());

        runConcurrently(20, () -> {
            try {
                stockService.sell(batch, 1, new BigDecimal("2.00"),
                        Reference.of(ReferenceType.POS, "POS-" + UUID.randomUUID()));
                sold.incrementAndGet();
            } catch (InsufficientStockException e) {
                rejected.incrementAndGet();
            } catch (RuntimeException e) {
                unexpected.add(e);
            }
        });

        assertTrue(unexpected.isEmpty(), "unexpected failures: " + unexpected);
        assertEquals(10, sold.get());
        assertEquals(10, rejected.get());
        assertEquals(0, stockService.position(batch).orElseThrow().getCurrentQuantity());
        assertEquals(11, ledgerStore.read(LedgerDomain.STOCK, batch.entityKey()).stream().count());
    }

    @Test
    @DisplayName("The same receipt submitted concurrently is applied exactly once")
    void testRacingDuplicates() throws InterruptedException {
        AtomicInteger applied = new AtomicInteger();
        AtomicInteger duplicates = new AtomicInteger();
        Reference receipt = Reference.of(ReferenceType.POS, "POS-RACE-" + suffix);

        runConcurrently(8, () -> {
            try {
                stockService.sell(batch, 3, new BigDecimal("2.00"), receipt);
                applied.incrementAndGet();
            } catch (AlreadyAppliedException e) {
                duplicates.incrementAndGet();
            }
        });

        assertEquals(1, applied.get());
        assertEquals(7, duplicates.get());
        assertEquals(7, stockService.position(batch).orElseThrow().getCurrentQuantity());
    }

    @Test
    @DisplayName("Interleaved statement lines of one account get continuous running balances")
    void testConcurrentStatementImports() throws InterruptedException {
        String accountId = "HDFC-" + suffix;
        Instant opened = Instant.now().minus(1, ChronoUnit.DAYS).truncatedTo(ChronoUnit.SECONDS);
        cashService.openAccount(accountId, "HDFC Current", new BigDecimal("1000.00"), opened);
        Instant occurredAt = opened.plus(1, ChronoUnit.HOURS);
        AtomicInteger counter = new AtomicInteger();
        List<BigDecimal> balances = Collections.synchronizedList(new ArrayList<>());

        runConcurrently(10, () -> {
            BankLedgerEntry entry = cashService.importStatementEntry(StatementLine.of(accountId,
                    "T" + counter.incrementAndGet() + "-" + suffix, occurredAt, Direction.CR,
                    new BigDecimal("100.00"), "UPI settlement", null, null));
            balances.add(entry.getRunningBalance());
        });

        assertEquals(10, balances.size());
        List<BigDecimal> sorted = new ArrayList<>(balances);
        Collections.sort(sorted);
        for (int i = 0; i < sorted.size(); i++) {
            assertEquals(0, new BigDecimal("1000.00").add(new BigDecimal("100.00").multiply(BigDecimal.valueOf(i + 1)))
                    .compareTo(sorted.get(i)));
        }
        assertEquals(0, new BigDecimal("2000.00").compareTo(cashService.balance(accountId)));
    }

    @Test
    @DisplayName("Recorded movements and approved entries cannot be changed in place")
    void testAppendOnlyTriggers() {
        assertThrows(DataAccessException.class, () -> jdbcTemplate.update(
                "UPDATE stock_movements SET signed_amount = 1000 WHERE entity_key = ?", batch.entityKey()));
        assertThrows(DataAccessException.class, () -> jdbcTemplate.update(
                "DELETE FROM stock_movements WHERE entity_key = ?", batch.entityKey()));

        String accountId = "AXIS-" + suffix;
        Instant opened = Instant.now().minus(1, ChronoUnit.DAYS).truncatedTo(ChronoUnit.SECONDS);
        cashService.openAccount(accountId, "Axis Current", BigDecimal.ZERO, opened);
        BankLedgerEntry entry = cashService.importStatementEntry(StatementLine.of(accountId, "AX1-" + suffix,
                opened.plusSeconds(60), Direction.CR, BigDecimal.TEN, "Cash deposit", null, null));
        cashService.approve(entry.getEntryId(), "manager");

        assertThrows(DataAccessException.class, () -> jdbcTemplate.update(
                "UPDATE bank_statement_entries SET description = 'edited' WHERE entry_id = ?", entry.getEntryId()));
        assertEquals(10, stockService.position(batch).orElseThrow().getCurrentQuantity());
    }

    @Test
    @DisplayName("The publisher query claims unpublished events with SKIP LOCKED")
    void testOutboxClaim() {
        assertFalse(outboxService.findUnpublishedEvents(50).isEmpty());
        assertTrue(outboxService.countUnpublished() > 0);
    }
}
