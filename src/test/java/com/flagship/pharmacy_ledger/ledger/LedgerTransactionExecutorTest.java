package com.flagship.pharmacy_ledger.ledger;

import com.flagship.pharmacy_ledger.config.LedgerProperties;
import com.flagship.pharmacy_ledger.exception.ConcurrencyTimeoutException;
import com.flagship.pharmacy_ledger.exception.InsufficientStockException;
import com.flagship.pharmacy_ledger.observability.LedgerMetrics;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.CannotAcquireLockException;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.SimpleTransactionStatus;

import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 * Retry behaviour of the executor against a stub transaction manager.
 */
@ExtendWith(MockitoExtension.class)
class LedgerTransactionExecutorTest {

    @Mock
    private PlatformTransactionManager transactionManager;

    @Mock
    private LedgerMetrics metrics;

    private LedgerTransactionExecutor executor;

    @BeforeEach
    void setUp() {
        when(transactionManager.getTransaction(any(TransactionDefinition.class)))
                .thenAnswer(invocation -> new SimpleTransactionStatus());

        LedgerProperties properties = new LedgerProperties();
        properties.getConcurrency().setMaxAttempts(3);
        properties.getConcurrency().setInitialBackoffMillis(1);
        properties.getConcurrency().setMaxBackoffMillis(2);
        executor = new LedgerTransactionExecutor(transactionManager, properties, metrics);
    }

    @Test
    @DisplayName("Lock failures are retried until the work succeeds")
    void testExecute_RetriesLockFailures() {
        AtomicInteger calls = new AtomicInteger();

        String result = executor.execute("test.retry", () -> {
            if (calls.incrementAndGet() < 3) {
                throw new CannotAcquireLockException("row locked");
            }
            return "done";
        });

        assertEquals("done", result);
        assertEquals(3, calls.get());
        verify(metrics, times(2)).incrementLockRetries();
        verify(metrics, never()).incrementLockTimeouts();
        verify(transactionManager, times(2)).rollback(any());
        verify(transactionManager, times(1)).commit(any());
    }

    @Test
    @DisplayName("Exhausted lock retries surface as ConcurrencyTimeoutException")
    void testExecute_GivesUpAfterMaxAttempts() {
        AtomicInteger calls = new AtomicInteger();

        ConcurrencyTimeoutException e = assertThrows(ConcurrencyTimeoutException.class,
                () -> executor.execute("test.timeout", () -> {
                    calls.incrementAndGet();
                    throw new CannotAcquireLockException("row locked");
                }));

        assertEquals(3, calls.get());
        assertInstanceOf(CannotAcquireLockException.class, e.getCause());
        verify(metrics).incrementLockTimeouts();
    }

    @Test
    @DisplayName("Business exceptions are never retried")
    void testExecute_DoesNotRetryBusinessErrors() {
        AtomicInteger calls = new AtomicInteger();

        assertThrows(InsufficientStockException.class, () -> executor.execute("test.business", () -> {
            calls.incrementAndGet();
            throw new InsufficientStockException("Paracetamol 500mg|B1", 10, 2);
        }));

        assertEquals(1, calls.get());
        verify(metrics, never()).incrementLockRetries();
    }
}
