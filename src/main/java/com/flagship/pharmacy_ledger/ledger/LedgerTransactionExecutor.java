package com.flagship.pharmacy_ledger.ledger;

import com.flagship.pharmacy_ledger.config.LedgerProperties;
import com.flagship.pharmacy_ledger.exception.ConcurrencyTimeoutException;
import com.flagship.pharmacy_ledger.observability.LedgerMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.PessimisticLockingFailureException;
import org.springframework.dao.QueryTimeoutException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionTimedOutException;
import org.springframework.transaction.support.TransactionSynchronizationManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.function.Supplier;

/**
 * Runs a unit of ledger work in its own bounded transaction.
 *
 * The transaction timeout bounds every lock wait. Lock failures roll the attempt back and
 * are retried with exponential backoff; once attempts run out the caller gets a
 * {@link ConcurrencyTimeoutException}. Business exceptions are never retried.
 *
 * Called inside an existing transaction, the work simply joins it and retrying is left to
 * the outermost caller.
 */
@Slf4j
@Component
public class LedgerTransactionExecutor {

    private final TransactionTemplate transactionTemplate;
    private final ExponentialBackoff backoff;
    private final int maxAttempts;
    private final LedgerMetrics metrics;

    public LedgerTransactionExecutor(PlatformTransactionManager transactionManager,
                                     LedgerProperties properties,
                                     LedgerMetrics metrics) {
        LedgerProperties.Concurrency concurrency = properties.getConcurrency();
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.transactionTemplate.setTimeout(concurrency.getLockTimeoutSeconds());
        this.backoff = new ExponentialBackoff(
                concurrency.getInitialBackoffMillis(),
                concurrency.getMaxBackoffMillis(),
                concurrency.getBackoffFactor());
        this.maxAttempts = Math.max(1, concurrency.getMaxAttempts());
        this.metrics = metrics;
    }

    public <T> T execute(String operation, Supplier<T> work) {
        if (TransactionSynchronizationManager.isActualTransactionActive()) {
            return work.get();
        }

        for (int attempt = 1; ; attempt++) {
            try {
                return transactionTemplate.execute(status -> work.get());
            } catch (PessimisticLockingFailureException | QueryTimeoutException | TransactionTimedOutException e) {
                if (attempt >= maxAttempts) {
                    metrics.incrementLockTimeouts();
                    log.warn("Giving up on {} after {} attempt(s): {}", operation, attempt, e.getMessage());
                    throw new ConcurrencyTimeoutException(operation, attempt, e);
                }
                metrics.incrementLockRetries();
                long delay = backoff.calculateBackoffMillis(attempt);
                log.info("Lock contention on {} (attempt {}/{}), retrying in {}ms",
                        operation, attempt, maxAttempts, delay);
                sleep(operation, attempt, delay, e);
            }
        }
    }

    public void run(String operation, Runnable work) {
        execute(operation, () -> {
            work.run();
            return null;
        });
    }

    private void sleep(String operation, int attempt, long delay, RuntimeException cause) {
        try {
            Thread.sleep(delay);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw new ConcurrencyTimeoutException(operation, attempt, cause);
        }
    }
}
