package com.flagship.pharmacy_ledger.observability;

import com.flagship.pharmacy_ledger.cash.BankEntryStatus;
import com.flagship.pharmacy_ledger.cash.BankStatementEntryRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Refreshes the gauges that need a database query: the outbox backlog and the bank statement
 * review queue. Prometheus scrapes read the cached values and never reach the database.
 *
 * The review queue counts IMPORTED entries waiting for approval and FLAGGED entries waiting
 * for a correction. A flagged entry keeps its status after it is resolved, so the flagged
 * gauge counts resolved entries too.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class MetricsScheduler {

    private final OutboxMetrics outboxMetrics;
    private final LedgerMetrics ledgerMetrics;
    private final BankStatementEntryRepository entryRepository;

    @Scheduled(fixedRateString = "${metrics.refresh.interval:15000}")
    public void refreshOutboxMetrics() {
        outboxMetrics.refreshMetrics();
    }

    @Scheduled(fixedRateString = "${metrics.refresh.interval:15000}")
    public void refreshReviewQueue() {
        try {
            long imported = entryRepository.countByStatus(BankEntryStatus.IMPORTED);
            long flagged = entryRepository.countByStatus(BankEntryStatus.FLAGGED);
            ledgerMetrics.updateReviewQueue(imported, flagged);
            log.debug("Review queue refreshed: imported={}, flagged={}", imported, flagged);
        } catch (Exception e) {
            log.warn("Failed to refresh review queue metrics: {}", e.getMessage());
        }
    }
}
