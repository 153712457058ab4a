package com.flagship.pharmacy_ledger.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Supplier;

/**
 * Centralized metrics for ledger operations.
 *
 * Metrics exposed:
 * - ledger.movements.recorded: entries appended, tagged by domain and kind
 * - ledger.duplicates: events dropped as already applied
 * - ledger.rejections: hard rejects, tagged by reason
 * - ledger.lock.retries / ledger.lock.timeouts: contention on entity locks
 * - ledger.projection.drift: cache entries found out of line with the ledger
 * - ledger.cash.flagged / ledger.cash.approved: statement review workflow
 * - ledger.cash.review.queue: entries awaiting review, tagged by status (refreshed by {@link MetricsScheduler})
 * - ledger.intake.records: intake records consumed, tagged by document type and outcome
 * - ledger.operation.duration: latency per operation
 */
@Component
public class LedgerMetrics {

    private final MeterRegistry registry;

    private final Counter lockRetries;
    private final Counter lockTimeouts;
    private final Counter projectionDrift;
    private final Counter flaggedEntries;
    private final Counter approvedEntries;

    private final AtomicLong awaitingApproval = new AtomicLong(0);
    private final AtomicLong flaggedOpen = new AtomicLong(0);

    public LedgerMetrics(MeterRegistry registry) {
        this.registry = registry;

        this.lockRetries = Counter.builder("ledger.lock.retries")
                .description("Units of work retried after failing to acquire an entity lock")
                .register(registry);

        this.lockTimeouts = Counter.builder("ledger.lock.timeouts")
                .description("Units of work abandoned after exhausting lock retries")
                .register(registry);

        this.projectionDrift = Counter.builder("ledger.projection.drift")
                .description("Projection cache entries that disagreed with a full ledger fold")
                .register(registry);

        this.flaggedEntries = Counter.builder("ledger.cash.flagged")
                .description("Statement lines flagged for a declared balance mismatch")
                .register(registry);

        this.approvedEntries = Counter.builder("ledger.cash.approved")
                .description("Statement entries approved")
                .register(registry);

        Gauge.builder("ledger.cash.review.queue", awaitingApproval, AtomicLong::get)
                .description("Imported statement entries not yet approved")
                .tag("status", "imported")
                .register(registry);

        Gauge.builder("ledger.cash.review.queue", flaggedOpen, AtomicLong::get)
                .description("Flagged statement entries")
                .tag("status", "flagged")
                .register(registry);
    }

    public void recordMovement(String domain, String kind, int entries) {
        registry.counter("ledger.movements.recorded",
                "domain", domain,
                "kind", kind
        ).increment(entries);
    }

    /**
     * Records an event that was submitted again after being applied.
     */
    public void recordDuplicate(String referenceType) {
        registry.counter("ledger.duplicates", "reference_type", sanitizeTag(referenceType)).increment();
    }

    public void recordRejection(String reason) {
        registry.counter("ledger.rejections", "reason", sanitizeTag(reason)).increment();
    }

    public void recordIntake(String documentType, String outcome) {
        registry.counter("ledger.intake.records",
                "document_type", sanitizeTag(documentType),
                "outcome", sanitizeTag(outcome)
        ).increment();
    }

    public void incrementLockRetries() {
        lockRetries.increment();
    }

    public void incrementLockTimeouts() {
        lockTimeouts.increment();
    }

    public void incrementProjectionDrift() {
        projectionDrift.increment();
    }

    public void incrementFlaggedEntries() {
        flaggedEntries.increment();
    }

    public void incrementApprovedEntries() {
        approvedEntries.increment();
    }

    public void updateReviewQueue(long imported, long flagged) {
        awaitingApproval.set(imported);
        flaggedOpen.set(flagged);
    }

    /**
     * Times an operation under the given name.
     */
    public <T> T time(String operation, Supplier<T> work) {
        Timer timer = Timer.builder("ledger.operation.duration")
                .tag("operation", sanitizeTag(operation))
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(registry);
        return timer.record(work);
    }

    /**
     * Sanitizes a tag value to prevent cardinality explosion.
     */
    private String sanitizeTag(String value) {
        if (value == null) {
            return "unknown";
        }
        String sanitized = value.replaceAll("[^a-zA-Z0-9_]", "_");
        return sanitized.length() > 50 ? sanitized.substring(0, 50) : sanitized;
    }
}
