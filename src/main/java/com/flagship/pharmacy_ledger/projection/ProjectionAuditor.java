package com.flagship.pharmacy_ledger.projection;

import com.flagship.pharmacy_ledger.config.LedgerProperties;
import com.flagship.pharmacy_ledger.ledger.LedgerDomain;
import com.flagship.pharmacy_ledger.ledger.LedgerTransactionExecutor;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Periodically re-folds every cached projection and rebuilds the ones that drifted.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "ledger.projection.audit-enabled", havingValue = "true", matchIfMissing = true)
public class ProjectionAuditor {

    private final ProjectionCacheRepository cacheRepository;
    private final BalanceProjector projector;
    private final LedgerTransactionExecutor executor;
    private final LedgerProperties properties;

    @Scheduled(fixedDelayString = "${ledger.projection.audit-interval-ms:300000}",
            initialDelayString = "${ledger.projection.audit-initial-delay-ms:60000}")
    public void audit() {
        for (LedgerDomain domain : LedgerDomain.values()) {
            int checked = 0;
            int repaired = 0;
            for (Projection projection : cacheRepository.all(domain, properties.getRead().getPageSize())) {
                checked++;
                try {
                    if (auditOne(domain, projection.getEntityKey())) {
                        repaired++;
                    }
                } catch (RuntimeException e) {
                    log.error("Projection audit failed for {} {}: {}", domain, projection.getEntityKey(), e.getMessage(), e);
                }
            }
            log.info("Projection audit for {}: checked={}, repaired={}", domain, checked, repaired);
        }
    }

    /**
     * @return true if the entity had drifted and was rebuilt
     */
    public boolean auditOne(LedgerDomain domain, String entityKey) {
        ProjectionCheck check = projector.verify(domain, entityKey);
        if (!check.isDrifted()) {
            return false;
        }
        executor.execute("projection-repair", () -> projector.repair(domain, entityKey));
        return true;
    }
}
