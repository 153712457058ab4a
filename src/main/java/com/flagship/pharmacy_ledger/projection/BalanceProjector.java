package com.flagship.pharmacy_ledger.projection;

import com.flagship.pharmacy_ledger.ledger.LedgerDomain;
import com.flagship.pharmacy_ledger.ledger.LedgerEntry;
import com.flagship.pharmacy_ledger.ledger.LedgerStore;
import com.flagship.pharmacy_ledger.observability.LedgerMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Derives quantities and balances by folding ledger entries.
 *
 * The current value of an entity is:
 *
 *   opening balance (bank accounts only, via {@link OpeningBalanceResolver})
 *   + cached fold up to {@code last_sequence_number}
 *   + fold of entries appended after that sequence number
 *
 * The cached fold in {@code ledger_projections} is advanced on every append, inside the
 * appending transaction and under the entity lock. Reads add a catch-up fold of anything
 * newer than the cache, so a stale cache never yields a stale answer.
 *
 * Point-in-time reads ({@link #asOf}) ignore the cache and fold every entry that occurred
 * up to the given instant. {@link #verify} compares the cache with a full fold and
 * {@link #repair} rewrites the cache from the ledger; both are driven by the scheduled
 * {@link ProjectionAuditor}. The ledger always wins.
 */
@Slf4j
@Component
public class BalanceProjector {

    private final LedgerStore ledgerStore;
    private final ProjectionCacheRepository cacheRepository;
    private final EntityLockManager lockManager;
    private final Map<LedgerDomain, OpeningBalanceResolver> openingBalances = new EnumMap<>(LedgerDomain.class);
    private final LedgerMetrics metrics;
    private final Clock clock;

    public BalanceProjector(LedgerStore ledgerStore,
                            ProjectionCacheRepository cacheRepository,
                            EntityLockManager lockManager,
                            List<OpeningBalanceResolver> resolvers,
                            LedgerMetrics metrics,
                            Clock clock) {
        this.ledgerStore = ledgerStore;
        this.cacheRepository = cacheRepository;
        this.lockManager = lockManager;
        for (OpeningBalanceResolver resolver : resolvers) {
            openingBalances.put(resolver.domain(), resolver);
        }
        this.metrics = metrics;
        this.clock = clock;
    }

    /**
     * Current quantity or balance of an entity, opening balance included.
     */
    public BigDecimal current(LedgerDomain domain, String entityKey) {
        Projection cached = cacheRepository.find(domain, entityKey)
                .orElse(Projection.empty(domain, entityKey));
        return current(cached);
    }

    /**
     * Current value starting from an already read (typically locked) cache row.
     */
    public BigDecimal current(Projection cached) {
        BigDecimal catchUp = fold(ledgerStore.readAfter(
                cached.getDomain(), cached.getEntityKey(), cached.getLastSequenceNumber()));
        return opening(cached.getDomain(), cached.getEntityKey())
                .add(cached.getBalance())
                .add(catchUp);
    }

    /**
     * Value as of a point in time: entries that occurred at or before {@code asOf}.
     */
    public BigDecimal asOf(LedgerDomain domain, String entityKey, Instant asOf) {
        return opening(domain, entityKey).add(fold(ledgerStore.read(domain, entityKey, asOf)));
    }

    /**
     * Full fold from the ledger, ignoring the cache.
     */
    public BigDecimal recompute(LedgerDomain domain, String entityKey) {
        return opening(domain, entityKey).add(fold(ledgerStore.read(domain, entityKey)));
    }

    /**
     * Advances the cache past freshly appended entries. Caller must hold the entity lock.
     *
     * @return the new current value, opening balance included
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public BigDecimal foldForward(Projection locked, List<LedgerEntry> appended) {
        BigDecimal balance = locked.getBalance();
        long lastSequence = locked.getLastSequenceNumber();
        int folded = 0;
        for (LedgerEntry entry : ledgerStore.readAfter(locked.getDomain(), locked.getEntityKey(), lastSequence)) {
            balance = balance.add(entry.getSignedAmount());
            lastSequence = Math.max(lastSequence, entry.getSequenceNumber());
            folded++;
        }
        if (folded != appended.size()) {
            log.warn("Projection for {} {} caught up {} entries while folding {} appended",
                    locked.getDomain(), locked.getEntityKey(), folded, appended.size());
        }
        cacheRepository.update(locked.getDomain(), locked.getEntityKey(), balance, lastSequence, clock.instant());
        return opening(locked.getDomain(), locked.getEntityKey()).add(balance);
    }

    /**
     * Compares the cached fold with a fold of the ledger up to the cached sequence number.
     */
    public ProjectionCheck verify(LedgerDomain domain, String entityKey) {
        Projection cached = cacheRepository.find(domain, entityKey)
                .orElse(Projection.empty(domain, entityKey));
        BigDecimal folded = BigDecimal.ZERO;
        for (LedgerEntry entry : ledgerStore.read(domain, entityKey)) {
            if (entry.getSequenceNumber() <= cached.getLastSequenceNumber()) {
                folded = folded.add(entry.getSignedAmount());
            }
        }
        ProjectionCheck check = new ProjectionCheck(domain, entityKey, cached.getBalance(), folded,
                cached.getLastSequenceNumber());
        if (check.isDrifted()) {
            metrics.incrementProjectionDrift();
            log.error("Projection drift for {} {}: cached={}, ledger={} at sequence {}",
                    domain, entityKey, cached.getBalance().toPlainString(), folded.toPlainString(),
                    cached.getLastSequenceNumber());
        }
        return check;
    }

    /**
     * Rebuilds the cache row of an entity from the ledger, under its lock.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public BigDecimal repair(LedgerDomain domain, String entityKey) {
        lockManager.lock(domain, entityKey);
        BigDecimal balance = BigDecimal.ZERO;
        long lastSequence = 0L;
        for (LedgerEntry entry : ledgerStore.read(domain, entityKey)) {
            balance = balance.add(entry.getSignedAmount());
            lastSequence = Math.max(lastSequence, entry.getSequenceNumber());
        }
        cacheRepository.update(domain, entityKey, balance, lastSequence, clock.instant());
        log.info("Projection for {} {} rebuilt: balance={}, sequence={}",
                domain, entityKey, balance.toPlainString(), lastSequence);
        return opening(domain, entityKey).add(balance);
    }

    private BigDecimal opening(LedgerDomain domain, String entityKey) {
        OpeningBalanceResolver resolver = openingBalances.get(domain);
        return resolver != null ? resolver.openingBalance(entityKey) : BigDecimal.ZERO;
    }

    private static BigDecimal fold(Iterable<LedgerEntry> entries) {
        BigDecimal total = BigDecimal.ZERO;
        for (LedgerEntry entry : entries) {
            total = total.add(entry.getSignedAmount());
        }
        return total;
    }
}
