package com.flagship.pharmacy_ledger.projection;

import com.flagship.pharmacy_ledger.ledger.LedgerDomain;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.TreeSet;

/**
 * Per-entity pessimistic locks, held until the surrounding transaction ends.
 *
 * Keys are always locked in sorted order so two multi-key operations cannot deadlock.
 * Entities with different keys never wait on each other.
 */
@Slf4j
@Component
public class EntityLockManager {

    private final ProjectionCacheRepository cacheRepository;
    private final Clock clock;

    public EntityLockManager(ProjectionCacheRepository cacheRepository, Clock clock) {
        this.cacheRepository = cacheRepository;
        this.clock = clock;
    }

    @Transactional(propagation = Propagation.MANDATORY)
    public Projection lock(LedgerDomain domain, String entityKey) {
        cacheRepository.ensureRow(domain, entityKey, clock.instant());
        return cacheRepository.lock(domain, entityKey)
                .orElseThrow(() -> new IllegalStateException("Projection row vanished for " + entityKey));
    }

    /**
     * Locks all keys in ascending order.
     *
     * @return the locked cache rows, in lock order
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public Map<String, Projection> lockAll(LedgerDomain domain, Collection<String> entityKeys) {
        Map<String, Projection> locked = new LinkedHashMap<>();
        for (String key : new TreeSet<>(entityKeys)) {
            locked.put(key, lock(domain, key));
        }
        log.debug("Locked {} {} entities", locked.size(), domain);
        return locked;
    }
}
