package com.flagship.pharmacy_ledger.idempotency;

import com.flagship.pharmacy_ledger.config.LedgerProperties;
import com.flagship.pharmacy_ledger.ledger.LedgerDomain;
import com.flagship.pharmacy_ledger.ledger.ReferenceType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import java.time.Clock;
import java.time.Duration;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.Optional;

/**
 * Ensures an external event is applied at most once.
 *
 * An event is identified by its reference: a POS receipt number, a supplier invoice number
 * or a bank statement transaction id, each scoped by its {@link ReferenceType}. Claims are
 * permanent; a receipt replayed a year later is still a duplicate.
 *
 * Strategy:
 * 1. Redis is a fast path for references known to be applied (can be unavailable)
 * 2. The database claim table is the source of truth, written with insert-if-absent
 * 3. A claim is written in the caller's transaction, so it becomes permanent exactly when
 *    the event's effects commit and disappears if they roll back
 * 4. Redis learns about a claim only after that commit
 *
 * Two producers racing with the same reference both reach the insert. The database lets one
 * through; the other waits for it and then sees the row, so it reports a duplicate without
 * ever touching the ledger. Redis keys ({@code ledger:claim:<TYPE>:<id>}) expire after
 * {@code ledger.idempotency.redis-ttl}; an expired key only costs a database lookup.
 */
@Slf4j
@Service
public class IdempotencyGuard {

    private static final String REDIS_KEY_PREFIX = "ledger:claim:";

    private final JdbcTemplate jdbcTemplate;
    private final IdempotencyClaimRepository claimRepository;
    private final Optional<StringRedisTemplate> redisTemplate;
    private final boolean redisEnabled;
    private final Duration redisTtl;
    private final Clock clock;

    public IdempotencyGuard(JdbcTemplate jdbcTemplate,
                            IdempotencyClaimRepository claimRepository,
                            Optional<StringRedisTemplate> redisTemplate,
                            LedgerProperties properties,
                            Clock clock) {
        this.jdbcTemplate = jdbcTemplate;
        this.claimRepository = claimRepository;
        this.redisTemplate = redisTemplate;
        this.redisEnabled = properties.getIdempotency().isRedisEnabled();
        this.redisTtl = properties.getIdempotency().getRedisTtl();
        this.clock = clock;
    }

    /**
     * Claims a reference for the calling transaction.
     *
     * @return true if this call claimed it, false if it was already claimed
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public boolean claim(ReferenceType type, String referenceId, LedgerDomain domain) {
        validate(type, referenceId);

        if (cachedAsClaimed(type, referenceId)) {
            log.debug("Reference {}/{} already claimed (Redis)", type, referenceId);
            return false;
        }

        int inserted = jdbcTemplate.update(
                "INSERT INTO idempotency_claims (reference_type, reference_id, domain, claimed_at) " +
                "VALUES (?, ?, ?, ?) ON CONFLICT DO NOTHING",
                type.name(),
                referenceId,
                domain.name(),
                OffsetDateTime.ofInstant(clock.instant(), ZoneOffset.UTC));

        if (inserted == 0) {
            log.debug("Reference {}/{} already claimed (database)", type, referenceId);
            cacheAsClaimed(type, referenceId);
            return false;
        }

        TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
            @Override
            public void afterCommit() {
                cacheAsClaimed(type, referenceId);
            }
        });
        return true;
    }

    public boolean isClaimed(ReferenceType type, String referenceId) {
        validate(type, referenceId);

        if (cachedAsClaimed(type, referenceId)) {
            return true;
        }
        boolean claimed = claimRepository.existsById(new IdempotencyClaimId(type.name(), referenceId));
        if (claimed) {
            cacheAsClaimed(type, referenceId);
        }
        return claimed;
    }

    private boolean cachedAsClaimed(ReferenceType type, String referenceId) {
        if (!redisEnabled || redisTemplate.isEmpty()) {
            return false;
        }
        try {
            return Boolean.TRUE.equals(redisTemplate.get().hasKey(redisKey(type, referenceId)));
        } catch (Exception e) {
            log.warn("Redis lookup failed for reference {}/{}. Falling back to database. Error: {}",
                    type, referenceId, e.getMessage());
            return false;
        }
    }

    private void cacheAsClaimed(ReferenceType type, String referenceId) {
        if (!redisEnabled || redisTemplate.isEmpty()) {
            return;
        }
        try {
            redisTemplate.get().opsForValue().set(redisKey(type, referenceId), "1", redisTtl);
        } catch (Exception e) {
            // database remains the source of truth
            log.debug("Failed to cache claim {}/{} in Redis: {}", type, referenceId, e.getMessage());
        }
    }

    private static String redisKey(ReferenceType type, String referenceId) {
        return REDIS_KEY_PREFIX + type.name() + ":" + referenceId;
    }

    private static void validate(ReferenceType type, String referenceId) {
        if (type == null) {
            throw new IllegalArgumentException("Reference type cannot be null");
        }
        if (referenceId == null || referenceId.isBlank()) {
            throw new IllegalArgumentException("Reference id cannot be null or blank");
        }
    }
}
