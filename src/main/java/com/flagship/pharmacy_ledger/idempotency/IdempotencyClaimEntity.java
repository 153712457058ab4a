package com.flagship.pharmacy_ledger.idempotency;

import jakarta.persistence.Column;
import jakarta.persistence.EmbeddedId;
import jakarta.persistence.Entity;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * A permanent claim on an external reference. Inserted through
 * {@link IdempotencyGuard#claim}; this mapping is read-only.
 */
@Entity
@Table(name = "idempotency_claims")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class IdempotencyClaimEntity {

    @EmbeddedId
    private IdempotencyClaimId id;

    @Column(name = "domain", nullable = false, updatable = false, length = 10)
    private String domain;

    @Column(name = "claimed_at", nullable = false, updatable = false)
    private Instant claimedAt;
}
