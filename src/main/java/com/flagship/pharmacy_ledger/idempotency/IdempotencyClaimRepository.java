package com.flagship.pharmacy_ledger.idempotency;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface IdempotencyClaimRepository extends JpaRepository<IdempotencyClaimEntity, IdempotencyClaimId> {
}
