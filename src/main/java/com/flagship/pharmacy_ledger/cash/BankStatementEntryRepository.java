package com.flagship.pharmacy_ledger.cash;

import jakarta.persistence.LockModeType;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface BankStatementEntryRepository extends JpaRepository<BankStatementEntryEntity, UUID> {

    boolean existsByTranId(String tranId);

    Optional<BankStatementEntryEntity> findByTranId(String tranId);

    /**
     * Loads an entry under a row lock so concurrent approvals serialize.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT e FROM BankStatementEntryEntity e WHERE e.entryId = :entryId")
    Optional<BankStatementEntryEntity> findForUpdate(@Param("entryId") UUID entryId);

    List<BankStatementEntryEntity> findByCorrectsEntryId(UUID correctsEntryId);

    long countByStatus(BankEntryStatus status);

    /**
     * First page of the review queue (all accounts).
     */
    @Query("""
        SELECT e FROM BankStatementEntryEntity e
        WHERE e.status = com.flagship.pharmacy_ledger.cash.BankEntryStatus.IMPORTED
        ORDER BY e.occurredAt ASC, e.importedAt ASC, e.entryId ASC
        """)
    List<BankStatementEntryEntity> findUnreconciled(Pageable page);

    @Query("""
        SELECT e FROM BankStatementEntryEntity e
        WHERE e.status = com.flagship.pharmacy_ledger.cash.BankEntryStatus.IMPORTED
          AND (e.occurredAt > :occurredAt
               OR (e.occurredAt = :occurredAt AND e.importedAt > :importedAt)
               OR (e.occurredAt = :occurredAt AND e.importedAt = :importedAt AND e.entryId > :entryId))
        ORDER BY e.occurredAt ASC, e.importedAt ASC, e.entryId ASC
        """)
    List<BankStatementEntryEntity> findUnreconciledAfter(@Param("occurredAt") Instant occurredAt,
                                                         @Param("importedAt") Instant importedAt,
                                                         @Param("entryId") UUID entryId,
                                                         Pageable page);

    @Query("""
        SELECT e FROM BankStatementEntryEntity e
        WHERE e.accountId = :accountId
          AND e.status = com.flagship.pharmacy_ledger.cash.BankEntryStatus.IMPORTED
        ORDER BY e.occurredAt ASC, e.importedAt ASC, e.entryId ASC
        """)
    List<BankStatementEntryEntity> findUnreconciledByAccount(@Param("accountId") String accountId, Pageable page);

    @Query("""
        SELECT e FROM BankStatementEntryEntity e
        WHERE e.accountId = :accountId
          AND e.status = com.flagship.pharmacy_ledger.cash.BankEntryStatus.IMPORTED
          AND (e.occurredAt > :occurredAt
               OR (e.occurredAt = :occurredAt AND e.importedAt > :importedAt)
               OR (e.occurredAt = :occurredAt AND e.importedAt = :importedAt AND e.entryId > :entryId))
        ORDER BY e.occurredAt ASC, e.importedAt ASC, e.entryId ASC
        """)
    List<BankStatementEntryEntity> findUnreconciledByAccountAfter(@Param("accountId") String accountId,
                                                                  @Param("occurredAt") Instant occurredAt,
                                                                  @Param("importedAt") Instant importedAt,
                                                                  @Param("entryId") UUID entryId,
                                                                  Pageable page);

    @Query("""
        SELECT e FROM BankStatementEntryEntity e
        WHERE e.accountId = :accountId
        ORDER BY e.occurredAt ASC, e.importedAt ASC, e.entryId ASC
        """)
    List<BankStatementEntryEntity> findByAccount(@Param("accountId") String accountId, Pageable page);

    @Query("""
        SELECT e FROM BankStatementEntryEntity e
        WHERE e.accountId = :accountId
          AND (e.occurredAt > :occurredAt
               OR (e.occurredAt = :occurredAt AND e.importedAt > :importedAt)
               OR (e.occurredAt = :occurredAt AND e.importedAt = :importedAt AND e.entryId > :entryId))
        ORDER BY e.occurredAt ASC, e.importedAt ASC, e.entryId ASC
        """)
    List<BankStatementEntryEntity> findByAccountAfter(@Param("accountId") String accountId,
                                                      @Param("occurredAt") Instant occurredAt,
                                                      @Param("importedAt") Instant importedAt,
                                                      @Param("entryId") UUID entryId,
                                                      Pageable page);

    /**
     * Entries of an account that occurred in {@code [from, to)}, in statement order.
     */
    @Query("""
        SELECT e FROM BankStatementEntryEntity e
        WHERE e.accountId = :accountId
          AND e.occurredAt >= :from AND e.occurredAt < :to
        ORDER BY e.occurredAt ASC, e.importedAt ASC, e.entryId ASC
        """)
    List<BankStatementEntryEntity> findInRange(@Param("accountId") String accountId,
                                               @Param("from") Instant from,
                                               @Param("to") Instant to);
}
