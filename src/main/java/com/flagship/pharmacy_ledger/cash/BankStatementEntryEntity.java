package com.flagship.pharmacy_ledger.cash;

import com.flagship.pharmacy_ledger.exception.AlreadyApprovedException;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.util.UUID;

/**
 * Persistence of a statement line and its review state.
 *
 * No setters: the only change after import is the single approval, which also freezes the
 * row (a PostgreSQL trigger rejects updates of approved rows).
 */
@Entity
@Table(name = "bank_statement_entries")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class BankStatementEntryEntity {

    @Id
    @Column(name = "entry_id", nullable = false, updatable = false)
    private UUID entryId;

    @Column(name = "tran_id", nullable = false, updatable = false, unique = true, length = 50)
    private String tranId;

    @Column(name = "account_id", nullable = false, updatable = false, length = 50)
    private String accountId;

    @Column(name = "ledger_sequence_number", updatable = false)
    private Long ledgerSequenceNumber;

    @Column(name = "occurred_at", nullable = false, updatable = false)
    private Instant occurredAt;

    @Enumerated(EnumType.STRING)
    @Column(name = "direction", nullable = false, updatable = false, length = 2)
    private Direction direction;

    @Column(name = "amount", nullable = false, updatable = false, precision = 15, scale = 2)
    private BigDecimal amount;

    @Column(name = "running_balance", updatable = false, precision = 15, scale = 2)
    private BigDecimal runningBalance;

    @Column(name = "declared_balance", updatable = false, precision = 15, scale = 2)
    private BigDecimal declaredBalance;

    @Column(name = "description", nullable = false, updatable = false, length = 250)
    private String description;

    @Column(name = "linked_reference_type", updatable = false, length = 30)
    private String linkedReferenceType;

    @Column(name = "linked_reference_id", updatable = false, length = 100)
    private String linkedReferenceId;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    private BankEntryStatus status;

    @Column(name = "flag_reason", updatable = false, length = 500)
    private String flagReason;

    @Column(name = "corrects_entry_id", updatable = false)
    private UUID correctsEntryId;

    @Column(name = "approved_by", length = 100)
    private String approvedBy;

    @Column(name = "approved_at")
    private Instant approvedAt;

    @Column(name = "imported_at", nullable = false, updatable = false)
    private Instant importedAt;

    @PrePersist
    void onCreate() {
        if (this.importedAt == null) {
            this.importedAt = Instant.now();
        }
    }

    static BankStatementEntryEntity imported(StatementLine line, long ledgerSequenceNumber,
                                             BigDecimal runningBalance, UUID correctsEntryId, Instant importedAt) {
        BankStatementEntryEntity entity = fromLine(line, correctsEntryId, importedAt);
        entity.status = BankEntryStatus.IMPORTED;
        entity.ledgerSequenceNumber = ledgerSequenceNumber;
        entity.runningBalance = runningBalance.setScale(2, RoundingMode.HALF_UP);
        return entity;
    }

    static BankStatementEntryEntity flagged(StatementLine line, String flagReason, UUID correctsEntryId,
                                            Instant importedAt) {
        BankStatementEntryEntity entity = fromLine(line, correctsEntryId, importedAt);
        entity.status = BankEntryStatus.FLAGGED;
        entity.flagReason = flagReason;
        return entity;
    }

    private static BankStatementEntryEntity fromLine(StatementLine line, UUID correctsEntryId, Instant importedAt) {
        BankStatementEntryEntity entity = new BankStatementEntryEntity();
        entity.entryId = UUID.randomUUID();
        entity.tranId = line.getTranId();
        entity.accountId = line.getAccountId();
        entity.occurredAt = line.getOccurredAt();
        entity.direction = line.getDirection();
        entity.amount = line.getAmount();
        entity.declaredBalance = line.getDeclaredBalance();
        entity.description = line.getDescription();
        if (line.getLinkedReference() != null) {
            entity.linkedReferenceType = line.getLinkedReference().getType().name();
            entity.linkedReferenceId = line.getLinkedReference().getId();
        }
        entity.correctsEntryId = correctsEntryId;
        entity.importedAt = importedAt;
        return entity;
    }

    /**
     * Records the approval. Allowed exactly once, and only for IMPORTED entries.
     *
     * @throws AlreadyApprovedException if the entry was approved before
     * @throws IllegalStateException    if the entry is FLAGGED
     */
    void approve(String approver, Instant at) {
        if (approvedAt != null) {
            throw new AlreadyApprovedException(entryId, approvedBy, approvedAt);
        }
        if (!status.canTransitionTo(BankEntryStatus.APPROVED)) {
            throw new IllegalStateException(
                    String.format("Bank entry %s is %s and cannot be approved", entryId, status));
        }
        this.status = BankEntryStatus.APPROVED;
        this.approvedBy = approver;
        this.approvedAt = at;
    }

    BankLedgerEntry toDomain() {
        return new BankLedgerEntry(entryId, tranId, accountId, ledgerSequenceNumber, occurredAt, direction, amount,
                runningBalance, declaredBalance, description, linkedReferenceType, linkedReferenceId, status,
                flagReason, correctsEntryId, approvedBy, approvedAt, importedAt);
    }
}
