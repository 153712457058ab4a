package com.flagship.pharmacy_ledger.cash;

import com.flagship.pharmacy_ledger.cash.event.BankEntryApprovedEvent;
import com.flagship.pharmacy_ledger.cash.event.BankEntryFlaggedEvent;
import com.flagship.pharmacy_ledger.cash.event.BankEntryImportedEvent;
import com.flagship.pharmacy_ledger.config.LedgerProperties;
import com.flagship.pharmacy_ledger.exception.AlreadyApprovedException;
import com.flagship.pharmacy_ledger.exception.BalanceMismatchException;
import com.flagship.pharmacy_ledger.exception.DuplicateTransactionException;
import com.flagship.pharmacy_ledger.exception.ResourceNotFoundException;
import com.flagship.pharmacy_ledger.idempotency.IdempotencyGuard;
import com.flagship.pharmacy_ledger.ledger.KeysetSequence;
import com.flagship.pharmacy_ledger.ledger.LedgerDomain;
import com.flagship.pharmacy_ledger.ledger.LedgerEntry;
import com.flagship.pharmacy_ledger.ledger.LedgerEntryDraft;
import com.flagship.pharmacy_ledger.ledger.LedgerStore;
import com.flagship.pharmacy_ledger.ledger.LedgerTransactionExecutor;
import com.flagship.pharmacy_ledger.ledger.Reference;
import com.flagship.pharmacy_ledger.ledger.ReferenceType;
import com.flagship.pharmacy_ledger.observability.CorrelationContext;
import com.flagship.pharmacy_ledger.observability.LedgerMetrics;
import com.flagship.pharmacy_ledger.outbox.OutboxService;
import com.flagship.pharmacy_ledger.projection.BalanceProjector;
import com.flagship.pharmacy_ledger.projection.EntityLockManager;
import com.flagship.pharmacy_ledger.projection.Projection;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Reconciles bank statements against the cash ledger.
 *
 * Statement lines of an account are imported in order under the account lock. Each line's
 * running balance is the previous balance plus or minus its amount, starting from the
 * account's opening balance. A line whose printed balance disagrees with that is kept as
 * FLAGGED for review and never reaches the ledger.
 */
@Slf4j
@Service
public class CashReconciliationService {

    private final BankAccountRepository accountRepository;
    private final BankStatementEntryRepository entryRepository;
    private final LedgerStore ledgerStore;
    private final BalanceProjector projector;
    private final EntityLockManager lockManager;
    private final IdempotencyGuard idempotencyGuard;
    private final OutboxService outboxService;
    private final LedgerTransactionExecutor executor;
    private final LedgerMetrics metrics;
    private final LedgerProperties properties;
    private final Clock clock;

    public CashReconciliationService(BankAccountRepository accountRepository,
                                     BankStatementEntryRepository entryRepository,
                                     LedgerStore ledgerStore,
                                     BalanceProjector projector,
                                     EntityLockManager lockManager,
                                     IdempotencyGuard idempotencyGuard,
                                     OutboxService outboxService,
                                     LedgerTransactionExecutor executor,
                                     LedgerMetrics metrics,
                                     LedgerProperties properties,
                                     Clock clock) {
        this.accountRepository = accountRepository;
        this.entryRepository = entryRepository;
        this.ledgerStore = ledgerStore;
        this.projector = projector;
        this.lockManager = lockManager;
        this.idempotencyGuard = idempotencyGuard;
        this.outboxService = outboxService;
        this.executor = executor;
        this.metrics = metrics;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * @throws IllegalStateException if the account already exists
     */
    public BankAccountEntity openAccount(String accountId, String accountName, BigDecimal openingBalance,
                                         Instant openedAt) {
        if (accountId == null || accountId.isBlank() || accountId.length() > 50) {
            throw new IllegalArgumentException("Account id must be 1-50 characters");
        }
        if (accountName == null || accountName.isBlank()) {
            throw new IllegalArgumentException("Account name cannot be blank");
        }
        if (openingBalance == null || openedAt == null) {
            throw new IllegalArgumentException("Opening balance and opening time are required");
        }
        StatementLine.requireCents(openingBalance, "Opening balance");
        return executor.execute("cash.open-account", () -> {
            if (accountRepository.existsById(accountId)) {
                throw new IllegalStateException("Bank account already exists: " + accountId);
            }
            BankAccountEntity saved = accountRepository.save(BankAccountEntity.open(accountId, accountName,
                    openingBalance, openedAt.truncatedTo(ChronoUnit.MICROS)));
            log.info("Opened bank account {} with opening balance {}", accountId, openingBalance.toPlainString());
            return saved;
        });
    }

    /**
     * Imports one statement line.
     *
     * @throws DuplicateTransactionException if the transaction id was imported before
     * @throws BalanceMismatchException      if the declared balance disagrees with the ledger;
     *                                       the line is kept as FLAGGED
     * @throws IllegalArgumentException      if the line is older than the account's latest entry
     */
    public BankLedgerEntry importStatementEntry(StatementLine line) {
        return importLine(line);
    }

    /**
     * Imports a corrected version of a FLAGGED line as a new entry linked to it. The flagged
     * entry itself is never changed.
     *
     * If the corrected line reuses the flagged transaction id, the corrective entry gets
     * {@code <tranId>-R<n>}.
     */
    public BankLedgerEntry resolveFlagged(UUID flaggedEntryId, StatementLine correctedLine, String resolvedBy) {
        if (resolvedBy == null || resolvedBy.isBlank()) {
            throw new IllegalArgumentException("Resolver is required");
        }
        try (CorrelationContext.LedgerScope ignored =
                     CorrelationContext.ledgerScope(correctedLine.getAccountId(), correctedLine.getTranId())) {

            // the flagged row lock serializes resolutions of the same entry
            ImportOutcome outcome = metrics.time("cash.import", () -> executor.execute("cash.resolve-flagged", () -> {
                BankStatementEntryEntity flagged = entryRepository.findForUpdate(flaggedEntryId)
                        .orElseThrow(() -> new ResourceNotFoundException("Bank entry not found: " + flaggedEntryId));
                if (flagged.getStatus() != BankEntryStatus.FLAGGED) {
                    throw new IllegalStateException("Bank entry " + flaggedEntryId + " is " + flagged.getStatus()
                            + ", only FLAGGED entries can be resolved");
                }
                if (!flagged.getAccountId().equals(correctedLine.getAccountId())) {
                    throw new IllegalArgumentException("Corrected line must belong to account "
                            + flagged.getAccountId());
                }
                List<BankStatementEntryEntity> corrections = entryRepository.findByCorrectsEntryId(flaggedEntryId);
                if (corrections.stream().anyMatch(c -> c.getStatus() != BankEntryStatus.FLAGGED)) {
                    throw new IllegalStateException("Bank entry " + flaggedEntryId + " is already resolved");
                }

                StatementLine line = correctedLine.getTranId().equals(flagged.getTranId())
                        ? correctedLine.withTranId(flagged.getTranId() + "-R" + (corrections.size() + 1))
                        : correctedLine;
                log.info("Resolving flagged entry {} ({}) by {} with {}", flaggedEntryId, flagged.getTranId(),
                        resolvedBy, line.getTranId());
                return doImport(line, flaggedEntryId);
            }));
            return completeImport(outcome);
        }
    }

    private BankLedgerEntry importLine(StatementLine line) {
        try (CorrelationContext.LedgerScope ignored =
                     CorrelationContext.ledgerScope(line.getAccountId(), line.getTranId())) {

            ImportOutcome outcome = metrics.time("cash.import",
                    () -> executor.execute("cash.import", () -> doImport(line, null)));
            return completeImport(outcome);
        }
    }

    /**
     * Raised after commit so the FLAGGED row is kept.
     */
    private BankLedgerEntry completeImport(ImportOutcome outcome) {
        BankLedgerEntry entry = outcome.getEntry();
        if (entry.getStatus() == BankEntryStatus.FLAGGED) {
            throw new BalanceMismatchException(entry.getTranId(), entry.getEntryId(),
                    entry.getDeclaredBalance(), outcome.getComputedBalance());
        }
        return entry;
    }

    private ImportOutcome doImport(StatementLine line, UUID correctsEntryId) {
        BankAccountEntity account = accountRepository.findById(line.getAccountId())
                .orElseThrow(() -> new ResourceNotFoundException("Bank account not found: " + line.getAccountId()));

        if (!idempotencyGuard.claim(ReferenceType.BANK_STATEMENT, line.getTranId(), LedgerDomain.CASH)) {
            metrics.recordDuplicate(ReferenceType.BANK_STATEMENT.name());
            throw new DuplicateTransactionException(line.getTranId());
        }

        Instant occurredAt = line.getOccurredAt().truncatedTo(ChronoUnit.MICROS);
        if (occurredAt.isBefore(account.getOpenedAt())) {
            throw new IllegalArgumentException(String.format(
                    "Line %s occurred at %s, before account %s was opened", line.getTranId(), occurredAt,
                    account.getAccountId()));
        }

        Projection locked = lockManager.lock(LedgerDomain.CASH, account.getAccountId());
        Optional<Instant> latest = ledgerStore.latestOccurredAt(LedgerDomain.CASH, account.getAccountId());
        if (latest.isPresent() && occurredAt.isBefore(latest.get())) {
            metrics.recordRejection("back_dated_statement_line");
            throw new IllegalArgumentException(String.format(
                    "Line %s occurred at %s, before the latest entry of account %s at %s",
                    line.getTranId(), occurredAt, account.getAccountId(), latest.get()));
        }

        BigDecimal previous = projector.current(locked);
        BigDecimal computed = previous.add(line.getDirection().signed(line.getAmount()));
        Instant now = clock.instant().truncatedTo(ChronoUnit.MICROS);

        if (line.getDeclaredBalance() != null
                && line.getDeclaredBalance().subtract(computed).abs()
                    .compareTo(properties.getCash().getBalanceTolerance()) > 0) {
            String reason = String.format("Declared balance %s differs from computed balance %s",
                    line.getDeclaredBalance().toPlainString(), computed.toPlainString());
            BankStatementEntryEntity flagged = entryRepository.save(
                    BankStatementEntryEntity.flagged(line, reason, correctsEntryId, now));
            outboxService.saveEvent(new BankEntryFlaggedEvent(flagged.getEntryId(), flagged.getTranId(),
                    flagged.getAccountId(), line.getDeclaredBalance(), computed, reason));
            metrics.incrementFlaggedEntries();
            metrics.recordRejection("balance_mismatch");
            log.warn("Statement line {} flagged for review: {}", line.getTranId(), reason);
            return new ImportOutcome(flagged.toDomain(), computed);
        }

        Reference reference = Reference.of(ReferenceType.BANK_STATEMENT, line.getTranId());
        List<LedgerEntry> appended = ledgerStore.append(List.of(LedgerEntryDraft.of(account.getAccountId(),
                line.getDirection().signed(line.getAmount()), line.getDirection().movementKind(), reference, 0,
                occurredAt, line.getDescription())));
        BigDecimal balance = projector.foldForward(locked, appended);

        BankStatementEntryEntity imported = entryRepository.save(BankStatementEntryEntity.imported(
                line, appended.get(0).getSequenceNumber(), balance, correctsEntryId, now));
        BankLedgerEntry entry = imported.toDomain();
        outboxService.saveEvent(BankEntryImportedEvent.from(entry));

        metrics.recordMovement(LedgerDomain.CASH.name(), line.getDirection().name(), 1);
        log.info("Imported {} {} {} on account {}: balance {} -> {}", line.getTranId(), line.getDirection(),
                line.getAmount().toPlainString(), account.getAccountId(), previous.toPlainString(),
                balance.toPlainString());
        return new ImportOutcome(entry, balance);
    }

    /**
     * Approves an IMPORTED entry. Approval is set exactly once and freezes the entry.
     *
     * @throws AlreadyApprovedException on any second approval, whoever the approver
     */
    public BankLedgerEntry approve(UUID entryId, String approver) {
        if (approver == null || approver.isBlank()) {
            throw new IllegalArgumentException("Approver is required");
        }
        return executor.execute("cash.approve", () -> {
            BankStatementEntryEntity entity = entryRepository.findForUpdate(entryId)
                    .orElseThrow(() -> new ResourceNotFoundException("Bank entry not found: " + entryId));
            entity.approve(approver, clock.instant().truncatedTo(ChronoUnit.MICROS));
            BankStatementEntryEntity saved = entryRepository.save(entity);

            outboxService.saveEvent(new BankEntryApprovedEvent(saved.getEntryId(), saved.getTranId(),
                    saved.getAccountId(), saved.getApprovedBy(), saved.getApprovedAt()));
            metrics.incrementApprovedEntries();
            log.info("Bank entry {} ({}) approved by {}", entryId, saved.getTranId(), approver);
            return saved.toDomain();
        });
    }

    /**
     * IMPORTED entries awaiting review, oldest first, lazily.
     *
     * @param accountId restricts the queue to one account when not null
     */
    public KeysetSequence<BankLedgerEntry> unreconciled(String accountId) {
        int pageSize = properties.getRead().getPageSize();
        PageRequest page = PageRequest.of(0, pageSize);
        return new KeysetSequence<>(last -> {
            List<BankStatementEntryEntity> rows;
            if (accountId == null) {
                rows = last == null
                        ? entryRepository.findUnreconciled(page)
                        : entryRepository.findUnreconciledAfter(last.getOccurredAt(), last.getImportedAt(),
                                last.getEntryId(), page);
            } else {
                rows = last == null
                        ? entryRepository.findUnreconciledByAccount(accountId, page)
                        : entryRepository.findUnreconciledByAccountAfter(accountId, last.getOccurredAt(),
                                last.getImportedAt(), last.getEntryId(), page);
            }
            return rows.stream().map(BankStatementEntryEntity::toDomain).toList();
        }, pageSize);
    }

    /**
     * Every entry of an account, FLAGGED ones included, in statement order.
     */
    public KeysetSequence<BankLedgerEntry> entries(String accountId) {
        requireAccount(accountId);
        int pageSize = properties.getRead().getPageSize();
        PageRequest page = PageRequest.of(0, pageSize);
        return new KeysetSequence<>(last -> (last == null
                ? entryRepository.findByAccount(accountId, page)
                : entryRepository.findByAccountAfter(accountId, last.getOccurredAt(), last.getImportedAt(),
                        last.getEntryId(), page))
                .stream()
                .map(BankStatementEntryEntity::toDomain)
                .toList(), pageSize);
    }

    /**
     * Entries of an account that occurred in {@code [from, to)}, FLAGGED ones included.
     */
    public List<BankLedgerEntry> entriesBetween(String accountId, Instant from, Instant to) {
        requireAccount(accountId);
        if (!from.isBefore(to)) {
            throw new IllegalArgumentException("Range start must be before its end");
        }
        return entryRepository.findInRange(accountId, from, to).stream()
                .map(BankStatementEntryEntity::toDomain)
                .toList();
    }

    public BigDecimal balance(String accountId) {
        requireAccount(accountId);
        return projector.current(LedgerDomain.CASH, accountId);
    }

    public BigDecimal balanceAsOf(String accountId, Instant asOf) {
        requireAccount(accountId);
        return projector.asOf(LedgerDomain.CASH, accountId, asOf);
    }

    public Optional<BankLedgerEntry> findEntry(UUID entryId) {
        return entryRepository.findById(entryId).map(BankStatementEntryEntity::toDomain);
    }

    public BankAccountEntity requireAccount(String accountId) {
        return accountRepository.findById(accountId)
                .orElseThrow(() -> new ResourceNotFoundException("Bank account not found: " + accountId));
    }

    @Value
    private static class ImportOutcome {
        BankLedgerEntry entry;
        BigDecimal computedBalance;
    }
}
