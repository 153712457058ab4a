package com.flagship.pharmacy_ledger.stock;

import com.flagship.pharmacy_ledger.config.LedgerProperties;
import com.flagship.pharmacy_ledger.exception.DuplicateReferenceException;
import com.flagship.pharmacy_ledger.exception.InsufficientStockException;
import com.flagship.pharmacy_ledger.exception.ResourceNotFoundException;
import com.flagship.pharmacy_ledger.idempotency.IdempotencyGuard;
import com.flagship.pharmacy_ledger.ledger.KeysetSequence;
import com.flagship.pharmacy_ledger.ledger.LedgerDomain;
import com.flagship.pharmacy_ledger.ledger.LedgerEntry;
import com.flagship.pharmacy_ledger.ledger.LedgerEntryDraft;
import com.flagship.pharmacy_ledger.ledger.LedgerStore;
import com.flagship.pharmacy_ledger.ledger.LedgerTransactionExecutor;
import com.flagship.pharmacy_ledger.ledger.MovementKind;
import com.flagship.pharmacy_ledger.ledger.Reference;
import com.flagship.pharmacy_ledger.observability.CorrelationContext;
import com.flagship.pharmacy_ledger.observability.LedgerMetrics;
import com.flagship.pharmacy_ledger.outbox.OutboxService;
import com.flagship.pharmacy_ledger.projection.BalanceProjector;
import com.flagship.pharmacy_ledger.projection.EntityLockManager;
import com.flagship.pharmacy_ledger.projection.Projection;
import com.flagship.pharmacy_ledger.stock.event.ReorderLevelReachedEvent;
import com.flagship.pharmacy_ledger.stock.event.StockMovementRecordedEvent;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Keeps batch quantities consistent with the stock ledger.
 *
 * Every movement runs under the lock of each batch it touches, validates against the
 * folded quantity, appends to the ledger and folds the projection forward, all in one
 * transaction. An event is applied completely or not at all.
 */
@Slf4j
@Service
public class StockReconciliationService {

    private final LedgerStore ledgerStore;
    private final BalanceProjector projector;
    private final EntityLockManager lockManager;
    private final IdempotencyGuard idempotencyGuard;
    private final StockPositionRepository positionRepository;
    private final OutboxService outboxService;
    private final LedgerTransactionExecutor executor;
    private final LedgerMetrics metrics;
    private final LedgerProperties properties;
    private final Clock clock;

    public StockReconciliationService(LedgerStore ledgerStore,
                                      BalanceProjector projector,
                                      EntityLockManager lockManager,
                                      IdempotencyGuard idempotencyGuard,
                                      StockPositionRepository positionRepository,
                                      OutboxService outboxService,
                                      LedgerTransactionExecutor executor,
                                      LedgerMetrics metrics,
                                      LedgerProperties properties,
                                      Clock clock) {
        this.ledgerStore = ledgerStore;
        this.projector = projector;
        this.lockManager = lockManager;
        this.idempotencyGuard = idempotencyGuard;
        this.positionRepository = positionRepository;
        this.outboxService = outboxService;
        this.executor = executor;
        this.metrics = metrics;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * Receives a single batch line. Creates the position on first receipt.
     *
     * @throws DuplicateReferenceException if the reference was already applied
     */
    public StockMovementResult receive(BatchKey batch, long quantity, BigDecimal unitCost,
                                       Reference reference, BatchMetadata metadata) {
        return applyReceipt(ReceiptEvent.of(reference, clock.instant(),
                List.of(StockLine.receipt(batch, quantity, unitCost, metadata)), null));
    }

    /**
     * Sells from a single batch.
     *
     * @throws InsufficientStockException if {@code quantity} exceeds the current quantity
     * @throws DuplicateReferenceException if the reference was already applied
     */
    public StockMovementResult sell(BatchKey batch, long quantity, BigDecimal unitPrice, Reference reference) {
        return applySale(SaleEvent.of(reference, clock.instant(),
                List.of(StockLine.sale(batch, quantity, unitPrice)), null));
    }

    public StockMovementResult applyReceipt(ReceiptEvent event) {
        Reference reference = event.getReference();
        try (CorrelationContext.LedgerScope ignored = CorrelationContext.ledgerScope(null, reference.toString())) {
            return metrics.time("stock.receipt", () -> executor.execute("stock.receipt", () -> {
                claimOrReject(reference);

                Map<String, Projection> locked = lockManager.lockAll(LedgerDomain.STOCK, keysOf(event.getLines()));
                Map<String, StockPositionEntity> positions = loadPositions(locked.keySet());
                Map<String, Long> running = new LinkedHashMap<>();
                for (Map.Entry<String, Projection> lockedEntry : locked.entrySet()) {
                    running.put(lockedEntry.getKey(), toQuantity(projector.current(lockedEntry.getValue())));
                }

                List<LedgerEntryDraft> drafts = new ArrayList<>();
                int lineNumber = 1;
                for (StockLine line : event.getLines()) {
                    String key = line.getBatch().entityKey();
                    StockPositionEntity position = positions.get(key);
                    if (position == null) {
                        position = StockPositionEntity.create(line.getBatch(), line.getMetadata(),
                                properties.getStock().getDefaultReorderLevel());
                        positions.put(key, position);
                        log.info("New batch {} expiring {}", key, line.getMetadata().getExpiryDate());
                    } else {
                        if (!position.getExpiryDate().equals(line.getMetadata().getExpiryDate())) {
                            log.warn("Receipt {} states expiry {} for batch {}, keeping recorded expiry {}",
                                    reference, line.getMetadata().getExpiryDate(), key, position.getExpiryDate());
                        }
                        position.refresh(line.getMetadata());
                    }
                    long before = running.get(key);
                    position.applyReceiptCost(before, line.getQuantity(), line.getUnitPrice());
                    running.put(key, before + line.getQuantity());

                    drafts.add(LedgerEntryDraft.of(key, BigDecimal.valueOf(line.getQuantity()), MovementKind.IN,
                            reference, lineNumber++, event.getOccurredAt(), remarks(event.getRemarks(), line)));
                }
                positionRepository.saveAll(positions.values());

                List<LedgerEntry> appended = ledgerStore.append(drafts);
                Map<String, Long> after = foldForward(locked, appended);
                publishMovements(appended, after);

                metrics.recordMovement(LedgerDomain.STOCK.name(), MovementKind.IN.name(), appended.size());
                log.info("Receipt {} applied: {} line(s), quantities now {}", reference, appended.size(), after);
                return new StockMovementResult(reference, appended, after, List.of());
            }));
        }
    }

    /**
     * Applies every line of a sale or none of them. Lines for the same batch are summed
     * before the availability check.
     */
    public StockMovementResult applySale(SaleEvent event) {
        Reference reference = event.getReference();
        try (CorrelationContext.LedgerScope ignored = CorrelationContext.ledgerScope(null, reference.toString())) {
            return metrics.time("stock.sale", () -> executor.execute("stock.sale", () -> {
                claimOrReject(reference);

                Map<String, Long> requested = event.getLines().stream()
                        .collect(Collectors.groupingBy(line -> line.getBatch().entityKey(), LinkedHashMap::new,
                                Collectors.summingLong(StockLine::getQuantity)));

                Map<String, StockPositionEntity> positions = loadPositions(requested.keySet());
                for (String key : requested.keySet()) {
                    if (!positions.containsKey(key)) {
                        metrics.recordRejection("insufficient_stock");
                        throw new InsufficientStockException(key, requested.get(key), 0);
                    }
                }

                Map<String, Projection> locked = lockManager.lockAll(LedgerDomain.STOCK, requested.keySet());
                Map<String, Long> before = new LinkedHashMap<>();
                for (Map.Entry<String, Projection> lockedEntry : locked.entrySet()) {
                    String key = lockedEntry.getKey();
                    long available = toQuantity(projector.current(lockedEntry.getValue()));
                    long wanted = requested.get(key);
                    if (wanted > available) {
                        metrics.recordRejection("insufficient_stock");
                        log.warn("Sale {} rejected: batch {} has {} unit(s), {} requested",
                                reference, key, available, wanted);
                        throw new InsufficientStockException(key, wanted, available);
                    }
                    before.put(key, available);
                }

                List<LedgerEntryDraft> drafts = new ArrayList<>();
                int lineNumber = 1;
                for (StockLine line : event.getLines()) {
                    drafts.add(LedgerEntryDraft.of(line.getBatch().entityKey(),
                            BigDecimal.valueOf(-line.getQuantity()), MovementKind.OUT, reference, lineNumber++,
                            event.getOccurredAt(), remarks(event.getRemarks(), line)));
                }

                List<LedgerEntry> appended = ledgerStore.append(drafts);
                Map<String, Long> after = foldForward(locked, appended);
                publishMovements(appended, after);

                List<ExpiredBatchWarning> warnings = new ArrayList<>();
                LocalDate today = today();
                for (String key : requested.keySet()) {
                    StockPositionEntity position = positions.get(key);
                    if (position.getExpiryDate().isBefore(today)) {
                        log.warn("Sale {} sold {} unit(s) from expired batch {} (expired {})",
                                reference, requested.get(key), key, position.getExpiryDate());
                        warnings.add(new ExpiredBatchWarning(key, position.getExpiryDate(), requested.get(key)));
                    }
                    long quantityAfter = after.get(key);
                    if (before.get(key) >= position.getReorderLevel() && quantityAfter < position.getReorderLevel()) {
                        log.info("Batch {} dropped below reorder level {} ({} left)",
                                key, position.getReorderLevel(), quantityAfter);
                        outboxService.saveEvent(new ReorderLevelReachedEvent(key, position.getMedicineName(),
                                position.getBatchNumber(), quantityAfter, position.getReorderLevel(), clock.instant()));
                    }
                }

                metrics.recordMovement(LedgerDomain.STOCK.name(), MovementKind.OUT.name(), appended.size());
                log.info("Sale {} applied: {} line(s), quantities now {}", reference, appended.size(), after);
                return new StockMovementResult(reference, appended, after, List.copyOf(warnings));
            }));
        }
    }

    /**
     * Manual correction of a batch quantity. Never deduplicated: two identical adjustments
     * are two movements.
     *
     * @param recountReference optional id of the stock count that motivated the adjustment
     * @throws InsufficientStockException if the adjustment would leave the batch negative
     */
    public StockMovementResult adjust(BatchKey batch, long delta, String reason, String recountReference) {
        if (delta == 0) {
            throw new IllegalArgumentException("Adjustment delta cannot be zero");
        }
        if (reason == null || reason.isBlank()) {
            throw new IllegalArgumentException("Adjustment reason is required");
        }
        String key = batch.entityKey();
        try (CorrelationContext.LedgerScope ignored = CorrelationContext.ledgerScope(key, null)) {
            return executor.execute("stock.adjust", () -> {
                positionRepository.findByEntityKey(key)
                        .orElseThrow(() -> new ResourceNotFoundException("Unknown batch: " + key));

                Projection locked = lockManager.lock(LedgerDomain.STOCK, key);
                long current = toQuantity(projector.current(locked));
                if (current + delta < 0) {
                    metrics.recordRejection("negative_adjustment");
                    throw new InsufficientStockException(key, -delta, current);
                }

                String remarks = recountReference == null ? reason : reason + " [recount " + recountReference + "]";
                List<LedgerEntry> appended = ledgerStore.append(List.of(LedgerEntryDraft.of(key,
                        BigDecimal.valueOf(delta), MovementKind.ADJUST, Reference.manual(), 0, clock.instant(),
                        remarks)));
                long after = toQuantity(projector.foldForward(locked, appended));
                Map<String, Long> quantities = Map.of(key, after);
                publishMovements(appended, quantities);

                metrics.recordMovement(LedgerDomain.STOCK.name(), MovementKind.ADJUST.name(), 1);
                log.info("Batch {} adjusted by {} ({}): {} -> {}", key, delta, remarks, current, after);
                return new StockMovementResult(Reference.manual(), appended, quantities, List.of());
            });
        }
    }

    public Optional<StockPosition> position(BatchKey batch) {
        return positionRepository.findByEntityKey(batch.entityKey())
                .map(entity -> entity.toPosition(toQuantity(projector.current(LedgerDomain.STOCK, entity.getEntityKey()))));
    }

    public long quantityAsOf(BatchKey batch, Instant asOf) {
        return toQuantity(projector.asOf(LedgerDomain.STOCK, batch.entityKey(), asOf));
    }

    public KeysetSequence<LedgerEntry> history(BatchKey batch, Instant asOf) {
        return ledgerStore.read(LedgerDomain.STOCK, batch.entityKey(), asOf);
    }

    /**
     * Every position, lazily, in creation order.
     */
    public Stream<StockPosition> positions() {
        int pageSize = properties.getRead().getPageSize();
        KeysetSequence<StockPositionEntity> entities = new KeysetSequence<>(last ->
                positionRepository.findByIdGreaterThanOrderByIdAsc(last == null ? 0L : last.getId(),
                        PageRequest.of(0, pageSize)), pageSize);
        return entities.stream()
                .map(entity -> entity.toPosition(toQuantity(projector.current(LedgerDomain.STOCK, entity.getEntityKey()))));
    }

    /**
     * Positions whose current quantity is below their reorder level, lazily.
     */
    public Stream<StockPosition> reorderCandidates() {
        return positions().filter(StockPosition::isBelowReorderLevel);
    }

    /**
     * Positions with stock on hand that expire between today and {@code withinDays} from now.
     */
    public List<StockPosition> expiringBatches(int withinDays) {
        if (withinDays < 0) {
            throw new IllegalArgumentException("Window cannot be negative");
        }
        LocalDate today = today();
        return positionRepository.findByExpiryDateBetweenOrderByExpiryDateAsc(today, today.plusDays(withinDays))
                .stream()
                .map(entity -> entity.toPosition(toQuantity(projector.current(LedgerDomain.STOCK, entity.getEntityKey()))))
                .filter(position -> position.getCurrentQuantity() > 0)
                .toList();
    }

    private void claimOrReject(Reference reference) {
        if (reference.isDeduplicated()
                && !idempotencyGuard.claim(reference.getType(), reference.getId(), LedgerDomain.STOCK)) {
            metrics.recordDuplicate(reference.getType().name());
            throw new DuplicateReferenceException(reference.getType().name(), reference.getId());
        }
    }

    private Map<String, StockPositionEntity> loadPositions(Iterable<String> keys) {
        return positionRepository.findByEntityKeyIn(keys).stream()
                .collect(Collectors.toMap(StockPositionEntity::getEntityKey, Function.identity(),
                        (a, b) -> a, LinkedHashMap::new));
    }

    private Map<String, Long> foldForward(Map<String, Projection> locked, List<LedgerEntry> appended) {
        Map<String, List<LedgerEntry>> byKey = appended.stream()
                .collect(Collectors.groupingBy(LedgerEntry::getEntityKey));
        Map<String, Long> after = new LinkedHashMap<>();
        for (Map.Entry<String, Projection> lockedEntry : locked.entrySet()) {
            List<LedgerEntry> entries = byKey.getOrDefault(lockedEntry.getKey(), List.of());
            after.put(lockedEntry.getKey(), toQuantity(projector.foldForward(lockedEntry.getValue(), entries)));
        }
        return after;
    }

    private void publishMovements(List<LedgerEntry> appended, Map<String, Long> after) {
        for (LedgerEntry entry : appended) {
            outboxService.saveEvent(StockMovementRecordedEvent.from(entry, after.get(entry.getEntityKey())));
        }
    }

    private static List<String> keysOf(List<StockLine> lines) {
        return lines.stream().map(line -> line.getBatch().entityKey()).distinct().toList();
    }

    private static String remarks(String eventRemarks, StockLine line) {
        if (line.getUnitPrice() == null) {
            return eventRemarks;
        }
        String price = "@" + line.getUnitPrice().toPlainString();
        return eventRemarks == null ? price : eventRemarks + " " + price;
    }

    private LocalDate today() {
        return LocalDate.ofInstant(clock.instant(), properties.getBusinessZone());
    }

    static long toQuantity(BigDecimal value) {
        return value.longValueExact();
    }
}
