package com.flagship.pharmacy_ledger.report;

import com.flagship.pharmacy_ledger.cash.BankAccountEntity;
import com.flagship.pharmacy_ledger.cash.BankEntryStatus;
import com.flagship.pharmacy_ledger.cash.BankLedgerEntry;
import com.flagship.pharmacy_ledger.cash.CashReconciliationService;
import com.flagship.pharmacy_ledger.cash.Direction;
import com.flagship.pharmacy_ledger.cash.dto.BankEntryResponse;
import com.flagship.pharmacy_ledger.config.LedgerProperties;
import com.flagship.pharmacy_ledger.report.dto.BankReport;
import com.flagship.pharmacy_ledger.report.dto.InventoryReport;
import com.flagship.pharmacy_ledger.stock.StockPosition;
import com.flagship.pharmacy_ledger.stock.StockReconciliationService;
import com.flagship.pharmacy_ledger.stock.dto.StockPositionResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Read-only reports over both ledgers. Quantities and balances come from the projector,
 * never from stored columns.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ReportService {

    private final StockReconciliationService stockService;
    private final CashReconciliationService cashService;
    private final LedgerProperties properties;
    private final Clock clock;

    public InventoryReport inventoryReport(InventoryFilter filter) {
        List<StockPosition> positions;
        switch (filter) {
            case LOW_STOCK -> positions = collect(stockService.reorderCandidates());
            case EXPIRING -> positions = stockService.expiringBatches(properties.getStock().getExpiringWindowDays());
            default -> positions = collect(stockService.positions());
        }

        LocalDate today = LocalDate.ofInstant(clock.instant(), properties.getBusinessZone());
        long totalUnits = 0;
        BigDecimal stockValue = BigDecimal.ZERO;
        int expired = 0;
        for (StockPosition position : positions) {
            totalUnits += position.getCurrentQuantity();
            if (position.getCostPrice() != null) {
                stockValue = stockValue.add(position.getCostPrice().multiply(BigDecimal.valueOf(position.getCurrentQuantity())));
            }
            if (position.isExpiredOn(today)) {
                expired++;
            }
        }

        log.debug("Inventory report {}: {} batch(es), {} unit(s)", filter, positions.size(), totalUnits);
        return InventoryReport.builder()
            .filter(filter)
            .businessDate(today)
            .batchCount(positions.size())
            .totalUnits(totalUnits)
            .stockValue(stockValue.setScale(2, RoundingMode.HALF_UP))
            .expiredBatches(expired)
            .positions(positions.stream().map(StockPositionResponse::from).collect(Collectors.toList()))
            .generatedAt(clock.instant())
            .build();
    }

    /**
     * Statement of an account over the business days {@code from} to {@code to}, both
     * inclusive. FLAGGED lines are listed but do not count towards the totals.
     */
    public BankReport bankReport(String accountId, LocalDate from, LocalDate to) {
        if (from == null || to == null || to.isBefore(from)) {
            throw new IllegalArgumentException("Report range must have from <= to");
        }
        BankAccountEntity account = cashService.requireAccount(accountId);
        Instant start = from.atStartOfDay(properties.getBusinessZone()).toInstant();
        Instant end = to.plusDays(1).atStartOfDay(properties.getBusinessZone()).toInstant();

        List<BankLedgerEntry> entries = cashService.entriesBetween(accountId, start, end);

        BigDecimal credits = BigDecimal.ZERO;
        BigDecimal debits = BigDecimal.ZERO;
        int flagged = 0;
        int unapproved = 0;
        for (BankLedgerEntry entry : entries) {
            if (entry.getStatus() == BankEntryStatus.FLAGGED) {
                flagged++;
                continue;
            }
            if (!entry.isApproved()) {
                unapproved++;
            }
            if (entry.getDirection() == Direction.CR) {
                credits = credits.add(entry.getAmount());
            } else {
                debits = debits.add(entry.getAmount());
            }
        }

        // balanceAsOf includes entries at the instant itself
        BigDecimal opening = cashService.balanceAsOf(accountId, start.minus(1, ChronoUnit.MICROS));
        BigDecimal closing = opening.add(credits).subtract(debits);

        return BankReport.builder()
            .accountId(accountId)
            .accountName(account.getAccountName())
            .from(from)
            .to(to)
            .openingBalance(opening)
            .totalCredits(credits)
            .totalDebits(debits)
            .closingBalance(closing)
            .flaggedCount(flagged)
            .unapprovedCount(unapproved)
            .entries(entries.stream().map(BankEntryResponse::from).collect(Collectors.toList()))
            .generatedAt(clock.instant())
            .build();
    }

    private static List<StockPosition> collect(Stream<StockPosition> positions) {
        try (positions) {
            return positions.collect(Collectors.toList());
        }
    }
}
