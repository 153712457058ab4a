package com.flagship.pharmacy_ledger.report;

import com.flagship.pharmacy_ledger.cash.CashReconciliationService;
import com.flagship.pharmacy_ledger.config.LedgerProperties;
import com.flagship.pharmacy_ledger.report.dto.InventoryReport;
import com.flagship.pharmacy_ledger.stock.BatchKey;
import com.flagship.pharmacy_ledger.stock.StockPosition;
import com.flagship.pharmacy_ledger.stock.StockReconciliationService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class InventoryReportTest {

    // 2024-03-01 00:30 in Asia/Kolkata, still 2024-02-29 in UTC
    private static final Instant NOW = Instant.parse("2024-02-29T19:00:00Z");

    @Mock
    private StockReconciliationService stockService;

    @Mock
    private CashReconciliationService cashService;

    private ReportService reportService;

    private final StockPosition fresh = new StockPosition(BatchKey.of("Dolo 650", "D1"), "Micro Labs",
            LocalDate.of(2025, 6, 30), 120, 50, "Rack A", new BigDecimal("1.2500"), new BigDecimal("2.00"));
    private final StockPosition expired = new StockPosition(BatchKey.of("Crocin", "C9"), "GSK",
            LocalDate.of(2024, 2, 29), 10, 50, "Rack B", new BigDecimal("0.3333"), null);
    private final StockPosition uncosted = new StockPosition(BatchKey.of("ORS", "O1"), null,
            LocalDate.of(2024, 3, 20), 5, 20, null, null, null);

    @BeforeEach
    void setUp() {
        LedgerProperties properties = new LedgerProperties();
        properties.getStock().setExpiringWindowDays(30);
        reportService = new ReportService(stockService, cashService, properties, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    void testFullInventory() {
        when(stockService.positions()).thenReturn(Stream.of(fresh, expired, uncosted));

        InventoryReport report = reportService.inventoryReport(InventoryFilter.FULL);

        assertEquals(LocalDate.of(2024, 3, 1), report.getBusinessDate());
        assertEquals(3, report.getBatchCount());
        assertEquals(135, report.getTotalUnits());
        // 120 x 1.25 + 10 x 0.3333, the uncosted batch adds nothing
        assertEquals(new BigDecimal("153.33"), report.getStockValue());
        assertEquals(1, report.getExpiredBatches());
        assertEquals(3, report.getPositions().size());
    }

    @Test
    void testLowStockAndExpiringFilters() {
        when(stockService.reorderCandidates()).thenReturn(Stream.of(expired, uncosted));
        when(stockService.expiringBatches(30)).thenReturn(List.of(uncosted));

        InventoryReport low = reportService.inventoryReport(InventoryFilter.LOW_STOCK);
        InventoryReport expiring = reportService.inventoryReport(InventoryFilter.EXPIRING);

        assertEquals(2, low.getBatchCount());
        assertEquals(InventoryFilter.LOW_STOCK, low.getFilter());
        assertEquals(1, expiring.getBatchCount());
        assertEquals(new BigDecimal("0.00"), expiring.getStockValue());
        verify(stockService, never()).positions();
    }
}
