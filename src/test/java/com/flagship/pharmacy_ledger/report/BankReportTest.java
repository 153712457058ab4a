package com.flagship.pharmacy_ledger.report;

import com.flagship.pharmacy_ledger.cash.CashReconciliationService;
import com.flagship.pharmacy_ledger.cash.Direction;
import com.flagship.pharmacy_ledger.cash.StatementLine;
import com.flagship.pharmacy_ledger.exception.BalanceMismatchException;
import com.flagship.pharmacy_ledger.exception.ResourceNotFoundException;
import com.flagship.pharmacy_ledger.report.dto.BankReport;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Bank statement reports over business days in the pharmacy's time zone.
 */
@SpringBootTest
class BankReportTest {

    @Autowired
    private ReportService reportService;

    @Autowired
    private CashReconciliationService cashService;

    private String accountId;
    private String suffix;

    @BeforeEach
    void setUp() {
        suffix = UUID.randomUUID().toString().substring(0, 8);
        accountId = "SBI-" + suffix;
        cashService.openAccount(accountId, "SBI Current", new BigDecimal("100000.00"),
                OffsetDateTime.parse("2024-01-01T00:00:00+05:30").toInstant());

        importLine("R1", "2024-01-02T10:00:00+05:30", Direction.CR, "1000.00", null);
        importLine("R2", "2024-01-03T00:00:00+05:30", Direction.CR, "20.00", null);
        importLine("R3", "2024-01-05T11:00:00+05:30", Direction.DR, "300.00", null);
        assertThrows(BalanceMismatchException.class,
                () -> importLine("R4", "2024-01-05T12:00:00+05:30", Direction.DR, "5.00", "1.00"));
        importLine("R5", "2024-01-08T09:00:00+05:30", Direction.CR, "50.00", null);
    }

    private void importLine(String tranId, String occurredAt, Direction direction, String amount, String declared) {
        cashService.importStatementEntry(StatementLine.of(accountId, tranId + "-" + suffix,
                OffsetDateTime.parse(occurredAt).toInstant(), direction, new BigDecimal(amount),
                "Line " + tranId, declared == null ? null : new BigDecimal(declared), null));
    }

    @Test
    @DisplayName("Opening balance folds everything before the first day, flagged lines stay out of totals")
    void testMidPeriodReport() {
        BankReport report = reportService.bankReport(accountId, LocalDate.of(2024, 1, 3), LocalDate.of(2024, 1, 5));

        assertEquals(0, new BigDecimal("101000.00").compareTo(report.getOpeningBalance()));
        assertEquals(0, new BigDecimal("20.00").compareTo(report.getTotalCredits()));
        assertEquals(0, new BigDecimal("300.00").compareTo(report.getTotalDebits()));
        assertEquals(0, new BigDecimal("100720.00").compareTo(report.getClosingBalance()));
        assertEquals(3, report.getEntries().size());
        assertEquals(1, report.getFlaggedCount());
        assertEquals(2, report.getUnapprovedCount());
        assertEquals("SBI Current", report.getAccountName());
    }

    @Test
    @DisplayName("A line at midnight belongs to the day it starts, not the day before")
    void testDayBoundaries() {
        BankReport report = reportService.bankReport(accountId, LocalDate.of(2024, 1, 1), LocalDate.of(2024, 1, 2));

        assertEquals(1, report.getEntries().size());
        assertEquals(0, new BigDecimal("100000.00").compareTo(report.getOpeningBalance()));
        assertEquals(0, new BigDecimal("101000.00").compareTo(report.getClosingBalance()));
    }

    @Test
    @DisplayName("The closing balance of the full range matches the account balance")
    void testFullRange() {
        BankReport report = reportService.bankReport(accountId, LocalDate.of(2024, 1, 1), LocalDate.of(2024, 1, 31));

        assertEquals(0, cashService.balance(accountId).compareTo(report.getClosingBalance()));
        assertEquals(0, new BigDecimal("100770.00").compareTo(report.getClosingBalance()));
    }

    @Test
    @DisplayName("Reversed ranges and unknown accounts are rejected")
    void testInvalidRequests() {
        assertThrows(IllegalArgumentException.class,
                () -> reportService.bankReport(accountId, LocalDate.of(2024, 1, 5), LocalDate.of(2024, 1, 4)));
        assertThrows(ResourceNotFoundException.class,
                () -> reportService.bankReport("NOPE-" + suffix, LocalDate.of(2024, 1, 1), LocalDate.of(2024, 1, 2)));
    }
}
