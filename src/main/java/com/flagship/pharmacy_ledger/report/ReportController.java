package com.flagship.pharmacy_ledger.report;

import com.flagship.pharmacy_ledger.report.dto.BankReport;
import com.flagship.pharmacy_ledger.report.dto.InventoryReport;
import lombok.RequiredArgsConstructor;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.LocalDate;

@RestController
@RequestMapping("/api/reports")
@RequiredArgsConstructor
public class ReportController {

    private final ReportService reportService;

    @GetMapping("/inventory")
    public ResponseEntity<InventoryReport> inventory(
            @RequestParam(value = "filter", defaultValue = "FULL") InventoryFilter filter) {
        return ResponseEntity.ok(reportService.inventoryReport(filter));
    }

    @GetMapping("/bank/{accountId}")
    public ResponseEntity<BankReport> bank(
            @PathVariable("accountId") String accountId,
            @RequestParam("from") @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate from,
            @RequestParam("to") @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate to) {
        return ResponseEntity.ok(reportService.bankReport(accountId, from, to));
    }
}
