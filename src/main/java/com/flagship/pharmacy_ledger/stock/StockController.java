package com.flagship.pharmacy_ledger.stock;

import com.flagship.pharmacy_ledger.exception.ResourceNotFoundException;
import com.flagship.pharmacy_ledger.ledger.Reference;
import com.flagship.pharmacy_ledger.stock.dto.AdjustStockRequest;
import com.flagship.pharmacy_ledger.stock.dto.LedgerEntryResponse;
import com.flagship.pharmacy_ledger.stock.dto.ReceiveStockRequest;
import com.flagship.pharmacy_ledger.stock.dto.SellStockRequest;
import com.flagship.pharmacy_ledger.stock.dto.StockMovementResponse;
import com.flagship.pharmacy_ledger.stock.dto.StockPositionResponse;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * REST surface of the stock ledger: single-line movements and position queries.
 * Multi-line documents go through {@code /api/documents}.
 */
@RestController
@RequestMapping("/api/stock")
@RequiredArgsConstructor
@Validated
@Slf4j
public class StockController {

    private final StockReconciliationService stockService;

    @PostMapping("/receipts")
    public ResponseEntity<StockMovementResponse> receive(@Valid @RequestBody ReceiveStockRequest request) {
        BatchKey batch = BatchKey.of(request.getMedicineName(), request.getBatchNumber());
        BatchMetadata metadata = new BatchMetadata(request.getManufacturer(), request.getExpiryDate(),
                request.getLocation(), request.getReorderLevel(), request.getSellingPrice());
        StockMovementResult result = stockService.receive(batch, request.getQuantity(), request.getUnitCost(),
                Reference.of(request.getReferenceType(), request.getReferenceId()), metadata);
        return ResponseEntity.status(HttpStatus.CREATED).body(StockMovementResponse.from(result));
    }

    @PostMapping("/sales")
    public ResponseEntity<StockMovementResponse> sell(@Valid @RequestBody SellStockRequest request) {
        BatchKey batch = BatchKey.of(request.getMedicineName(), request.getBatchNumber());
        StockMovementResult result = stockService.sell(batch, request.getQuantity(), request.getUnitPrice(),
                Reference.of(request.getReferenceType(), request.getReferenceId()));
        return ResponseEntity.status(HttpStatus.CREATED).body(StockMovementResponse.from(result));
    }

    @PostMapping("/adjustments")
    public ResponseEntity<StockMovementResponse> adjust(@Valid @RequestBody AdjustStockRequest request) {
        BatchKey batch = BatchKey.of(request.getMedicineName(), request.getBatchNumber());
        StockMovementResult result = stockService.adjust(batch, request.getDelta(), request.getReason(),
                request.getRecountReference());
        return ResponseEntity.status(HttpStatus.CREATED).body(StockMovementResponse.from(result));
    }

    @GetMapping("/positions/{medicineName}/{batchNumber}")
    public ResponseEntity<StockPositionResponse> position(@PathVariable("medicineName") String medicineName,
                                                          @PathVariable("batchNumber") String batchNumber) {
        BatchKey batch = BatchKey.of(medicineName, batchNumber);
        return stockService.position(batch)
            .map(position -> ResponseEntity.ok(StockPositionResponse.from(position)))
            .orElseThrow(() -> new ResourceNotFoundException("Batch not found: " + batch));
    }

    @GetMapping("/positions/{medicineName}/{batchNumber}/quantity")
    public ResponseEntity<Map<String, Object>> quantityAsOf(
            @PathVariable("medicineName") String medicineName,
            @PathVariable("batchNumber") String batchNumber,
            @RequestParam("as_of") @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant asOf) {
        BatchKey batch = BatchKey.of(medicineName, batchNumber);
        long quantity = stockService.quantityAsOf(batch, asOf);
        return ResponseEntity.ok(Map.of("batch_key", batch.entityKey(), "as_of", asOf, "quantity", quantity));
    }

    @GetMapping("/positions/{medicineName}/{batchNumber}/history")
    public ResponseEntity<List<LedgerEntryResponse>> history(
            @PathVariable("medicineName") String medicineName,
            @PathVariable("batchNumber") String batchNumber,
            @RequestParam(value = "as_of", required = false)
            @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant asOf) {
        BatchKey batch = BatchKey.of(medicineName, batchNumber);
        List<LedgerEntryResponse> entries = stockService.history(batch, asOf).stream()
            .map(LedgerEntryResponse::from)
            .collect(Collectors.toList());
        return ResponseEntity.ok(entries);
    }

    @GetMapping("/reorder-candidates")
    public ResponseEntity<List<StockPositionResponse>> reorderCandidates() {
        try (Stream<StockPosition> candidates = stockService.reorderCandidates()) {
            return ResponseEntity.ok(candidates.map(StockPositionResponse::from).collect(Collectors.toList()));
        }
    }

    @GetMapping("/expiring")
    public ResponseEntity<List<StockPositionResponse>> expiring(
            @RequestParam(value = "within_days", defaultValue = "90") @Min(0) @Max(3650) int withinDays) {
        return ResponseEntity.ok(stockService.expiringBatches(withinDays).stream()
            .map(StockPositionResponse::from)
            .collect(Collectors.toList()));
    }
}
