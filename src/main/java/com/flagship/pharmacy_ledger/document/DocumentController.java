package com.flagship.pharmacy_ledger.document;

import com.flagship.pharmacy_ledger.document.dto.PaymentStatusUpdateRequest;
import com.flagship.pharmacy_ledger.document.dto.PosSaleResponse;
import com.flagship.pharmacy_ledger.document.dto.RecordInvoiceRequest;
import com.flagship.pharmacy_ledger.document.dto.RecordSaleRequest;
import com.flagship.pharmacy_ledger.document.dto.SupplierInvoiceResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * Intake of POS receipts and supplier invoices over HTTP.
 *
 * A resubmitted document answers 200 ALREADY_APPLIED through the exception handler;
 * a first submission answers 201.
 */
@RestController
@RequestMapping("/api/documents")
@RequiredArgsConstructor
@Slf4j
public class DocumentController {

    private final PosSaleService saleService;
    private final SupplierInvoiceService invoiceService;

    @PostMapping("/sales")
    public ResponseEntity<PosSaleResponse> recordSale(@Valid @RequestBody RecordSaleRequest request) {
        long startTime = System.currentTimeMillis();
        log.info("Received POS receipt {} with {} item(s)", request.getReceiptNumber(), request.getItems().size());
        try {
            RecordedSale recorded = saleService.recordSale(request);
            log.info("POS receipt {} accepted in {}ms", request.getReceiptNumber(),
                    System.currentTimeMillis() - startTime);
            return ResponseEntity.status(HttpStatus.CREATED)
                .body(PosSaleResponse.from(recorded.getSale(), recorded.getWarnings()));
        } catch (RuntimeException e) {
            log.info("POS receipt {} not recorded after {}ms: {}", request.getReceiptNumber(),
                    System.currentTimeMillis() - startTime, e.getMessage());
            throw e;
        }
    }

    @GetMapping("/sales/{receiptNumber}")
    public ResponseEntity<PosSaleResponse> getSale(@PathVariable("receiptNumber") String receiptNumber) {
        return ResponseEntity.ok(PosSaleResponse.from(saleService.getSale(receiptNumber), List.of()));
    }

    @PatchMapping("/sales/{receiptNumber}/payment-status")
    public ResponseEntity<PosSaleResponse> updateSalePaymentStatus(
            @PathVariable("receiptNumber") String receiptNumber,
            @Valid @RequestBody PaymentStatusUpdateRequest request) {
        PosSaleEntity sale = saleService.updatePaymentStatus(receiptNumber, request.getPaymentStatus());
        return ResponseEntity.ok(PosSaleResponse.from(sale, List.of()));
    }

    @PostMapping("/invoices")
    public ResponseEntity<SupplierInvoiceResponse> recordInvoice(@Valid @RequestBody RecordInvoiceRequest request) {
        long startTime = System.currentTimeMillis();
        log.info("Received invoice {} from {} with {} item(s)",
                request.getInvoiceNumber(), request.getSupplierName(), request.getItems().size());
        try {
            SupplierInvoiceEntity invoice = invoiceService.recordInvoice(request);
            log.info("Invoice {} accepted in {}ms", request.getInvoiceNumber(),
                    System.currentTimeMillis() - startTime);
            return ResponseEntity.status(HttpStatus.CREATED).body(SupplierInvoiceResponse.from(invoice));
        } catch (RuntimeException e) {
            log.info("Invoice {} not recorded after {}ms: {}", request.getInvoiceNumber(),
                    System.currentTimeMillis() - startTime, e.getMessage());
            throw e;
        }
    }

    @GetMapping("/invoices/{invoiceNumber}")
    public ResponseEntity<SupplierInvoiceResponse> getInvoice(@PathVariable("invoiceNumber") String invoiceNumber) {
        return ResponseEntity.ok(SupplierInvoiceResponse.from(invoiceService.getInvoice(invoiceNumber)));
    }

    @PatchMapping("/invoices/{invoiceNumber}/payment-status")
    public ResponseEntity<SupplierInvoiceResponse> updateInvoicePaymentStatus(
            @PathVariable("invoiceNumber") String invoiceNumber,
            @Valid @RequestBody PaymentStatusUpdateRequest request) {
        SupplierInvoiceEntity invoice = invoiceService.updatePaymentStatus(invoiceNumber, request.getPaymentStatus());
        return ResponseEntity.ok(SupplierInvoiceResponse.from(invoice));
    }
}
