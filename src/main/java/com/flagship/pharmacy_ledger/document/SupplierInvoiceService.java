package com.flagship.pharmacy_ledger.document;

import com.flagship.pharmacy_ledger.config.LedgerProperties;
import com.flagship.pharmacy_ledger.document.dto.InvoiceItemRequest;
import com.flagship.pharmacy_ledger.document.dto.RecordInvoiceRequest;
import com.flagship.pharmacy_ledger.exception.ResourceNotFoundException;
import com.flagship.pharmacy_ledger.ledger.LedgerTransactionExecutor;
import com.flagship.pharmacy_ledger.ledger.Reference;
import com.flagship.pharmacy_ledger.ledger.ReferenceType;
import com.flagship.pharmacy_ledger.stock.BatchKey;
import com.flagship.pharmacy_ledger.stock.BatchMetadata;
import com.flagship.pharmacy_ledger.stock.ReceiptEvent;
import com.flagship.pharmacy_ledger.stock.StockLine;
import com.flagship.pharmacy_ledger.stock.StockMovementResult;
import com.flagship.pharmacy_ledger.stock.StockReconciliationService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Records supplier invoices. Each item becomes an IN movement for its batch; the invoice
 * number is the idempotency key.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SupplierInvoiceService {

    private final StockReconciliationService stockService;
    private final SupplierInvoiceRepository invoiceRepository;
    private final LedgerTransactionExecutor executor;
    private final LedgerProperties properties;

    public SupplierInvoiceEntity recordInvoice(RecordInvoiceRequest request) {
        List<StockLine> lines = new ArrayList<>();
        BigDecimal subtotal = BigDecimal.ZERO;
        for (InvoiceItemRequest item : request.getItems()) {
            BatchMetadata metadata = new BatchMetadata(item.getManufacturer(), item.getExpiryDate(),
                    item.getLocation(), item.getReorderLevel(), item.getSellingPrice());
            lines.add(StockLine.receipt(BatchKey.of(item.getMedicineName(), item.getBatchNumber()),
                    item.getQuantity(), item.getUnitPrice(), metadata));
            subtotal = subtotal.add(item.getUnitPrice().multiply(BigDecimal.valueOf(item.getQuantity())));
        }
        DocumentTotals totals = DocumentTotals.compute(request.getInvoiceNumber(), subtotal,
                request.getCgstAmount(), request.getSgstAmount(), request.getTotalAmount());

        Reference reference = Reference.of(ReferenceType.SUPPLIER_INVOICE, request.getInvoiceNumber());
        Instant receivedAt = request.getInvoiceDate().atStartOfDay(properties.getBusinessZone()).toInstant();
        ReceiptEvent event = ReceiptEvent.of(reference, receivedAt, lines, "Invoice from " + request.getSupplierName());

        return executor.execute("document.supplier-invoice", () -> {
            StockMovementResult result = stockService.applyReceipt(event);
            Map<Integer, UUID> entryIds = PosSaleService.entryIdsByLine(result.getEntries());

            SupplierInvoiceEntity invoice = SupplierInvoiceEntity.create(request.getInvoiceNumber(),
                    request.getInvoiceDate(), request.getSupplierName(), request.getSupplierGstin(),
                    request.getPoReference(), request.getPaymentTerms(), request.getPaymentStatus(), totals);
            int lineNumber = 1;
            for (InvoiceItemRequest item : request.getItems()) {
                invoice.addItem(SupplierInvoiceItemEntity.of(lineNumber, item.getMedicineName(),
                        item.getBatchNumber(), item.getManufacturer(), item.getExpiryDate(), item.getQuantity(),
                        item.getUnitPrice(), entryIds.get(lineNumber)));
                lineNumber++;
            }
            SupplierInvoiceEntity saved = invoiceRepository.save(invoice);

            log.info("Supplier invoice {} from {} recorded: {} item(s), total {}",
                    saved.getInvoiceNumber(), saved.getSupplierName(), saved.getItems().size(),
                    saved.getTotalAmount());
            return saved;
        });
    }

    @Transactional(readOnly = true)
    public SupplierInvoiceEntity getInvoice(String invoiceNumber) {
        return invoiceRepository.findByInvoiceNumber(invoiceNumber)
                .orElseThrow(() -> new ResourceNotFoundException("Invoice not found: " + invoiceNumber));
    }

    @Transactional
    public SupplierInvoiceEntity updatePaymentStatus(String invoiceNumber, PaymentStatus status) {
        SupplierInvoiceEntity invoice = getInvoice(invoiceNumber);
        PaymentStatus previous = invoice.getPaymentStatus();
        invoice.updatePaymentStatus(status);
        log.info("Invoice {} payment status {} -> {}", invoiceNumber, previous, status);
        return invoiceRepository.save(invoice);
    }
}
