package com.flagship.pharmacy_ledger.document;

import com.flagship.pharmacy_ledger.document.dto.RecordSaleRequest;
import com.flagship.pharmacy_ledger.document.dto.SaleItemRequest;
import com.flagship.pharmacy_ledger.exception.ResourceNotFoundException;
import com.flagship.pharmacy_ledger.ledger.LedgerEntry;
import com.flagship.pharmacy_ledger.ledger.LedgerTransactionExecutor;
import com.flagship.pharmacy_ledger.ledger.Reference;
import com.flagship.pharmacy_ledger.ledger.ReferenceType;
import com.flagship.pharmacy_ledger.stock.BatchKey;
import com.flagship.pharmacy_ledger.stock.SaleEvent;
import com.flagship.pharmacy_ledger.stock.StockLine;
import com.flagship.pharmacy_ledger.stock.StockMovementResult;
import com.flagship.pharmacy_ledger.stock.StockReconciliationService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Records POS receipts.
 *
 * The receipt row, its items and the OUT movements commit together. The receipt number is
 * the idempotency key: a resubmitted receipt is rejected by the stock ledger before
 * anything is written.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PosSaleService {

    private final StockReconciliationService stockService;
    private final PosSaleRepository saleRepository;
    private final LedgerTransactionExecutor executor;

    public RecordedSale recordSale(RecordSaleRequest request) {
        List<StockLine> lines = new ArrayList<>();
        BigDecimal subtotal = BigDecimal.ZERO;
        for (SaleItemRequest item : request.getItems()) {
            lines.add(StockLine.sale(BatchKey.of(item.getMedicineName(), item.getBatchNumber()),
                    item.getQuantity(), item.getUnitPrice()));
            subtotal = subtotal.add(item.getUnitPrice().multiply(BigDecimal.valueOf(item.getQuantity())));
        }
        DocumentTotals totals = DocumentTotals.compute(request.getReceiptNumber(), subtotal,
                request.getCgstAmount(), request.getSgstAmount(), request.getTotalAmount());

        Reference reference = Reference.of(ReferenceType.POS, request.getReceiptNumber());
        SaleEvent event = SaleEvent.of(reference, request.getSaleDate(), lines, saleRemarks(request));

        return executor.execute("document.pos-sale", () -> {
            StockMovementResult result = stockService.applySale(event);
            Map<Integer, UUID> entryIds = entryIdsByLine(result.getEntries());

            PosSaleEntity sale = PosSaleEntity.create(request.getReceiptNumber(), request.getSaleDate(),
                    request.getPharmacyLocation(), request.getPharmacistName(), request.getPrescriptionNumber(),
                    request.getPaymentMode(), totals);
            int lineNumber = 1;
            for (SaleItemRequest item : request.getItems()) {
                sale.addItem(PosSaleItemEntity.of(lineNumber, item.getMedicineName(), item.getBatchNumber(),
                        item.getQuantity(), item.getUnitPrice(), entryIds.get(lineNumber)));
                lineNumber++;
            }
            PosSaleEntity saved = saleRepository.save(sale);

            log.info("POS receipt {} recorded: {} item(s), total {}",
                    saved.getReceiptNumber(), saved.getItems().size(), saved.getTotalAmount());
            return new RecordedSale(saved, result.getWarnings());
        });
    }

    @Transactional(readOnly = true)
    public PosSaleEntity getSale(String receiptNumber) {
        return saleRepository.findByReceiptNumber(receiptNumber)
                .orElseThrow(() -> new ResourceNotFoundException("Sale not found: " + receiptNumber));
    }

    @Transactional
    public PosSaleEntity updatePaymentStatus(String receiptNumber, PaymentStatus status) {
        PosSaleEntity sale = getSale(receiptNumber);
        PaymentStatus previous = sale.getPaymentStatus();
        sale.updatePaymentStatus(status);
        log.info("Sale {} payment status {} -> {}", receiptNumber, previous, status);
        return saleRepository.save(sale);
    }

    static Map<Integer, UUID> entryIdsByLine(List<LedgerEntry> entries) {
        return entries.stream().collect(Collectors.toMap(LedgerEntry::getLineNumber, LedgerEntry::getEntryId));
    }

    private static String saleRemarks(RecordSaleRequest request) {
        if (request.getPrescriptionNumber() == null || request.getPrescriptionNumber().isBlank()) {
            return "POS sale";
        }
        return "POS sale, prescription " + request.getPrescriptionNumber();
    }
}
