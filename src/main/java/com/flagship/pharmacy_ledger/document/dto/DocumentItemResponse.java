package com.flagship.pharmacy_ledger.document.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.pharmacy_ledger.document.PosSaleItemEntity;
import com.flagship.pharmacy_ledger.document.SupplierInvoiceItemEntity;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.UUID;

@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class DocumentItemResponse {

    @JsonProperty("line_number")
    int lineNumber;

    @JsonProperty("medicine_name")
    String medicineName;

    @JsonProperty("batch_number")
    String batchNumber;

    @JsonProperty("manufacturer")
    String manufacturer;

    @JsonProperty("expiry_date")
    LocalDate expiryDate;

    @JsonProperty("quantity")
    int quantity;

    @JsonProperty("unit_price")
    BigDecimal unitPrice;

    @JsonProperty("total_price")
    BigDecimal totalPrice;

    @JsonProperty("ledger_entry_id")
    UUID ledgerEntryId;

    public static DocumentItemResponse from(PosSaleItemEntity item) {
        return DocumentItemResponse.builder()
            .lineNumber(item.getLineNumber())
            .medicineName(item.getMedicineName())
            .batchNumber(item.getBatchNumber())
            .quantity(item.getQuantity())
            .unitPrice(item.getUnitPrice())
            .totalPrice(item.getTotalPrice())
            .ledgerEntryId(item.getLedgerEntryId())
            .build();
    }

    public static DocumentItemResponse from(SupplierInvoiceItemEntity item) {
        return DocumentItemResponse.builder()
            .lineNumber(item.getLineNumber())
            .medicineName(item.getMedicineName())
            .batchNumber(item.getBatchNumber())
            .manufacturer(item.getManufacturer())
            .expiryDate(item.getExpiryDate())
            .quantity(item.getQuantity())
            .unitPrice(item.getUnitPrice())
            .totalPrice(item.getTotalPrice())
            .ledgerEntryId(item.getLedgerEntryId())
            .build();
    }
}
