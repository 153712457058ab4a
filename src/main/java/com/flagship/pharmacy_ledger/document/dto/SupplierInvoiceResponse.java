package com.flagship.pharmacy_ledger.document.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.pharmacy_ledger.document.PaymentStatus;
import com.flagship.pharmacy_ledger.document.SupplierInvoiceEntity;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.stream.Collectors;

@Value
@Builder
public class SupplierInvoiceResponse {

    @JsonProperty("invoice_number")
    String invoiceNumber;

    @JsonProperty("invoice_date")
    LocalDate invoiceDate;

    @JsonProperty("supplier_name")
    String supplierName;

    @JsonProperty("supplier_gstin")
    String supplierGstin;

    @JsonProperty("po_reference")
    String poReference;

    @JsonProperty("subtotal")
    BigDecimal subtotal;

    @JsonProperty("cgst_amount")
    BigDecimal cgstAmount;

    @JsonProperty("sgst_amount")
    BigDecimal sgstAmount;

    @JsonProperty("total_amount")
    BigDecimal totalAmount;

    @JsonProperty("payment_terms")
    String paymentTerms;

    @JsonProperty("payment_status")
    PaymentStatus paymentStatus;

    @JsonProperty("items")
    List<DocumentItemResponse> items;

    @JsonProperty("created_at")
    Instant createdAt;

    public static SupplierInvoiceResponse from(SupplierInvoiceEntity invoice) {
        return SupplierInvoiceResponse.builder()
            .invoiceNumber(invoice.getInvoiceNumber())
            .invoiceDate(invoice.getInvoiceDate())
            .supplierName(invoice.getSupplierName())
            .supplierGstin(invoice.getSupplierGstin())
            .poReference(invoice.getPoReference())
            .subtotal(invoice.getSubtotal())
            .cgstAmount(invoice.getCgstAmount())
            .sgstAmount(invoice.getSgstAmount())
            .totalAmount(invoice.getTotalAmount())
            .paymentTerms(invoice.getPaymentTerms())
            .paymentStatus(invoice.getPaymentStatus())
            .items(invoice.getItems().stream().map(DocumentItemResponse::from).collect(Collectors.toList()))
            .createdAt(invoice.getCreatedAt())
            .build();
    }
}
