package com.flagship.pharmacy_ledger.document.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.pharmacy_ledger.document.PaymentStatus;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

/**
 * A supplier invoice for goods received.
 */
@Value
public class RecordInvoiceRequest {

    @NotBlank(message = "Invoice number is required")
    @Size(max = 50, message = "Invoice number is at most 50 characters")
    @JsonProperty("invoice_number")
    String invoiceNumber;

    @NotNull(message = "Invoice date is required")
    @JsonProperty("invoice_date")
    LocalDate invoiceDate;

    @NotBlank(message = "Supplier name is required")
    @JsonProperty("supplier_name")
    String supplierName;

    @JsonProperty("supplier_gstin")
    String supplierGstin;

    @JsonProperty("po_reference")
    String poReference;

    @JsonProperty("payment_terms")
    String paymentTerms;

    @JsonProperty("payment_status")
    PaymentStatus paymentStatus;

    @DecimalMin(value = "0.00", message = "CGST cannot be negative")
    @JsonProperty("cgst_amount")
    BigDecimal cgstAmount;

    @DecimalMin(value = "0.00", message = "SGST cannot be negative")
    @JsonProperty("sgst_amount")
    BigDecimal sgstAmount;

    @JsonProperty("total_amount")
    BigDecimal totalAmount;

    @NotEmpty(message = "An invoice needs at least one item")
    @Valid
    @JsonProperty("items")
    List<InvoiceItemRequest> items;
}
