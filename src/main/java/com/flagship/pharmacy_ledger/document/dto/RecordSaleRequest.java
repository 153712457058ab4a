package com.flagship.pharmacy_ledger.document.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.pharmacy_ledger.document.PaymentMode;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

/**
 * A POS receipt as printed at the counter.
 */
@Value
public class RecordSaleRequest {

    @NotBlank(message = "Receipt number is required")
    @Size(max = 50, message = "Receipt number is at most 50 characters")
    @JsonProperty("receipt_number")
    String receiptNumber;

    @NotNull(message = "Sale date is required")
    @JsonProperty("sale_date")
    Instant saleDate;

    @JsonProperty("pharmacy_location")
    String pharmacyLocation;

    @JsonProperty("pharmacist_name")
    String pharmacistName;

    @JsonProperty("prescription_number")
    String prescriptionNumber;

    @JsonProperty("payment_mode")
    PaymentMode paymentMode;

    @DecimalMin(value = "0.00", message = "CGST cannot be negative")
    @JsonProperty("cgst_amount")
    BigDecimal cgstAmount;

    @DecimalMin(value = "0.00", message = "SGST cannot be negative")
    @JsonProperty("sgst_amount")
    BigDecimal sgstAmount;

    /** Optional; checked against the computed total when present. */
    @JsonProperty("total_amount")
    BigDecimal totalAmount;

    @NotEmpty(message = "A sale needs at least one item")
    @Valid
    @JsonProperty("items")
    List<SaleItemRequest> items;
}
