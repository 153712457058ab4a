package com.flagship.pharmacy_ledger.document.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;

@Value
public class InvoiceItemRequest {

    @NotBlank(message = "Medicine name is required")
    @JsonProperty("medicine_name")
    String medicineName;

    @NotBlank(message = "Batch number is required")
    @JsonProperty("batch_number")
    String batchNumber;

    @JsonProperty("manufacturer")
    String manufacturer;

    @NotNull(message = "Expiry date is required")
    @JsonProperty("expiry_date")
    LocalDate expiryDate;

    @Min(value = 1, message = "Quantity must be at least 1")
    @JsonProperty("quantity")
    int quantity;

    @NotNull(message = "Unit price is required")
    @DecimalMin(value = "0.00", message = "Unit price cannot be negative")
    @JsonProperty("unit_price")
    BigDecimal unitPrice;

    @JsonProperty("selling_price")
    BigDecimal sellingPrice;

    @JsonProperty("location")
    String location;

    @Min(value = 0, message = "Reorder level cannot be negative")
    @JsonProperty("reorder_level")
    Integer reorderLevel;
}
