package com.flagship.pharmacy_ledger.stock.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.pharmacy_ledger.ledger.ReferenceType;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * Request DTO for receiving a single batch line outside a supplier invoice.
 */
@Value
public class ReceiveStockRequest {

    @NotBlank(message = "Medicine name is required")
    @JsonProperty("medicine_name")
    String medicineName;

    @NotBlank(message = "Batch number is required")
    @JsonProperty("batch_number")
    String batchNumber;

    @Min(value = 1, message = "Quantity must be at least 1")
    @JsonProperty("quantity")
    long quantity;

    @NotNull(message = "Unit cost is required")
    @DecimalMin(value = "0.00", message = "Unit cost cannot be negative")
    @JsonProperty("unit_cost")
    BigDecimal unitCost;

    @NotNull(message = "Reference type is required")
    @JsonProperty("reference_type")
    ReferenceType referenceType;

    /** Null for a manual receipt, which is never deduplicated. */
    @JsonProperty("reference_id")
    String referenceId;

    @JsonProperty("manufacturer")
    String manufacturer;

    @NotNull(message = "Expiry date is required")
    @JsonProperty("expiry_date")
    LocalDate expiryDate;

    @JsonProperty("location")
    String location;

    @Min(value = 0, message = "Reorder level cannot be negative")
    @JsonProperty("reorder_level")
    Integer reorderLevel;

    @JsonProperty("selling_price")
    BigDecimal sellingPrice;
}
