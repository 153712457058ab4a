package com.flagship.pharmacy_ledger.stock.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import lombok.Value;

@Value
public class AdjustStockRequest {

    @NotBlank(message = "Medicine name is required")
    @JsonProperty("medicine_name")
    String medicineName;

    @NotBlank(message = "Batch number is required")
    @JsonProperty("batch_number")
    String batchNumber;

    /** Signed change, e.g. -2 for two damaged strips. */
    @JsonProperty("delta")
    long delta;

    @NotBlank(message = "Reason is required")
    @JsonProperty("reason")
    String reason;

    @JsonProperty("recount_reference")
    String recountReference;
}
