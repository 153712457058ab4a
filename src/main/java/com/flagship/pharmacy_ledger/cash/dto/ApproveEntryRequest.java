package com.flagship.pharmacy_ledger.cash.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import lombok.Value;

@Value
public class ApproveEntryRequest {

    @NotBlank(message = "Approver is required")
    @JsonProperty("approved_by")
    String approvedBy;
}
