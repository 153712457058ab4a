package com.flagship.pharmacy_ledger.cash.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Value;

@Value
public class ResolveFlaggedRequest {

    @NotNull(message = "Corrected line is required")
    @Valid
    @JsonProperty("corrected_line")
    StatementLineRequest correctedLine;

    @NotBlank(message = "Resolver is required")
    @JsonProperty("resolved_by")
    String resolvedBy;
}
