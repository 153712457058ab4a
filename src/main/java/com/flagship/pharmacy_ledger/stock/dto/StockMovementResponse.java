package com.flagship.pharmacy_ledger.stock.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.pharmacy_ledger.stock.ExpiredBatchWarning;
import com.flagship.pharmacy_ledger.stock.StockMovementResult;
import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

@Value
@Builder
public class StockMovementResponse {

    @JsonProperty("reference")
    String reference;

    @JsonProperty("entries")
    List<LedgerEntryResponse> entries;

    @JsonProperty("quantities_after")
    Map<String, Long> quantitiesAfter;

    @JsonProperty("warnings")
    List<ExpiredBatchWarning> warnings;

    public static StockMovementResponse from(StockMovementResult result) {
        return StockMovementResponse.builder()
            .reference(result.getReference().toString())
            .entries(result.getEntries().stream().map(LedgerEntryResponse::from).collect(Collectors.toList()))
            .quantitiesAfter(result.getQuantitiesAfter())
            .warnings(result.getWarnings())
            .build();
    }
}
