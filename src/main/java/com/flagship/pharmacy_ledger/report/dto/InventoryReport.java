package com.flagship.pharmacy_ledger.report.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.pharmacy_ledger.report.InventoryFilter;
import com.flagship.pharmacy_ledger.stock.dto.StockPositionResponse;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

@Value
@Builder
public class InventoryReport {

    @JsonProperty("filter")
    InventoryFilter filter;

    @JsonProperty("business_date")
    LocalDate businessDate;

    @JsonProperty("batch_count")
    int batchCount;

    @JsonProperty("total_units")
    long totalUnits;

    /** Units times weighted average cost, over batches with a known cost. */
    @JsonProperty("stock_value")
    BigDecimal stockValue;

    @JsonProperty("expired_batches")
    int expiredBatches;

    @JsonProperty("positions")
    List<StockPositionResponse> positions;

    @JsonProperty("generated_at")
    Instant generatedAt;
}
