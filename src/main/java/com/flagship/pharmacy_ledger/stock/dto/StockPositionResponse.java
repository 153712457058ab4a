package com.flagship.pharmacy_ledger.stock.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.pharmacy_ledger.stock.StockPosition;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;

@Value
@Builder
public class StockPositionResponse {

    @JsonProperty("medicine_name")
    String medicineName;

    @JsonProperty("batch_number")
    String batchNumber;

    @JsonProperty("manufacturer")
    String manufacturer;

    @JsonProperty("expiry_date")
    LocalDate expiryDate;

    @JsonProperty("current_quantity")
    long currentQuantity;

    @JsonProperty("reorder_level")
    int reorderLevel;

    @JsonProperty("location")
    String location;

    @JsonProperty("cost_price")
    BigDecimal costPrice;

    @JsonProperty("selling_price")
    BigDecimal sellingPrice;

    @JsonProperty("below_reorder_level")
    boolean belowReorderLevel;

    public static StockPositionResponse from(StockPosition position) {
        return StockPositionResponse.builder()
            .medicineName(position.getBatch().getMedicineName())
            .batchNumber(position.getBatch().getBatchNumber())
            .manufacturer(position.getManufacturer())
            .expiryDate(position.getExpiryDate())
            .currentQuantity(position.getCurrentQuantity())
            .reorderLevel(position.getReorderLevel())
            .location(position.getLocation())
            .costPrice(position.getCostPrice())
            .sellingPrice(position.getSellingPrice())
            .belowReorderLevel(position.isBelowReorderLevel())
            .build();
    }
}
