package com.flagship.pharmacy_ledger.stock;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

import java.time.LocalDate;

/**
 * Stock was sold from a batch past its expiry date. The sale stands.
 */
@Value
public class ExpiredBatchWarning {
    @JsonProperty("batch_key")
    String batchKey;

    @JsonProperty("expiry_date")
    LocalDate expiryDate;

    @JsonProperty("quantity_sold")
    long quantitySold;
}
