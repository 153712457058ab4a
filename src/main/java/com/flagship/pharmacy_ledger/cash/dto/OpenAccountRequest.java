package com.flagship.pharmacy_ledger.cash.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.Digits;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;

@Value
public class OpenAccountRequest {

    @NotBlank(message = "Account id is required")
    @Size(max = 50, message = "Account id is at most 50 characters")
    @JsonProperty("account_id")
    String accountId;

    @NotBlank(message = "Account name is required")
    @JsonProperty("account_name")
    String accountName;

    @NotNull(message = "Opening balance is required")
    @Digits(integer = 13, fraction = 2, message = "Opening balance has at most 2 decimal places")
    @JsonProperty("opening_balance")
    BigDecimal openingBalance;

    @NotNull(message = "Opening time is required")
    @JsonProperty("opened_at")
    Instant openedAt;
}
