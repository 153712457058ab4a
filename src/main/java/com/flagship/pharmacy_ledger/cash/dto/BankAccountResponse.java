package com.flagship.pharmacy_ledger.cash.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.pharmacy_ledger.cash.BankAccountEntity;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;

@Value
@Builder
public class BankAccountResponse {

    @JsonProperty("account_id")
    String accountId;

    @JsonProperty("account_name")
    String accountName;

    @JsonProperty("opening_balance")
    BigDecimal openingBalance;

    @JsonProperty("opened_at")
    Instant openedAt;

    @JsonProperty("current_balance")
    BigDecimal currentBalance;

    public static BankAccountResponse from(BankAccountEntity account, BigDecimal currentBalance) {
        return BankAccountResponse.builder()
            .accountId(account.getAccountId())
            .accountName(account.getAccountName())
            .openingBalance(account.getOpeningBalance())
            .openedAt(account.getOpenedAt())
            .currentBalance(currentBalance)
            .build();
    }
}
