package com.flagship.pharmacy_ledger.report.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.pharmacy_ledger.cash.dto.BankEntryResponse;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

@Value
@Builder
public class BankReport {

    @JsonProperty("account_id")
    String accountId;

    @JsonProperty("account_name")
    String accountName;

    @JsonProperty("from")
    LocalDate from;

    @JsonProperty("to")
    LocalDate to;

    @JsonProperty("opening_balance")
    BigDecimal openingBalance;

    @JsonProperty("total_credits")
    BigDecimal totalCredits;

    @JsonProperty("total_debits")
    BigDecimal totalDebits;

    @JsonProperty("closing_balance")
    BigDecimal closingBalance;

    @JsonProperty("flagged_count")
    int flaggedCount;

    @JsonProperty("unapproved_count")
    int unapprovedCount;

    @JsonProperty("entries")
    List<BankEntryResponse> entries;

    @JsonProperty("generated_at")
    Instant generatedAt;
}
