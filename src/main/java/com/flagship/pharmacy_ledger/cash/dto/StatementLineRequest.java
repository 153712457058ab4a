package com.flagship.pharmacy_ledger.cash.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.pharmacy_ledger.cash.Direction;
import com.flagship.pharmacy_ledger.cash.StatementLine;
import com.flagship.pharmacy_ledger.ledger.Reference;
import com.flagship.pharmacy_ledger.ledger.ReferenceType;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Digits;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * One bank statement line, as posted over HTTP or carried by an intake envelope.
 */
@Value
public class StatementLineRequest {

    @NotBlank(message = "Account id is required")
    @JsonProperty("account_id")
    String accountId;

    @NotBlank(message = "Transaction id is required")
    @Size(max = 50, message = "Transaction id is at most 50 characters")
    @JsonProperty("tran_id")
    String tranId;

    @NotNull(message = "Transaction time is required")
    @JsonProperty("occurred_at")
    Instant occurredAt;

    @NotNull(message = "Direction is required")
    @JsonProperty("direction")
    Direction direction;

    @NotNull(message = "Amount is required")
    @DecimalMin(value = "0.01", message = "Amount must be greater than 0")
    @Digits(integer = 13, fraction = 2, message = "Amount has at most 2 decimal places")
    @JsonProperty("amount")
    BigDecimal amount;

    @NotBlank(message = "Description is required")
    @JsonProperty("description")
    String description;

    @Digits(integer = 13, fraction = 2, message = "Declared balance has at most 2 decimal places")
    @JsonProperty("declared_balance")
    BigDecimal declaredBalance;

    @JsonProperty("linked_reference_type")
    ReferenceType linkedReferenceType;

    @JsonProperty("linked_reference_id")
    String linkedReferenceId;

    public StatementLine toStatementLine() {
        Reference linked = linkedReferenceType == null || linkedReferenceId == null
            ? null
            : Reference.of(linkedReferenceType, linkedReferenceId);
        return StatementLine.of(accountId, tranId, occurredAt, direction, amount, description,
            declaredBalance, linked);
    }
}
