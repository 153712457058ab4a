package com.flagship.pharmacy_ledger.cash;

import com.flagship.pharmacy_ledger.ledger.Reference;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * One line of a bank statement as extracted upstream.
 *
 * {@code declaredBalance} is the running balance printed on the statement, when present.
 * {@code linkedReference} ties the line to a business document (supplier invoice, POS batch).
 */
@Value
public class StatementLine {
    String accountId;
    String tranId;
    Instant occurredAt;
    Direction direction;
    BigDecimal amount;
    String description;
    BigDecimal declaredBalance;
    Reference linkedReference;

    public static StatementLine of(String accountId, String tranId, Instant occurredAt, Direction direction,
                                   BigDecimal amount, String description, BigDecimal declaredBalance,
                                   Reference linkedReference) {
        if (accountId == null || accountId.isBlank()) {
            throw new IllegalArgumentException("Account id cannot be blank");
        }
        if (tranId == null || tranId.isBlank()) {
            throw new IllegalArgumentException("Transaction id cannot be blank");
        }
        if (occurredAt == null || direction == null) {
            throw new IllegalArgumentException("Occurrence time and direction are required");
        }
        if (amount == null || amount.signum() <= 0) {
            throw new IllegalArgumentException("Amount must be positive");
        }
        requireCents(amount, "Amount");
        if (declaredBalance != null) {
            requireCents(declaredBalance, "Declared balance");
        }
        if (description == null || description.isBlank()) {
            throw new IllegalArgumentException("Description cannot be blank");
        }
        return new StatementLine(accountId, tranId.trim(), occurredAt, direction, amount, description,
                declaredBalance, linkedReference);
    }

    /**
     * Statement amounts and balances are stored with two decimal places.
     */
    static void requireCents(BigDecimal value, String field) {
        if (value.stripTrailingZeros().scale() > 2) {
            throw new IllegalArgumentException(field + " has more than 2 decimal places: " + value.toPlainString());
        }
    }

    StatementLine withTranId(String newTranId) {
        return new StatementLine(accountId, newTranId, occurredAt, direction, amount, description,
                declaredBalance, linkedReference);
    }
}
