package com.flagship.pharmacy_ledger.cash;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * A bank account the pharmacy reconciles. Immutable once opened.
 */
@Entity
@Table(name = "bank_accounts")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class BankAccountEntity {

    @Id
    @Column(name = "account_id", nullable = false, updatable = false, length = 50)
    private String accountId;

    @Column(name = "account_name", nullable = false, updatable = false, length = 200)
    private String accountName;

    @Column(name = "opening_balance", nullable = false, updatable = false, precision = 15, scale = 2)
    private BigDecimal openingBalance;

    @Column(name = "opened_at", nullable = false, updatable = false)
    private Instant openedAt;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @PrePersist
    void onCreate() {
        this.createdAt = Instant.now();
    }

    static BankAccountEntity open(String accountId, String accountName, BigDecimal openingBalance, Instant openedAt) {
        BankAccountEntity entity = new BankAccountEntity();
        entity.accountId = accountId;
        entity.accountName = accountName;
        entity.openingBalance = openingBalance;
        entity.openedAt = openedAt;
        return entity;
    }
}
