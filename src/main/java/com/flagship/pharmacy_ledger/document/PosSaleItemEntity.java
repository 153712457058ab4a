package com.flagship.pharmacy_ledger.document;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.FetchType;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.UUID;

@Entity
@Table(name = "pos_sale_items")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class PosSaleItemEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "item_id")
    private Long itemId;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "sale_id", nullable = false, updatable = false)
    private PosSaleEntity sale;

    @Column(name = "line_number", nullable = false, updatable = false)
    private int lineNumber;

    @Column(name = "medicine_name", nullable = false, updatable = false, length = 200)
    private String medicineName;

    @Column(name = "batch_number", nullable = false, updatable = false, length = 50)
    private String batchNumber;

    @Column(name = "quantity", nullable = false, updatable = false)
    private int quantity;

    @Column(name = "unit_price", nullable = false, updatable = false, precision = 10, scale = 2)
    private BigDecimal unitPrice;

    @Column(name = "total_price", nullable = false, updatable = false, precision = 12, scale = 2)
    private BigDecimal totalPrice;

    @Column(name = "ledger_entry_id", nullable = false, updatable = false)
    private UUID ledgerEntryId;

    static PosSaleItemEntity of(int lineNumber, String medicineName, String batchNumber, int quantity,
                                BigDecimal unitPrice, UUID ledgerEntryId) {
        PosSaleItemEntity item = new PosSaleItemEntity();
        item.lineNumber = lineNumber;
        item.medicineName = medicineName;
        item.batchNumber = batchNumber;
        item.quantity = quantity;
        item.unitPrice = unitPrice;
        item.totalPrice = unitPrice.multiply(BigDecimal.valueOf(quantity));
        item.ledgerEntryId = ledgerEntryId;
        return item;
    }

    void attachTo(PosSaleEntity sale) {
        this.sale = sale;
    }
}
