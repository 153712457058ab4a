package com.flagship.pharmacy_ledger.stock;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.time.LocalDate;

/**
 * Descriptive record of a batch.
 *
 * Holds no quantity: the quantity of a batch is always folded from the ledger.
 * Created on the first receipt and never deleted. Identity, manufacturer and expiry are
 * fixed once created.
 */
@Entity
@Table(name = "stock_positions")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class StockPositionEntity {

    private static final int COST_SCALE = 4;

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "entity_key", nullable = false, updatable = false, unique = true, length = 300)
    private String entityKey;

    @Column(name = "medicine_name", nullable = false, updatable = false, length = 200)
    private String medicineName;

    @Column(name = "batch_number", nullable = false, updatable = false, length = 50)
    private String batchNumber;

    @Column(name = "manufacturer", updatable = false, length = 100)
    private String manufacturer;

    @Column(name = "expiry_date", nullable = false, updatable = false)
    private LocalDate expiryDate;

    @Column(name = "reorder_level", nullable = false)
    private int reorderLevel;

    @Column(name = "location", length = 50)
    private String location;

    @Column(name = "cost_price", precision = 12, scale = 4)
    private BigDecimal costPrice;

    @Column(name = "selling_price", precision = 12, scale = 2)
    private BigDecimal sellingPrice;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @PrePersist
    void onCreate() {
        this.createdAt = Instant.now();
        this.updatedAt = this.createdAt;
    }

    @PreUpdate
    void onUpdate() {
        this.updatedAt = Instant.now();
    }

    static StockPositionEntity create(BatchKey batch, BatchMetadata metadata, int defaultReorderLevel) {
        StockPositionEntity entity = new StockPositionEntity();
        entity.entityKey = batch.entityKey();
        entity.medicineName = batch.getMedicineName();
        entity.batchNumber = batch.getBatchNumber();
        entity.manufacturer = metadata.getManufacturer();
        entity.expiryDate = metadata.getExpiryDate();
        entity.reorderLevel = metadata.getReorderLevel() != null ? metadata.getReorderLevel() : defaultReorderLevel;
        entity.location = metadata.getLocation();
        entity.sellingPrice = metadata.getSellingPrice();
        return entity;
    }

    /**
     * Folds a receipt into the weighted average cost.
     *
     * @param quantityBefore units on hand before the receipt
     */
    void applyReceiptCost(long quantityBefore, long received, BigDecimal unitCost) {
        if (unitCost == null) {
            return;
        }
        if (costPrice == null || quantityBefore <= 0) {
            this.costPrice = unitCost.setScale(COST_SCALE, RoundingMode.HALF_UP);
            return;
        }
        BigDecimal totalValue = costPrice.multiply(BigDecimal.valueOf(quantityBefore))
                .add(unitCost.multiply(BigDecimal.valueOf(received)));
        this.costPrice = totalValue.divide(BigDecimal.valueOf(quantityBefore + received), COST_SCALE,
                RoundingMode.HALF_UP);
    }

    void refresh(BatchMetadata metadata) {
        if (metadata.getSellingPrice() != null) {
            this.sellingPrice = metadata.getSellingPrice();
        }
        if (metadata.getLocation() != null) {
            this.location = metadata.getLocation();
        }
        if (metadata.getReorderLevel() != null) {
            this.reorderLevel = metadata.getReorderLevel();
        }
    }

    public BatchKey batchKey() {
        return BatchKey.of(medicineName, batchNumber);
    }

    StockPosition toPosition(long currentQuantity) {
        return new StockPosition(batchKey(), manufacturer, expiryDate, currentQuantity, reorderLevel,
                location, costPrice, sellingPrice);
    }
}
