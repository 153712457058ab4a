package com.flagship.pharmacy_ledger.document;

import jakarta.persistence.CascadeType;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.OneToMany;
import jakarta.persistence.OrderBy;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * A recorded POS receipt. Immutable except for its payment status.
 */
@Entity
@Table(name = "pos_sales")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class PosSaleEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "sale_id")
    private Long saleId;

    @Column(name = "receipt_number", nullable = false, updatable = false, unique = true, length = 50)
    private String receiptNumber;

    @Column(name = "sale_date", nullable = false, updatable = false)
    private Instant saleDate;

    @Column(name = "pharmacy_location", updatable = false, length = 100)
    private String pharmacyLocation;

    @Column(name = "pharmacist_name", updatable = false, length = 100)
    private String pharmacistName;

    @Column(name = "prescription_number", updatable = false, length = 50)
    private String prescriptionNumber;

    @Column(name = "subtotal", nullable = false, updatable = false, precision = 12, scale = 2)
    private BigDecimal subtotal;

    @Column(name = "cgst_amount", nullable = false, updatable = false, precision = 10, scale = 2)
    private BigDecimal cgstAmount;

    @Column(name = "sgst_amount", nullable = false, updatable = false, precision = 10, scale = 2)
    private BigDecimal sgstAmount;

    @Column(name = "total_amount", nullable = false, updatable = false, precision = 12, scale = 2)
    private BigDecimal totalAmount;

    @Enumerated(EnumType.STRING)
    @Column(name = "payment_mode", updatable = false, length = 20)
    private PaymentMode paymentMode;

    @Enumerated(EnumType.STRING)
    @Column(name = "payment_status", nullable = false, length = 20)
    private PaymentStatus paymentStatus;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @OneToMany(mappedBy = "sale", cascade = CascadeType.ALL, orphanRemoval = false)
    @OrderBy("lineNumber ASC")
    private List<PosSaleItemEntity> items = new ArrayList<>();

    @PrePersist
    void onCreate() {
        this.createdAt = Instant.now();
        this.updatedAt = this.createdAt;
    }

    @PreUpdate
    void onUpdate() {
        this.updatedAt = Instant.now();
    }

    static PosSaleEntity create(String receiptNumber, Instant saleDate, String pharmacyLocation,
                                String pharmacistName, String prescriptionNumber, PaymentMode paymentMode,
                                DocumentTotals totals) {
        PosSaleEntity sale = new PosSaleEntity();
        sale.receiptNumber = receiptNumber;
        sale.saleDate = saleDate;
        sale.pharmacyLocation = pharmacyLocation;
        sale.pharmacistName = pharmacistName;
        sale.prescriptionNumber = prescriptionNumber;
        sale.paymentMode = paymentMode;
        sale.subtotal = totals.getSubtotal();
        sale.cgstAmount = totals.getCgstAmount();
        sale.sgstAmount = totals.getSgstAmount();
        sale.totalAmount = totals.getTotalAmount();
        // counter sales are settled on the spot
        sale.paymentStatus = PaymentStatus.PAID;
        return sale;
    }

    void addItem(PosSaleItemEntity item) {
        item.attachTo(this);
        items.add(item);
    }

    void updatePaymentStatus(PaymentStatus target) {
        if (!paymentStatus.canTransitionTo(target)) {
            throw new IllegalStateException(String.format(
                    "Sale %s cannot move from %s to %s", receiptNumber, paymentStatus, target));
        }
        this.paymentStatus = target;
    }
}
