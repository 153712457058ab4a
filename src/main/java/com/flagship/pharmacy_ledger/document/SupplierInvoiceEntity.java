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
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * A recorded supplier invoice. Immutable except for its payment status.
 */
@Entity
@Table(name = "supplier_invoices")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class SupplierInvoiceEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "invoice_id")
    private Long invoiceId;

    @Column(name = "invoice_number", nullable = false, updatable = false, unique = true, length = 50)
    private String invoiceNumber;

    @Column(name = "invoice_date", nullable = false, updatable = false)
    private LocalDate invoiceDate;

    @Column(name = "supplier_name", nullable = false, updatable = false, length = 200)
    private String supplierName;

    @Column(name = "supplier_gstin", updatable = false, length = 20)
    private String supplierGstin;

    @Column(name = "po_reference", updatable = false, length = 50)
    private String poReference;

    @Column(name = "subtotal", nullable = false, updatable = false, precision = 12, scale = 2)
    private BigDecimal subtotal;

    @Column(name = "cgst_amount", nullable = false, updatable = false, precision = 10, scale = 2)
    private BigDecimal cgstAmount;

    @Column(name = "sgst_amount", nullable = false, updatable = false, precision = 10, scale = 2)
    private BigDecimal sgstAmount;

    @Column(name = "total_amount", nullable = false, updatable = false, precision = 12, scale = 2)
    private BigDecimal totalAmount;

    @Column(name = "payment_terms", updatable = false, length = 100)
    private String paymentTerms;

    @Enumerated(EnumType.STRING)
    @Column(name = "payment_status", nullable = false, length = 20)
    private PaymentStatus paymentStatus;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @OneToMany(mappedBy = "invoice", cascade = CascadeType.ALL)
    @OrderBy("lineNumber ASC")
    private List<SupplierInvoiceItemEntity> items = new ArrayList<>();

    @PrePersist
    void onCreate() {
        this.createdAt = Instant.now();
        this.updatedAt = this.createdAt;
    }

    @PreUpdate
    void onUpdate() {
        this.updatedAt = Instant.now();
    }

    static SupplierInvoiceEntity create(String invoiceNumber, LocalDate invoiceDate, String supplierName,
                                        String supplierGstin, String poReference, String paymentTerms,
                                        PaymentStatus paymentStatus, DocumentTotals totals) {
        SupplierInvoiceEntity invoice = new SupplierInvoiceEntity();
        invoice.invoiceNumber = invoiceNumber;
        invoice.invoiceDate = invoiceDate;
        invoice.supplierName = supplierName;
        invoice.supplierGstin = supplierGstin;
        invoice.poReference = poReference;
        invoice.paymentTerms = paymentTerms;
        invoice.paymentStatus = paymentStatus == null ? PaymentStatus.PENDING : paymentStatus;
        invoice.subtotal = totals.getSubtotal();
        invoice.cgstAmount = totals.getCgstAmount();
        invoice.sgstAmount = totals.getSgstAmount();
        invoice.totalAmount = totals.getTotalAmount();
        return invoice;
    }

    void addItem(SupplierInvoiceItemEntity item) {
        item.attachTo(this);
        items.add(item);
    }

    void updatePaymentStatus(PaymentStatus target) {
        if (!paymentStatus.canTransitionTo(target)) {
            throw new IllegalStateException(String.format(
                    "Invoice %s cannot move from %s to %s", invoiceNumber, paymentStatus, target));
        }
        this.paymentStatus = target;
    }
}
