package com.flagship.pharmacy_ledger.document;

import org.springframework.data.jpa.repository.EntityGraph;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface SupplierInvoiceRepository extends JpaRepository<SupplierInvoiceEntity, Long> {

    @EntityGraph(attributePaths = "items")
    Optional<SupplierInvoiceEntity> findByInvoiceNumber(String invoiceNumber);
}
