package com.flagship.pharmacy_ledger.document;

import org.springframework.data.jpa.repository.EntityGraph;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface PosSaleRepository extends JpaRepository<PosSaleEntity, Long> {

    @EntityGraph(attributePaths = "items")
    Optional<PosSaleEntity> findByReceiptNumber(String receiptNumber);
}
