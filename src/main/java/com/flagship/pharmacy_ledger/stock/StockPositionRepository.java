package com.flagship.pharmacy_ledger.stock;

import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

@Repository
public interface StockPositionRepository extends JpaRepository<StockPositionEntity, Long> {

    Optional<StockPositionEntity> findByEntityKey(String entityKey);

    List<StockPositionEntity> findByEntityKeyIn(Iterable<String> entityKeys);

    /**
     * Keyset page over all positions, in id order.
     */
    List<StockPositionEntity> findByIdGreaterThanOrderByIdAsc(Long afterId, Pageable page);

    List<StockPositionEntity> findByExpiryDateBetweenOrderByExpiryDateAsc(LocalDate from, LocalDate to);

    List<StockPositionEntity> findByMedicineNameOrderByExpiryDateAsc(String medicineName);
}
