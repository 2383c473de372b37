package com.tradeerp.invoicing.repository;

import com.tradeerp.invoicing.model.StockMovement;
import com.tradeerp.invoicing.model.StockReferenceType;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.Repository;
import org.springframework.data.repository.query.Param;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

/**
 * Append-only: exposes save and reads, no update or delete.
 */
public interface StockMovementRepository extends Repository<StockMovement, Long> {
    StockMovement save(StockMovement movement);

    Optional<StockMovement> findById(Long id);

    long count();

    List<StockMovement> findByReferenceTypeAndReferenceIdOrderByIdAsc(StockReferenceType referenceType,
            Long referenceId);

    List<StockMovement> findByItemIdAndMovementDateLessThanEqual(Long itemId, LocalDateTime asOf);

    List<StockMovement> findByItemIdAndMovementDateLessThan(Long itemId, LocalDateTime before);

    List<StockMovement> findByItemIdAndMovementDateBetween(Long itemId, LocalDateTime from, LocalDateTime to);

    @Query("SELECT m FROM StockMovement m WHERE m.batchInfo.expiryDate IS NOT NULL "
            + "AND m.batchInfo.expiryDate < :asOf AND m.quantity > 0 ORDER BY m.batchInfo.expiryDate ASC, m.id ASC")
    List<StockMovement> findInwardMovementsExpiredBefore(@Param("asOf") LocalDate asOf);
}
