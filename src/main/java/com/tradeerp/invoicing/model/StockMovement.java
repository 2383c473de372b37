package com.tradeerp.invoicing.model;

import jakarta.persistence.*;
import lombok.Data;
import org.hibernate.annotations.Immutable;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * Append-only stock ledger row. Never updated or deleted; a cancellation appends a reversal
 * that points at the row it negates through {@code reversalOfId}.
 */
@Entity
@Immutable
@Table(name = "stock_movements", indexes = {
        @Index(name = "idx_movement_item_date", columnList = "itemId, movementDate"),
        @Index(name = "idx_movement_reference", columnList = "referenceType, referenceId"),
        @Index(name = "idx_movement_expiry", columnList = "expiry_date")
})
@Data
public class StockMovement {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private Long itemId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private MovementType movementType;

    // Signed: positive for IN, negative for OUT
    @Column(nullable = false, precision = 19, scale = 3)
    private BigDecimal quantity;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private StockReferenceType referenceType;

    private Long referenceId;

    @Embedded
    private BatchInfo batchInfo;

    @Column(nullable = false)
    private LocalDateTime movementDate;

    @Column(length = 500)
    private String notes;

    private Long reversalOfId;

    @Column(nullable = false)
    private String createdBy;

    // Stamped by the ledger from the application clock
    @Column(updatable = false)
    private LocalDateTime createdAt;
}
