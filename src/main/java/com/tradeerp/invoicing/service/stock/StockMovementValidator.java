package com.tradeerp.invoicing.service.stock;

import com.tradeerp.invoicing.exception.ValidationException;
import com.tradeerp.invoicing.model.BatchInfo;
import com.tradeerp.invoicing.model.MovementType;
import com.tradeerp.invoicing.model.StockMovement;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * Rules every stock movement must satisfy before it is written. Invoked explicitly by the ledger.
 */
@Component
public class StockMovementValidator {

    public static final int MAX_BATCH_NUMBER_LENGTH = 50;
    public static final int MAX_NOTES_LENGTH = 500;

    public void validate(StockMovement movement, LocalDateTime now) {
        if (movement.getItemId() == null) {
            throw new ValidationException("Item is required", "itemId");
        }
        if (movement.getMovementType() == null) {
            throw new ValidationException("Movement type is required", "movementType");
        }
        if (movement.getReferenceType() == null) {
            throw new ValidationException("Reference type is required", "referenceType");
        }
        validateSign(movement.getMovementType(), movement.getQuantity());

        if (movement.getMovementDate() == null) {
            throw new ValidationException("Movement date is required", "movementDate");
        }
        if (movement.getMovementDate().isAfter(now)) {
            throw new ValidationException("Movement date cannot be in the future", "movementDate");
        }
        if (movement.getNotes() != null && movement.getNotes().length() > MAX_NOTES_LENGTH) {
            throw new ValidationException("Notes cannot exceed " + MAX_NOTES_LENGTH + " characters", "notes");
        }
        validateBatch(movement.getBatchInfo());
    }

    public void validateSign(MovementType type, BigDecimal quantity) {
        if (quantity == null || quantity.signum() == 0) {
            throw new ValidationException("Movement quantity cannot be zero", "quantity");
        }
        if (type == MovementType.IN && quantity.signum() < 0) {
            throw new ValidationException("Stock IN quantity must be positive", "quantity");
        }
        if (type == MovementType.OUT && quantity.signum() > 0) {
            throw new ValidationException("Stock OUT quantity must be negative", "quantity");
        }
    }

    public void validateBatch(BatchInfo batch) {
        if (batch == null) {
            return;
        }
        if (batch.getBatchNumber() != null && batch.getBatchNumber().length() > MAX_BATCH_NUMBER_LENGTH) {
            throw new ValidationException("Batch number cannot exceed " + MAX_BATCH_NUMBER_LENGTH + " characters",
                    "batchNumber");
        }
        if (batch.getManufacturingDate() != null && batch.getExpiryDate() != null
                && batch.getManufacturingDate().isAfter(batch.getExpiryDate())) {
            throw new ValidationException("Manufacturing date cannot be after expiry date", "expiryDate");
        }
    }
}
