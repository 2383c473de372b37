package com.tradeerp.invoicing.dto;

import com.tradeerp.invoicing.model.MovementType;
import com.tradeerp.invoicing.model.StockReferenceType;
import com.tradeerp.invoicing.service.stock.MovementBalance;

import java.math.BigDecimal;
import java.time.LocalDateTime;

public record MovementHistoryRow(
        Long movementId,
        LocalDateTime movementDate,
        MovementType movementType,
        BigDecimal quantity,
        StockReferenceType referenceType,
        Long referenceId,
        String batchNumber,
        BigDecimal runningBalance) {

    public static MovementHistoryRow from(MovementBalance entry) {
        var m = entry.movement();
        return new MovementHistoryRow(m.getId(), m.getMovementDate(), m.getMovementType(), m.getQuantity(),
                m.getReferenceType(), m.getReferenceId(),
                m.getBatchInfo() != null ? m.getBatchInfo().getBatchNumber() : null,
                entry.runningBalance());
    }
}
