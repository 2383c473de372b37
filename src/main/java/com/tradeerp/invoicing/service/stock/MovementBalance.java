package com.tradeerp.invoicing.service.stock;

import com.tradeerp.invoicing.model.StockMovement;

import java.math.BigDecimal;

/**
 * A movement together with the item's unclamped balance right after it.
 */
public record MovementBalance(StockMovement movement, BigDecimal runningBalance) {
}
