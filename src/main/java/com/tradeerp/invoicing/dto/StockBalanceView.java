package com.tradeerp.invoicing.dto;

import java.math.BigDecimal;
import java.time.LocalDateTime;

public record StockBalanceView(
        Long itemId,
        LocalDateTime asOf,
        BigDecimal balance,
        boolean clamped,
        BigDecimal currentStock) {
}
