package com.tradeerp.invoicing.dto;

import lombok.Data;

import java.math.BigDecimal;

@Data
public class StockAdjustmentRequest {
    private Long itemId;
    private BigDecimal quantity; // Signed
    private String reason;
}
