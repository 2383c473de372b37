package com.tradeerp.invoicing.dto;

import lombok.Data;

import java.math.BigDecimal;

@Data
public class StockCorrectionRequest {
    private Long itemId;
    private BigDecimal actualStock; // Physically counted
    private String reason;
}
