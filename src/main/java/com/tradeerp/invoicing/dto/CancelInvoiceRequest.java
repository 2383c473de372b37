package com.tradeerp.invoicing.dto;

import lombok.Data;

@Data
public class CancelInvoiceRequest {
    private String reason;
}
