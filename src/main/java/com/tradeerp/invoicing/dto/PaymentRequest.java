package com.tradeerp.invoicing.dto;

import com.tradeerp.invoicing.model.PaymentMethod;
import lombok.Data;

import java.math.BigDecimal;

@Data
public class PaymentRequest {
    private BigDecimal amount; // Optional for full payment; must match the outstanding balance when given
    private PaymentMethod paymentMethod;
    private String referenceNumber;
    private String notes;
}
