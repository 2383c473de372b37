package com.tradeerp.invoicing.model;

public enum PaymentStatus {
    PENDING,
    PARTIAL,
    PAID
}
