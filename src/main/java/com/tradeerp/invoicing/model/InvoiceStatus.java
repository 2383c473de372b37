package com.tradeerp.invoicing.model;

public enum InvoiceStatus {
    DRAFT,
    CONFIRMED,
    PARTIAL,
    PAID,
    CANCELLED
}
