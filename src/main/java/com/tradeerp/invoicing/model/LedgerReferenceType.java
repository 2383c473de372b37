package com.tradeerp.invoicing.model;

public enum LedgerReferenceType {
    INVOICE,
    PAYMENT,
    ADJUSTMENT
}
