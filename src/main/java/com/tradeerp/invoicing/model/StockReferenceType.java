package com.tradeerp.invoicing.model;

public enum StockReferenceType {
    SALES_INVOICE,
    PURCHASE_INVOICE,
    ADJUSTMENT,
    OPENING_BALANCE,
    TRANSFER
}
