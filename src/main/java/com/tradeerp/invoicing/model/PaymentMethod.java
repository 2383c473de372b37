package com.tradeerp.invoicing.model;

public enum PaymentMethod {
    CASH,
    BANK_TRANSFER,
    CHEQUE,
    CARD
}
