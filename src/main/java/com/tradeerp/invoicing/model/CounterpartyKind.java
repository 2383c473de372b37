package com.tradeerp.invoicing.model;

public enum CounterpartyKind {
    CUSTOMER,
    SUPPLIER
}
