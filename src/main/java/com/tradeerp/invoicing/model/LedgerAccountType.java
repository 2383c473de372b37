package com.tradeerp.invoicing.model;

public enum LedgerAccountType {
    CUSTOMER,
    SUPPLIER,
    ACCOUNT
}
