package com.tradeerp.invoicing.model;

public enum LedgerTransactionType {
    DEBIT,
    CREDIT
}
