package com.tradeerp.invoicing.service;

import com.tradeerp.invoicing.model.CounterpartyKind;

import java.math.BigDecimal;

/**
 * Plain snapshot of a customer or supplier, detached from persistence.
 */
public record CounterpartyProfile(
        Long id,
        CounterpartyKind kind,
        String name,
        boolean active,
        boolean nonFiler,
        Integer paymentTermsDays,
        BigDecimal creditLimit) {

    public String label() {
        return (kind == CounterpartyKind.CUSTOMER ? "Customer " : "Supplier ") + id;
    }
}
