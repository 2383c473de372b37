package com.tradeerp.invoicing.model;

/**
 * Invoice kinds and the stock/ledger direction each one implies.
 * Goods leaving the warehouse (sales, purchase returns) produce OUT movements;
 * goods arriving (purchases, sales returns) produce IN movements.
 */
public enum InvoiceType {
    SALES("SI", CounterpartyKind.CUSTOMER, MovementType.OUT, StockReferenceType.SALES_INVOICE),
    PURCHASE("PI", CounterpartyKind.SUPPLIER, MovementType.IN, StockReferenceType.PURCHASE_INVOICE),
    RETURN_SALES("SR", CounterpartyKind.CUSTOMER, MovementType.IN, StockReferenceType.SALES_INVOICE),
    RETURN_PURCHASE("PR", CounterpartyKind.SUPPLIER, MovementType.OUT, StockReferenceType.PURCHASE_INVOICE);

    private final String numberPrefix;
    private final CounterpartyKind counterpartyKind;
    private final MovementType stockDirection;
    private final StockReferenceType stockReferenceType;

    InvoiceType(String numberPrefix, CounterpartyKind counterpartyKind, MovementType stockDirection,
            StockReferenceType stockReferenceType) {
        this.numberPrefix = numberPrefix;
        this.counterpartyKind = counterpartyKind;
        this.stockDirection = stockDirection;
        this.stockReferenceType = stockReferenceType;
    }

    public String getNumberPrefix() {
        return numberPrefix;
    }

    public CounterpartyKind getCounterpartyKind() {
        return counterpartyKind;
    }

    public MovementType getStockDirection() {
        return stockDirection;
    }

    public StockReferenceType getStockReferenceType() {
        return stockReferenceType;
    }

    public boolean isGoodsOutward() {
        return stockDirection == MovementType.OUT;
    }
}
