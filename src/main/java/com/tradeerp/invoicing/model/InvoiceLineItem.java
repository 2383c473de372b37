package com.tradeerp.invoicing.model;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import jakarta.persistence.Embedded;
import lombok.Data;

import java.math.BigDecimal;

/**
 * One billed line. Amount columns hold the values surfaced to callers, rounded once to 2 decimals;
 * invoice totals are computed from the unrounded line values, not from these columns.
 */
@Embeddable
@Data
public class InvoiceLineItem {

    @Column(name = "item_id", nullable = false)
    private Long itemId;

    // Magnitude only; direction comes from the invoice type
    @Column(nullable = false, precision = 19, scale = 3)
    private BigDecimal quantity;

    @Column(nullable = false, precision = 19, scale = 4)
    private BigDecimal unitPrice;

    @Column(precision = 7, scale = 3)
    private BigDecimal discount1Percent;

    @Column(precision = 19, scale = 2)
    private BigDecimal discount1Amount;

    // Set when the caller gave discount1Amount; otherwise the stored amount is derived from the percentage
    private boolean discount1Explicit;

    @Column(precision = 7, scale = 3)
    private BigDecimal discount2Percent;

    @Column(precision = 19, scale = 2)
    private BigDecimal discount2Amount;

    private boolean discount2Explicit;

    @Column(precision = 7, scale = 3)
    private BigDecimal gstRate;

    @Column(precision = 19, scale = 2)
    private BigDecimal gstAmount;

    @Column(precision = 7, scale = 3)
    private BigDecimal advanceTaxPercent;

    @Column(precision = 19, scale = 2)
    private BigDecimal advanceTaxAmount;

    @Column(precision = 19, scale = 3)
    private BigDecimal scheme1Quantity;

    @Column(precision = 19, scale = 3)
    private BigDecimal scheme2Quantity;

    @Embedded
    private BatchInfo batchInfo;

    @Column(precision = 19, scale = 2)
    private BigDecimal taxableAmount;

    // quantity * unitPrice, before discounts and tax
    @Column(precision = 19, scale = 2)
    private BigDecimal lineTotal;

    // taxableAmount + gst + advance tax
    @Column(precision = 19, scale = 2)
    private BigDecimal netAmount;
}
