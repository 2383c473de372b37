package com.tradeerp.invoicing.service.tax;

import java.math.BigDecimal;

/**
 * Unrounded per-line amounts. Only {@link TaxCalculationEngine} rounds, and only once.
 */
public record LineCalculation(
        BigDecimal gstRate,
        BigDecimal lineTotal,
        BigDecimal discount1,
        BigDecimal discount2,
        BigDecimal taxableAmount,
        BigDecimal gstAmount,
        BigDecimal advanceTaxAmount) {

    public BigDecimal netAmount() {
        return taxableAmount.add(gstAmount).add(advanceTaxAmount);
    }
}
