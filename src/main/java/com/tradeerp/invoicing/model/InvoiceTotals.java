package com.tradeerp.invoicing.model;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import lombok.Data;

import java.math.BigDecimal;

@Embeddable
@Data
public class InvoiceTotals {

    @Column(precision = 19, scale = 2)
    private BigDecimal subtotal = BigDecimal.ZERO;

    @Column(name = "total_discount1", precision = 19, scale = 2)
    private BigDecimal totalDiscount1 = BigDecimal.ZERO;

    @Column(name = "total_discount2", precision = 19, scale = 2)
    private BigDecimal totalDiscount2 = BigDecimal.ZERO;

    @Column(precision = 19, scale = 2)
    private BigDecimal taxableTotal = BigDecimal.ZERO;

    @Column(precision = 19, scale = 2)
    private BigDecimal totalTax = BigDecimal.ZERO;

    @Column(name = "gst18_total", precision = 19, scale = 2)
    private BigDecimal gst18Total = BigDecimal.ZERO;

    @Column(name = "gst4_total", precision = 19, scale = 2)
    private BigDecimal gst4Total = BigDecimal.ZERO;

    @Column(precision = 19, scale = 2)
    private BigDecimal gstTotal = BigDecimal.ZERO;

    @Column(precision = 19, scale = 2)
    private BigDecimal advanceTaxTotal = BigDecimal.ZERO;

    @Column(name = "non_filer_gst_total", precision = 19, scale = 2)
    private BigDecimal nonFilerGSTTotal = BigDecimal.ZERO;

    @Column(precision = 19, scale = 2)
    private BigDecimal incomeTaxTotal = BigDecimal.ZERO;

    @Column(precision = 19, scale = 2)
    private BigDecimal grandTotal = BigDecimal.ZERO;

    @Column(precision = 19, scale = 2)
    private BigDecimal paidAmount = BigDecimal.ZERO;

    public BigDecimal outstanding() {
        return grandTotal.subtract(paidAmount);
    }
}
