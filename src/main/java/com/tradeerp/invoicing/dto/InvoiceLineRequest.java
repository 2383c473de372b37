package com.tradeerp.invoicing.dto;

import com.tradeerp.invoicing.model.BatchInfo;
import com.tradeerp.invoicing.model.InvoiceLineItem;
import lombok.Data;

import java.math.BigDecimal;
import java.time.LocalDate;

@Data
public class InvoiceLineRequest {
    private Long itemId;
    private BigDecimal quantity;
    private BigDecimal unitPrice;

    private BigDecimal discount1Percent;
    private BigDecimal discount1Amount; // Takes precedence over the percentage
    private BigDecimal discount2Percent;
    private BigDecimal discount2Amount;

    private BigDecimal gstRate; // Item default when absent
    private BigDecimal advanceTaxPercent;

    private BigDecimal scheme1Quantity;
    private BigDecimal scheme2Quantity;

    private String batchNumber;
    private LocalDate manufacturingDate;
    private LocalDate expiryDate;

    public InvoiceLineItem toLineItem() {
        InvoiceLineItem line = new InvoiceLineItem();
        line.setItemId(itemId);
        line.setQuantity(quantity);
        line.setUnitPrice(unitPrice);
        line.setDiscount1Percent(discount1Percent);
        line.setDiscount1Amount(discount1Amount);
        line.setDiscount1Explicit(discount1Amount != null);
        line.setDiscount2Percent(discount2Percent);
        line.setDiscount2Amount(discount2Amount);
        line.setDiscount2Explicit(discount2Amount != null);
        line.setGstRate(gstRate);
        line.setAdvanceTaxPercent(advanceTaxPercent);
        line.setScheme1Quantity(scheme1Quantity);
        line.setScheme2Quantity(scheme2Quantity);
        BatchInfo batch = new BatchInfo(batchNumber, manufacturingDate, expiryDate);
        line.setBatchInfo(batch.isEmpty() ? null : batch);
        return line;
    }
}
