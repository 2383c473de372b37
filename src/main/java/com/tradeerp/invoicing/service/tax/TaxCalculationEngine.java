package com.tradeerp.invoicing.service.tax;

import com.tradeerp.invoicing.config.ErpProperties;
import com.tradeerp.invoicing.exception.ValidationException;
import com.tradeerp.invoicing.model.InvoiceLineItem;
import com.tradeerp.invoicing.model.InvoiceTotals;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;

/**
 * Discount and tax arithmetic for invoice lines and totals.
 * <p>
 * Per line: {@code lineTotal = qty * price}, discount1 off the line total, discount2 off the remainder,
 * GST and advance tax on what is left. An explicit discount amount takes precedence over its percentage;
 * an amount written back from a percentage is recomputed from that percentage on every pass, so
 * recalculating an unchanged line is idempotent.
 * All intermediate values keep full precision; values written back to the invoice are rounded to
 * 2 decimals (half away from zero) exactly once, and invoice totals are rounded from unrounded sums.
 */
@Component
public class TaxCalculationEngine {

    public static final int MONEY_SCALE = 2;
    public static final BigDecimal GST_STANDARD_RATE = new BigDecimal("18");
    public static final BigDecimal GST_REDUCED_RATE = new BigDecimal("4");

    private static final BigDecimal HUNDRED = new BigDecimal("100");

    private final ErpProperties properties;

    public TaxCalculationEngine(ErpProperties properties) {
        this.properties = properties;
    }

    public LineCalculation calculateLine(InvoiceLineItem line) {
        if (line.getItemId() == null) {
            throw new ValidationException("Item is required on every line", "itemId");
        }
        if (line.getQuantity() == null || line.getQuantity().signum() <= 0) {
            throw new ValidationException("Quantity must be positive", "quantity");
        }
        if (line.getUnitPrice() == null) {
            throw new ValidationException("Unit price is required", "unitPrice");
        }
        if (line.getUnitPrice().signum() < 0) {
            throw new ValidationException("Unit price cannot be negative", "unitPrice");
        }

        BigDecimal lineTotal = line.getQuantity().abs().multiply(line.getUnitPrice());

        BigDecimal discount1 = discount(lineTotal, line.getDiscount1Amount(), line.isDiscount1Explicit(),
                line.getDiscount1Percent(), "discount1");
        BigDecimal afterDiscount1 = lineTotal.subtract(discount1);

        BigDecimal discount2 = discount(afterDiscount1, line.getDiscount2Amount(), line.isDiscount2Explicit(),
                line.getDiscount2Percent(), "discount2");
        BigDecimal taxable = afterDiscount1.subtract(discount2);

        BigDecimal gstRate = rate(line.getGstRate(), "gstRate");
        BigDecimal advanceTaxPercent = percent(line.getAdvanceTaxPercent(), "advanceTaxPercent");

        return new LineCalculation(
                gstRate,
                lineTotal,
                discount1,
                discount2,
                taxable,
                percentOf(taxable, gstRate),
                percentOf(taxable, advanceTaxPercent));
    }

    /**
     * Computes every line, writes the rounded per-line amounts back onto the lines and returns the
     * invoice totals. {@code paidAmount} of the result is zero; callers carry the existing value over.
     */
    public InvoiceTotals calculateInvoice(List<InvoiceLineItem> lines, boolean nonFiler) {
        List<LineCalculation> calculations = new ArrayList<>(lines.size());
        for (InvoiceLineItem line : lines) {
            LineCalculation calc = calculateLine(line);
            applyTo(line, calc);
            calculations.add(calc);
        }
        return calculateTotals(calculations, nonFiler);
    }

    public InvoiceTotals calculateTotals(List<LineCalculation> lines, boolean nonFiler) {
        BigDecimal subtotal = BigDecimal.ZERO;
        BigDecimal discount1 = BigDecimal.ZERO;
        BigDecimal discount2 = BigDecimal.ZERO;
        BigDecimal taxable = BigDecimal.ZERO;
        BigDecimal gst = BigDecimal.ZERO;
        BigDecimal gst18 = BigDecimal.ZERO;
        BigDecimal gst4 = BigDecimal.ZERO;
        BigDecimal advanceTax = BigDecimal.ZERO;

        for (LineCalculation line : lines) {
            subtotal = subtotal.add(line.lineTotal());
            discount1 = discount1.add(line.discount1());
            discount2 = discount2.add(line.discount2());
            taxable = taxable.add(line.taxableAmount());
            gst = gst.add(line.gstAmount());
            advanceTax = advanceTax.add(line.advanceTaxAmount());
            if (line.gstRate().compareTo(GST_STANDARD_RATE) == 0) {
                gst18 = gst18.add(line.gstAmount());
            } else if (line.gstRate().compareTo(GST_REDUCED_RATE) == 0) {
                gst4 = gst4.add(line.gstAmount());
            }
        }

        // Invoice-level levies, not summed per line
        BigDecimal nonFilerGst = BigDecimal.ZERO;
        BigDecimal incomeTax = BigDecimal.ZERO;
        if (nonFiler) {
            nonFilerGst = percentOf(taxable, properties.getTax().getNonFilerGstRate());
            incomeTax = percentOf(taxable, properties.getTax().getIncomeTaxRate());
        }

        BigDecimal totalTax = gst.add(advanceTax).add(nonFilerGst).add(incomeTax);

        InvoiceTotals totals = new InvoiceTotals();
        totals.setSubtotal(round(subtotal));
        totals.setTotalDiscount1(round(discount1));
        totals.setTotalDiscount2(round(discount2));
        totals.setTaxableTotal(round(taxable));
        totals.setGstTotal(round(gst));
        totals.setGst18Total(round(gst18));
        totals.setGst4Total(round(gst4));
        totals.setAdvanceTaxTotal(round(advanceTax));
        totals.setNonFilerGSTTotal(round(nonFilerGst));
        totals.setIncomeTaxTotal(round(incomeTax));
        totals.setTotalTax(round(totalTax));
        totals.setGrandTotal(round(taxable.add(totalTax)));
        totals.setPaidAmount(BigDecimal.ZERO.setScale(MONEY_SCALE));
        return totals;
    }

    public static BigDecimal round(BigDecimal value) {
        return value.setScale(MONEY_SCALE, RoundingMode.HALF_UP);
    }

    private void applyTo(InvoiceLineItem line, LineCalculation calc) {
        line.setGstRate(calc.gstRate());
        line.setLineTotal(round(calc.lineTotal()));
        line.setDiscount1Amount(round(calc.discount1()));
        line.setDiscount2Amount(round(calc.discount2()));
        line.setTaxableAmount(round(calc.taxableAmount()));
        line.setGstAmount(round(calc.gstAmount()));
        line.setAdvanceTaxAmount(round(calc.advanceTaxAmount()));
        line.setNetAmount(round(calc.netAmount()));
    }

    private BigDecimal discount(BigDecimal base, BigDecimal explicitAmount, boolean explicit, BigDecimal percent,
            String field) {
        // A line without a percentage can only have got its amount from the caller
        if (explicitAmount != null && (explicit || percent == null)) {
            if (explicitAmount.signum() < 0) {
                throw new ValidationException("Discount cannot be negative", field + "Amount");
            }
            if (explicitAmount.stripTrailingZeros().scale() > MONEY_SCALE) {
                throw new ValidationException("Discount amount cannot have more than 2 decimals", field + "Amount");
            }
            if (explicitAmount.compareTo(base) > 0) {
                throw new ValidationException("Discount cannot exceed the amount it is taken from",
                        field + "Amount");
            }
            return explicitAmount;
        }
        return percentOf(base, percent(percent, field + "Percent"));
    }

    private static BigDecimal percent(BigDecimal value, String field) {
        if (value == null) {
            return BigDecimal.ZERO;
        }
        if (value.signum() < 0 || value.compareTo(HUNDRED) > 0) {
            throw new ValidationException("Percentage must be between 0 and 100", field);
        }
        return value;
    }

    private static BigDecimal rate(BigDecimal value, String field) {
        if (value == null) {
            return BigDecimal.ZERO;
        }
        if (value.signum() < 0) {
            throw new ValidationException("Tax rate cannot be negative", field);
        }
        return value;
    }

    private static BigDecimal percentOf(BigDecimal base, BigDecimal percent) {
        return base.multiply(percent).movePointLeft(2);
    }
}
