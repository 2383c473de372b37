package com.tradeerp.invoicing.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.math.BigDecimal;

/**
 * Binds the {@code tradeerp.*} namespace of application.properties.
 */
@Data
@ConfigurationProperties(prefix = "tradeerp")
public class ErpProperties {

    private Tax tax = new Tax();
    private Inventory inventory = new Inventory();
    private InvoiceDefaults invoice = new InvoiceDefaults();
    private Ledger ledger = new Ledger();

    @Data
    public static class Tax {
        // Percent of taxable total levied on non-filer counterparties
        private BigDecimal nonFilerGstRate = new BigDecimal("0.1");
        private BigDecimal incomeTaxRate = new BigDecimal("5.5");
    }

    @Data
    public static class Inventory {
        private boolean allowNegativeStock = false;
    }

    @Data
    public static class InvoiceDefaults {
        private int defaultPaymentTermsDays = 30;
    }

    @Data
    public static class Ledger {
        private Long salesAccountId = 1L;
        private Long purchaseAccountId = 2L;
        private Long cashAccountId = 3L;
    }
}
