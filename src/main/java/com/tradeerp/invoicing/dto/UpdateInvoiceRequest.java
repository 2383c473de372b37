package com.tradeerp.invoicing.dto;

import lombok.Data;

import java.time.LocalDate;
import java.util.List;

/**
 * Partial update. Null fields are left unchanged. Only notes and dimension may change once an
 * invoice has left draft.
 */
@Data
public class UpdateInvoiceRequest {
    private Long customerId;
    private Long supplierId;
    private LocalDate invoiceDate;
    private LocalDate dueDate;
    private Long claimAccountId;
    private String dimension;
    private String notes;
    private List<InvoiceLineRequest> items;

    public boolean changesItems() {
        return items != null;
    }

    public boolean changesTerms() {
        return customerId != null || supplierId != null || invoiceDate != null || dueDate != null
                || claimAccountId != null;
    }
}
