package com.tradeerp.invoicing.dto;

import com.tradeerp.invoicing.model.InvoiceType;
import lombok.Data;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

@Data
public class CreateInvoiceRequest {
    private InvoiceType type;
    private Long customerId;
    private Long supplierId;
    private LocalDate invoiceDate; // Today when absent
    private LocalDate dueDate; // Derived from payment terms when absent
    private Long claimAccountId;
    private String dimension;
    private String notes;
    private List<InvoiceLineRequest> items = new ArrayList<>();
}
