package com.tradeerp.invoicing.model;

import jakarta.persistence.*;
import lombok.Data;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

@Entity
@Table(name = "invoices", indexes = {
        @Index(name = "idx_invoice_customer", columnList = "customerId, invoiceDate"),
        @Index(name = "idx_invoice_supplier", columnList = "supplierId, invoiceDate"),
        @Index(name = "idx_invoice_status", columnList = "status")
})
@Data
public class Invoice {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(unique = true, nullable = false, length = 50)
    private String invoiceNumber;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private InvoiceType type;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private InvoiceStatus status;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private PaymentStatus paymentStatus;

    // Opaque references, resolved through repositories when needed
    private Long customerId;
    private Long supplierId;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "invoice_line_items", joinColumns = @JoinColumn(name = "invoice_id"))
    @OrderColumn(name = "line_no")
    private List<InvoiceLineItem> items = new ArrayList<>();

    @Embedded
    private InvoiceTotals totals = new InvoiceTotals();

    @Column(nullable = false)
    private LocalDate invoiceDate;

    @Column(nullable = false)
    private LocalDate dueDate;

    // Ledger account charged back with discount2 amounts
    private Long claimAccountId;

    private String dimension;

    @Column(length = 1000)
    private String notes;

    @Column(nullable = false)
    private String createdBy;

    private LocalDateTime confirmedAt;
    private String confirmedBy;

    private LocalDateTime cancelledAt;
    private String cancelledBy;

    @Column(length = 500)
    private String cancellationReason;

    private LocalDateTime paidAt;

    // Stamped from the application clock when the draft is created
    @Column(updatable = false)
    private LocalDateTime createdAt;

    @Version
    private Long version;

    @PrePersist
    protected void onCreate() {
        if (status == null)
            status = InvoiceStatus.DRAFT;
        if (paymentStatus == null)
            paymentStatus = PaymentStatus.PENDING;
    }

    public Long getCounterpartyId() {
        if (type == null)
            return null;
        return type.getCounterpartyKind() == CounterpartyKind.CUSTOMER ? customerId : supplierId;
    }
}
