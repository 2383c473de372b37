package com.tradeerp.invoicing.controller;

import com.tradeerp.invoicing.dto.CancelInvoiceRequest;
import com.tradeerp.invoicing.dto.CreateInvoiceRequest;
import com.tradeerp.invoicing.dto.PaymentRequest;
import com.tradeerp.invoicing.dto.UpdateInvoiceRequest;
import com.tradeerp.invoicing.model.Invoice;
import com.tradeerp.invoicing.model.Payment;
import com.tradeerp.invoicing.model.StockMovement;
import com.tradeerp.invoicing.service.InvoiceStateMachine;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.security.Principal;
import java.util.List;

@RestController
@RequestMapping("/api/invoices")
public class InvoiceController {

    private final InvoiceStateMachine invoiceStateMachine;

    public InvoiceController(InvoiceStateMachine invoiceStateMachine) {
        this.invoiceStateMachine = invoiceStateMachine;
    }

    @PostMapping
    public ResponseEntity<Invoice> create(@RequestBody CreateInvoiceRequest request, Principal principal) {
        Invoice invoice = invoiceStateMachine.create(request, principal.getName());
        return ResponseEntity.status(HttpStatus.CREATED).body(invoice);
    }

    @GetMapping("/{id}")
    public Invoice get(@PathVariable Long id) {
        return invoiceStateMachine.get(id);
    }

    @PatchMapping("/{id}")
    public Invoice update(@PathVariable Long id, @RequestBody UpdateInvoiceRequest request, Principal principal) {
        return invoiceStateMachine.update(id, request, principal.getName());
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> delete(@PathVariable Long id, Principal principal) {
        invoiceStateMachine.delete(id, principal.getName());
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/{id}/confirm")
    public Invoice confirm(@PathVariable Long id, Principal principal) {
        return invoiceStateMachine.confirm(id, principal.getName());
    }

    @PostMapping("/{id}/cancel")
    public Invoice cancel(@PathVariable Long id, @RequestBody(required = false) CancelInvoiceRequest request,
            Principal principal) {
        String reason = request != null ? request.getReason() : null;
        return invoiceStateMachine.cancel(id, principal.getName(), reason);
    }

    @PostMapping("/{id}/payments")
    public Invoice pay(@PathVariable Long id, @RequestBody(required = false) PaymentRequest request,
            Principal principal) {
        return invoiceStateMachine.markPaid(id, request, principal.getName());
    }

    @PostMapping("/{id}/payments/partial")
    public Invoice payPartially(@PathVariable Long id, @RequestBody PaymentRequest request, Principal principal) {
        return invoiceStateMachine.markPartiallyPaid(id, request, principal.getName());
    }

    @GetMapping("/{id}/payments")
    public List<Payment> payments(@PathVariable Long id) {
        return invoiceStateMachine.paymentsFor(id);
    }

    @GetMapping("/{id}/stock-movements")
    public List<StockMovement> stockMovements(@PathVariable Long id) {
        return invoiceStateMachine.stockMovementsFor(id);
    }
}
