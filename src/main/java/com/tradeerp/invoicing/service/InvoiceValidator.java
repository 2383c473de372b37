package com.tradeerp.invoicing.service;

import com.tradeerp.invoicing.exception.NotFoundException;
import com.tradeerp.invoicing.exception.ValidationException;
import com.tradeerp.invoicing.model.InvoiceLineItem;
import com.tradeerp.invoicing.model.InvoiceType;
import com.tradeerp.invoicing.model.Item;
import com.tradeerp.invoicing.repository.InvoiceRepository;
import com.tradeerp.invoicing.repository.ItemRepository;
import com.tradeerp.invoicing.service.stock.StockMovementValidator;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

/**
 * Draft-time checks on invoice content. Called explicitly before an invoice is saved.
 */
@Component
public class InvoiceValidator {

    private final ItemRepository itemRepository;
    private final InvoiceRepository invoiceRepository;
    private final StockMovementValidator movementValidator;

    public InvoiceValidator(ItemRepository itemRepository, InvoiceRepository invoiceRepository,
            StockMovementValidator movementValidator) {
        this.itemRepository = itemRepository;
        this.invoiceRepository = invoiceRepository;
        this.movementValidator = movementValidator;
    }

    public void requireUser(String userId) {
        if (userId == null || userId.isBlank()) {
            throw new ValidationException("User is required", "createdBy");
        }
    }

    public void requireActive(CounterpartyProfile counterparty) {
        if (!counterparty.active()) {
            throw new ValidationException(counterparty.label() + " is not active",
                    counterparty.kind().name().toLowerCase() + "Id");
        }
    }

    /**
     * Checks every line's item and batch, and fills a missing GST rate from the item's default.
     */
    public void prepareLines(List<InvoiceLineItem> lines) {
        if (lines == null || lines.isEmpty()) {
            throw new ValidationException("At least one line item is required", "items");
        }
        for (InvoiceLineItem line : lines) {
            if (line.getItemId() == null) {
                throw new ValidationException("Item is required on every line", "itemId");
            }
            Item item = itemRepository.findById(line.getItemId())
                    .orElseThrow(() -> new NotFoundException("Item not found: " + line.getItemId()));
            if (!item.isActive()) {
                throw new ValidationException("Item " + item.getCode() + " is not active", "itemId");
            }
            if (line.getGstRate() == null) {
                line.setGstRate(item.getGstRate());
            }
            movementValidator.validateBatch(line.getBatchInfo());
        }
    }

    public void validateDates(LocalDate invoiceDate, LocalDate dueDate) {
        if (dueDate.isBefore(invoiceDate)) {
            throw new ValidationException("Due date cannot be before invoice date", "dueDate");
        }
    }

    public void validateClaimAccount(List<InvoiceLineItem> lines, Long claimAccountId) {
        boolean hasDiscount2 = lines.stream()
                .anyMatch(l -> l.getDiscount2Amount() != null && l.getDiscount2Amount().signum() > 0);
        if (hasDiscount2 && claimAccountId == null) {
            throw new ValidationException("A claim account is required when discount 2 is applied",
                    "claimAccountId");
        }
    }

    /**
     * Outstanding confirmed sales of the customer plus this invoice must stay within a positive credit limit.
     */
    public void validateCreditLimit(InvoiceType type, CounterpartyProfile customer, BigDecimal grandTotal) {
        if (type != InvoiceType.SALES || customer.creditLimit() == null
                || customer.creditLimit().signum() <= 0) {
            return;
        }
        BigDecimal currentDebt = invoiceRepository.sumOutstandingSalesByCustomer(customer.id());
        if (currentDebt == null)
            currentDebt = BigDecimal.ZERO;

        BigDecimal newTotalDebt = currentDebt.add(grandTotal);
        if (newTotalDebt.compareTo(customer.creditLimit()) > 0) {
            throw new ValidationException("Credit limit exceeded. Limit: " + customer.creditLimit()
                    + ", current debt: " + currentDebt + ", this invoice: " + grandTotal, "customerId");
        }
    }
}
