package com.tradeerp.invoicing.service;

import com.tradeerp.invoicing.config.ErpProperties;
import com.tradeerp.invoicing.dto.CreateInvoiceRequest;
import com.tradeerp.invoicing.dto.InvoiceLineRequest;
import com.tradeerp.invoicing.dto.PaymentRequest;
import com.tradeerp.invoicing.dto.UpdateInvoiceRequest;
import com.tradeerp.invoicing.exception.InternalErrorException;
import com.tradeerp.invoicing.exception.NotFoundException;
import com.tradeerp.invoicing.exception.StateConflictException;
import com.tradeerp.invoicing.exception.ValidationException;
import com.tradeerp.invoicing.model.*;
import com.tradeerp.invoicing.repository.InvoiceRepository;
import com.tradeerp.invoicing.repository.PaymentRepository;
import com.tradeerp.invoicing.service.ledger.InvoicePostingRules;
import com.tradeerp.invoicing.service.stock.StockMovementLedger;
import com.tradeerp.invoicing.service.tax.TaxCalculationEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Invoice lifecycle: {@code DRAFT -> CONFIRMED -> PARTIAL/PAID}, {@code DRAFT -> CANCELLED} and
 * {@code CONFIRMED -> CANCELLED}.
 * <p>
 * Confirm and cancel win their transition with a conditional status update before any side effect runs,
 * then append stock movements and post to the ledger inside the same transaction. Any failure rolls all of
 * it back and the invoice keeps its previous status.
 */
@Service
public class InvoiceStateMachine {

    private static final Logger logger = LoggerFactory.getLogger(InvoiceStateMachine.class);

    private final InvoiceRepository invoiceRepository;
    private final PaymentRepository paymentRepository;
    private final TaxCalculationEngine taxEngine;
    private final StockMovementLedger stockLedger;
    private final InvoicePostingRules postingRules;
    private final CounterpartyDirectory counterparties;
    private final InvoiceValidator validator;
    private final AuditService auditService;
    private final ErpProperties properties;
    private final Clock clock;

    public InvoiceStateMachine(InvoiceRepository invoiceRepository, PaymentRepository paymentRepository,
            TaxCalculationEngine taxEngine, StockMovementLedger stockLedger, InvoicePostingRules postingRules,
            CounterpartyDirectory counterparties, InvoiceValidator validator, AuditService auditService,
            ErpProperties properties, Clock clock) {
        this.invoiceRepository = invoiceRepository;
        this.paymentRepository = paymentRepository;
        this.taxEngine = taxEngine;
        this.stockLedger = stockLedger;
        this.postingRules = postingRules;
        this.counterparties = counterparties;
        this.validator = validator;
        this.auditService = auditService;
        this.properties = properties;
        this.clock = clock;
    }

    @Transactional
    public Invoice create(CreateInvoiceRequest request, String userId) {
        validator.requireUser(userId);
        if (request == null || request.getType() == null) {
            throw new ValidationException("Invoice type is required", "type");
        }

        Invoice invoice = new Invoice();
        invoice.setType(request.getType());
        invoice.setStatus(InvoiceStatus.DRAFT);
        invoice.setPaymentStatus(PaymentStatus.PENDING);
        invoice.setCreatedBy(userId);
        invoice.setCreatedAt(LocalDateTime.now(clock));
        invoice.setCustomerId(request.getCustomerId());
        invoice.setSupplierId(request.getSupplierId());
        invoice.setInvoiceDate(request.getInvoiceDate() != null ? request.getInvoiceDate() : LocalDate.now(clock));
        invoice.setDueDate(request.getDueDate());
        invoice.setClaimAccountId(request.getClaimAccountId());
        invoice.setDimension(request.getDimension());
        invoice.setNotes(request.getNotes());
        invoice.setItems(toLineItems(request.getItems()));

        recalculate(invoice);
        invoice.setInvoiceNumber(nextInvoiceNumber(invoice.getType(), invoice.getInvoiceDate()));

        Invoice saved = invoiceRepository.save(invoice);
        auditService.log(AuditService.INVOICE_CREATED, "Invoice " + saved.getInvoiceNumber() + " ("
                + saved.getType() + "), total " + saved.getTotals().getGrandTotal());
        logger.info("Created draft invoice {} ({} lines, total {})", saved.getInvoiceNumber(),
                saved.getItems().size(), saved.getTotals().getGrandTotal());
        return saved;
    }

    @Transactional
    public Invoice update(Long invoiceId, UpdateInvoiceRequest patch, String userId) {
        validator.requireUser(userId);
        if (patch == null) {
            throw new ValidationException("Nothing to update");
        }
        Invoice invoice = load(invoiceId);

        if (invoice.getStatus() == InvoiceStatus.CANCELLED) {
            logger.warn("Rejected update of cancelled invoice {}", invoice.getInvoiceNumber());
            throw new StateConflictException("Cannot modify a cancelled invoice");
        }
        if (invoice.getStatus() != InvoiceStatus.DRAFT) {
            if (patch.changesItems()) {
                logger.warn("Rejected item change on {} invoice {}", invoice.getStatus(), invoice.getInvoiceNumber());
                throw new StateConflictException("Cannot modify confirmed invoice items");
            }
            if (patch.changesTerms()) {
                logger.warn("Rejected terms change on {} invoice {}", invoice.getStatus(), invoice.getInvoiceNumber());
                throw new StateConflictException("Only notes and dimension can be changed after confirmation");
            }
        }

        if (patch.getNotes() != null)
            invoice.setNotes(patch.getNotes());
        if (patch.getDimension() != null)
            invoice.setDimension(patch.getDimension());

        if (invoice.getStatus() == InvoiceStatus.DRAFT && (patch.changesItems() || patch.changesTerms())) {
            if (patch.getCustomerId() != null)
                invoice.setCustomerId(patch.getCustomerId());
            if (patch.getSupplierId() != null)
                invoice.setSupplierId(patch.getSupplierId());
            if (patch.getInvoiceDate() != null)
                invoice.setInvoiceDate(patch.getInvoiceDate());
            if (patch.getDueDate() != null)
                invoice.setDueDate(patch.getDueDate());
            if (patch.getClaimAccountId() != null)
                invoice.setClaimAccountId(patch.getClaimAccountId());
            if (patch.changesItems())
                invoice.setItems(toLineItems(patch.getItems()));
            recalculate(invoice);
        }

        Invoice saved = invoiceRepository.save(invoice);
        auditService.log(AuditService.INVOICE_UPDATED, "Invoice " + saved.getInvoiceNumber());
        logger.info("Updated invoice {}", saved.getInvoiceNumber());
        return saved;
    }

    @Transactional
    public Invoice confirm(Long invoiceId, String userId) {
        validator.requireUser(userId);
        Invoice invoice = load(invoiceId);
        if (invoice.getStatus() != InvoiceStatus.DRAFT) {
            logger.warn("Rejected confirm of {} invoice {}", invoice.getStatus(), invoice.getInvoiceNumber());
            throw new StateConflictException("Only draft invoices can be confirmed");
        }

        // The conditional update clears the persistence context; keep what the side effects need
        List<InvoiceLineItem> lines = new ArrayList<>(invoice.getItems());
        LocalDateTime now = LocalDateTime.now(clock);

        // Movements are built from the lines read above, so the revision must not have moved since
        if (invoiceRepository.markConfirmed(invoiceId, invoice.getVersion(), InvoiceStatus.DRAFT,
                InvoiceStatus.CONFIRMED, now, userId) == 0) {
            logger.warn("Lost confirm race on invoice {} (revision {})", invoice.getInvoiceNumber(),
                    invoice.getVersion());
            throw new StateConflictException("Invoice was changed concurrently; reload and retry");
        }

        InvoiceType type = invoice.getType();
        for (InvoiceLineItem line : lines) {
            BigDecimal magnitude = line.getQuantity().abs();
            BigDecimal signed = type.getStockDirection() == MovementType.OUT ? magnitude.negate() : magnitude;
            stockLedger.appendMovement(line.getItemId(), type.getStockDirection(), signed,
                    type.getStockReferenceType(), invoiceId, line.getBatchInfo(), now,
                    "Invoice " + invoice.getInvoiceNumber(), userId);
        }
        postingRules.postConfirmation(invoice, userId);

        auditService.log(AuditService.INVOICE_CONFIRMED, "Invoice " + invoice.getInvoiceNumber() + ", "
                + lines.size() + " stock movement(s)");
        logger.info("Confirmed invoice {} by {}", invoice.getInvoiceNumber(), userId);
        return load(invoiceId);
    }

    @Transactional
    public Invoice cancel(Long invoiceId, String userId, String reason) {
        validator.requireUser(userId);
        if (reason != null && reason.length() > 500) {
            throw new ValidationException("Cancellation reason cannot exceed 500 characters", "reason");
        }
        Invoice invoice = load(invoiceId);
        InvoiceStatus from = invoice.getStatus();
        if (from == InvoiceStatus.CANCELLED) {
            logger.warn("Rejected cancel of already cancelled invoice {}", invoice.getInvoiceNumber());
            throw new StateConflictException("Invoice is already cancelled");
        }
        if (from == InvoiceStatus.PAID) {
            logger.warn("Rejected cancel of paid invoice {}", invoice.getInvoiceNumber());
            throw new StateConflictException("Cannot cancel paid invoice; process a refund");
        }
        if (from == InvoiceStatus.PARTIAL) {
            logger.warn("Rejected cancel of partially paid invoice {}", invoice.getInvoiceNumber());
            throw new StateConflictException("Cannot cancel partially paid invoice; process a refund");
        }

        LocalDateTime now = LocalDateTime.now(clock);
        if (invoiceRepository.markCancelled(invoiceId, invoice.getVersion(), from, InvoiceStatus.CANCELLED, now,
                userId, reason) == 0) {
            logger.warn("Lost cancel race on invoice {}", invoice.getInvoiceNumber());
            throw new StateConflictException("Invoice was changed concurrently; reload and retry");
        }

        if (from == InvoiceStatus.CONFIRMED) {
            List<StockMovement> reversals = stockLedger.reverse(invoice.getType().getStockReferenceType(),
                    invoiceId, now, userId);
            postingRules.postCancellation(invoice, userId);
            logger.info("Reversed {} stock movement(s) for invoice {}", reversals.size(),
                    invoice.getInvoiceNumber());
        }

        auditService.log(AuditService.INVOICE_CANCELLED, "Invoice " + invoice.getInvoiceNumber() + " (was "
                + from + ")" + (reason != null ? ": " + reason : ""));
        logger.info("Cancelled invoice {} (was {}) by {}", invoice.getInvoiceNumber(), from, userId);
        return load(invoiceId);
    }

    /**
     * Settles the whole outstanding balance. An invoice with nothing outstanding (a zero-value invoice) is
     * settled without recording a payment or a ledger posting.
     */
    @Transactional
    public Invoice markPaid(Long invoiceId, PaymentRequest request, String userId) {
        validator.requireUser(userId);
        Invoice invoice = load(invoiceId);
        requirePayable(invoice);

        BigDecimal outstanding = invoice.getTotals().outstanding();
        if (request != null && request.getAmount() != null && request.getAmount().compareTo(outstanding) != 0) {
            throw new ValidationException("Full payment must equal the outstanding balance of " + outstanding,
                    "amount");
        }
        if (outstanding.signum() <= 0) {
            return settleWithoutPayment(invoice, userId);
        }
        return applyPayment(invoice, outstanding, request, userId);
    }

    @Transactional
    public Invoice markPartiallyPaid(Long invoiceId, PaymentRequest request, String userId) {
        validator.requireUser(userId);
        if (request == null || request.getAmount() == null) {
            throw new ValidationException("Payment amount is required", "amount");
        }
        Invoice invoice = load(invoiceId);
        requirePayable(invoice);

        BigDecimal amount = request.getAmount();
        if (amount.signum() <= 0) {
            throw new ValidationException("Payment amount must be positive", "amount");
        }
        if (amount.stripTrailingZeros().scale() > TaxCalculationEngine.MONEY_SCALE) {
            throw new ValidationException("Payment amount cannot have more than 2 decimals", "amount");
        }
        BigDecimal outstanding = invoice.getTotals().outstanding();
        if (amount.compareTo(outstanding) > 0) {
            throw new ValidationException("Payment amount " + amount + " exceeds outstanding balance "
                    + outstanding, "amount");
        }
        return applyPayment(invoice, amount, request, userId);
    }

    @Transactional
    public void delete(Long invoiceId, String userId) {
        validator.requireUser(userId);
        Invoice invoice = load(invoiceId);
        if (invoice.getStatus() != InvoiceStatus.DRAFT) {
            logger.warn("Rejected delete of {} invoice {}", invoice.getStatus(), invoice.getInvoiceNumber());
            throw new StateConflictException("Cannot delete confirmed or paid invoices. Cancel the invoice instead.");
        }
        invoiceRepository.delete(invoice);
        auditService.log(AuditService.INVOICE_DELETED, "Draft invoice " + invoice.getInvoiceNumber());
        logger.info("Deleted draft invoice {}", invoice.getInvoiceNumber());
    }

    @Transactional(readOnly = true)
    public Invoice get(Long invoiceId) {
        return load(invoiceId);
    }

    @Transactional(readOnly = true)
    public List<StockMovement> stockMovementsFor(Long invoiceId) {
        Invoice invoice = load(invoiceId);
        return stockLedger.findByReference(invoice.getType().getStockReferenceType(), invoiceId);
    }

    @Transactional(readOnly = true)
    public List<Payment> paymentsFor(Long invoiceId) {
        load(invoiceId);
        return paymentRepository.findByInvoiceIdOrderByPaidAtAsc(invoiceId);
    }

    private Invoice applyPayment(Invoice invoice, BigDecimal amount, PaymentRequest request, String userId) {
        if (amount.signum() <= 0) {
            throw new ValidationException("Nothing outstanding on invoice " + invoice.getInvoiceNumber(), "amount");
        }
        LocalDateTime now = LocalDateTime.now(clock);

        Payment payment = new Payment();
        payment.setInvoiceId(invoice.getId());
        payment.setAmount(amount);
        payment.setPaymentMethod(request != null && request.getPaymentMethod() != null
                ? request.getPaymentMethod()
                : PaymentMethod.CASH);
        payment.setReferenceNumber(request != null ? request.getReferenceNumber() : null);
        payment.setNotes(request != null ? request.getNotes() : null);
        payment.setPaidAt(now);
        payment.setRecordedBy(userId);
        payment = paymentRepository.save(payment);

        InvoiceTotals totals = invoice.getTotals();
        totals.setPaidAmount(totals.getPaidAmount().add(amount));
        boolean settled = totals.getPaidAmount().compareTo(totals.getGrandTotal()) >= 0;
        invoice.setStatus(settled ? InvoiceStatus.PAID : InvoiceStatus.PARTIAL);
        invoice.setPaymentStatus(settled ? PaymentStatus.PAID : PaymentStatus.PARTIAL);
        if (settled)
            invoice.setPaidAt(now);

        // Version check at flush rejects a concurrent payment on the same invoice
        Invoice saved = invoiceRepository.saveAndFlush(invoice);
        postingRules.postPayment(saved, payment, userId);

        auditService.log(settled ? AuditService.INVOICE_PAID : AuditService.INVOICE_PARTIALLY_PAID,
                "Invoice " + saved.getInvoiceNumber() + ", amount " + amount + ", paid " + totals.getPaidAmount()
                        + " of " + totals.getGrandTotal());
        logger.info("Recorded payment of {} on invoice {} ({})", amount, saved.getInvoiceNumber(),
                saved.getStatus());
        return saved;
    }

    private Invoice settleWithoutPayment(Invoice invoice, String userId) {
        LocalDateTime now = LocalDateTime.now(clock);
        invoice.setStatus(InvoiceStatus.PAID);
        invoice.setPaymentStatus(PaymentStatus.PAID);
        invoice.setPaidAt(now);

        Invoice saved = invoiceRepository.saveAndFlush(invoice);
        auditService.log(AuditService.INVOICE_PAID, "Invoice " + saved.getInvoiceNumber()
                + " settled with nothing outstanding, total " + saved.getTotals().getGrandTotal());
        logger.info("Settled zero-value invoice {} by {}", saved.getInvoiceNumber(), userId);
        return saved;
    }

    private void requirePayable(Invoice invoice) {
        if (invoice.getStatus() == InvoiceStatus.DRAFT) {
            logger.warn("Rejected payment on draft invoice {}", invoice.getInvoiceNumber());
            throw new ValidationException("Confirm the invoice first", "status");
        }
        if (invoice.getStatus() == InvoiceStatus.CANCELLED) {
            logger.warn("Rejected payment on cancelled invoice {}", invoice.getInvoiceNumber());
            throw new StateConflictException("Cannot record payment on a cancelled invoice");
        }
        if (invoice.getStatus() == InvoiceStatus.PAID) {
            logger.warn("Rejected payment on paid invoice {}", invoice.getInvoiceNumber());
            throw new StateConflictException("Invoice is already paid");
        }
    }

    /**
     * Validates the draft's content and recomputes line amounts and totals. Paid amount is carried over.
     */
    private void recalculate(Invoice invoice) {
        CounterpartyKind kind = invoice.getType().getCounterpartyKind();
        Long counterpartyId = invoice.getCounterpartyId();
        if (counterpartyId == null) {
            String field = kind == CounterpartyKind.CUSTOMER ? "customerId" : "supplierId";
            throw new ValidationException((kind == CounterpartyKind.CUSTOMER ? "Customer" : "Supplier")
                    + " is required for " + invoice.getType() + " invoices", field);
        }
        // Only the counterparty matching the type is kept
        if (kind == CounterpartyKind.CUSTOMER)
            invoice.setSupplierId(null);
        else
            invoice.setCustomerId(null);

        CounterpartyProfile counterparty = counterparties.profile(kind, counterpartyId);
        validator.requireActive(counterparty);
        validator.prepareLines(invoice.getItems());

        BigDecimal paid = invoice.getTotals() != null ? invoice.getTotals().getPaidAmount() : BigDecimal.ZERO;
        InvoiceTotals totals = taxEngine.calculateInvoice(invoice.getItems(), counterparty.nonFiler());
        totals.setPaidAmount(paid);
        invoice.setTotals(totals);

        validator.validateClaimAccount(invoice.getItems(), invoice.getClaimAccountId());

        if (invoice.getDueDate() == null) {
            int terms = Optional.ofNullable(counterparty.paymentTermsDays())
                    .orElse(properties.getInvoice().getDefaultPaymentTermsDays());
            invoice.setDueDate(invoice.getInvoiceDate().plusDays(terms));
        }
        validator.validateDates(invoice.getInvoiceDate(), invoice.getDueDate());
        validator.validateCreditLimit(invoice.getType(), counterparty, totals.getGrandTotal());
    }

    /**
     * Type prefix, 4-digit year and a 6-digit sequence per type and year, e.g. SI2026000001.
     */
    private String nextInvoiceNumber(InvoiceType type, LocalDate invoiceDate) {
        String prefix = type.getNumberPrefix() + invoiceDate.getYear();
        long next = 1;
        Optional<Invoice> last = invoiceRepository
                .findTopByTypeAndInvoiceNumberStartingWithOrderByInvoiceNumberDesc(type, prefix);
        if (last.isPresent()) {
            String lastNumber = last.get().getInvoiceNumber();
            try {
                next = Long.parseLong(lastNumber.substring(prefix.length())) + 1;
            } catch (NumberFormatException | IndexOutOfBoundsException e) {
                throw new InternalErrorException("Unrecognised invoice number format: " + lastNumber, e);
            }
        }
        return String.format("%s%06d", prefix, next);
    }

    private static List<InvoiceLineItem> toLineItems(List<InvoiceLineRequest> requests) {
        List<InvoiceLineItem> lines = new ArrayList<>();
        if (requests != null) {
            for (InvoiceLineRequest request : requests) {
                lines.add(request.toLineItem());
            }
        }
        return lines;
    }

    private Invoice load(Long invoiceId) {
        return invoiceRepository.findById(invoiceId)
                .orElseThrow(() -> new NotFoundException("Invoice not found: " + invoiceId));
    }
}
