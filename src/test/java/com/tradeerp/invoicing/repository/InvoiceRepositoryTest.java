package com.tradeerp.invoicing.repository;

import com.tradeerp.invoicing.model.*;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

@DataJpaTest
class InvoiceRepositoryTest {

    @Autowired
    private InvoiceRepository invoiceRepository;

    private Invoice newInvoice(String number, InvoiceType type, InvoiceStatus status, Long customerId,
            String grandTotal, String paid) {
        InvoiceLineItem line = new InvoiceLineItem();
        line.setItemId(1L);
        line.setQuantity(new BigDecimal("2"));
        line.setUnitPrice(new BigDecimal("10"));
        line.setBatchInfo(new BatchInfo("B1", LocalDate.of(2024, 1, 1), LocalDate.of(2025, 12, 31)));

        Invoice invoice = new Invoice();
        invoice.setInvoiceNumber(number);
        invoice.setType(type);
        invoice.setStatus(status);
        invoice.setPaymentStatus(PaymentStatus.PENDING);
        invoice.setCustomerId(customerId);
        invoice.setInvoiceDate(LocalDate.of(2026, 1, 10));
        invoice.setDueDate(LocalDate.of(2026, 2, 10));
        invoice.setCreatedBy("alice");
        invoice.getItems().add(line);
        invoice.getTotals().setGrandTotal(new BigDecimal(grandTotal));
        invoice.getTotals().setPaidAmount(new BigDecimal(paid));
        return invoiceRepository.saveAndFlush(invoice);
    }

    @Test
    void markConfirmed_ShouldSucceedOnceOnly() {
        Invoice invoice = newInvoice("SI2026000001", InvoiceType.SALES, InvoiceStatus.DRAFT, 5L, "20", "0");
        LocalDateTime at = LocalDateTime.of(2026, 1, 11, 10, 0);

        int first = invoiceRepository.markConfirmed(invoice.getId(), invoice.getVersion(), InvoiceStatus.DRAFT,
                InvoiceStatus.CONFIRMED, at, "alice");
        int second = invoiceRepository.markConfirmed(invoice.getId(), invoice.getVersion() + 1, InvoiceStatus.DRAFT,
                InvoiceStatus.CONFIRMED, at, "bob");

        assertEquals(1, first);
        assertEquals(0, second);

        Invoice reloaded = invoiceRepository.findById(invoice.getId()).orElseThrow();
        assertEquals(InvoiceStatus.CONFIRMED, reloaded.getStatus());
        assertEquals("alice", reloaded.getConfirmedBy());
        assertEquals(at, reloaded.getConfirmedAt());
        assertEquals(invoice.getVersion() + 1, reloaded.getVersion());
        assertEquals(1, reloaded.getItems().size());
        assertEquals("B1", reloaded.getItems().get(0).getBatchInfo().getBatchNumber());
    }

    @Test
    void markCancelled_ShouldRequireExpectedStatus() {
        Invoice invoice = newInvoice("SI2026000002", InvoiceType.SALES, InvoiceStatus.PAID, 5L, "20", "20");

        int changed = invoiceRepository.markCancelled(invoice.getId(), invoice.getVersion(),
                InvoiceStatus.CONFIRMED, InvoiceStatus.CANCELLED, LocalDateTime.of(2026, 1, 12, 8, 0), "bob", "late");

        assertEquals(0, changed);
        assertEquals(InvoiceStatus.PAID, invoiceRepository.findById(invoice.getId()).orElseThrow().getStatus());
    }

    @Test
    void markConfirmed_StaleRevision_ShouldChangeNothing() {
        Invoice invoice = newInvoice("SI2026000003", InvoiceType.SALES, InvoiceStatus.DRAFT, 5L, "20", "0");
        Long readVersion = invoice.getVersion();

        // A line edit committed after the version was read
        invoice.getItems().get(0).setQuantity(new BigDecimal("7"));
        invoice.setNotes("Quantity corrected");
        Invoice edited = invoiceRepository.saveAndFlush(invoice);
        assertEquals(readVersion + 1, edited.getVersion());

        int changed = invoiceRepository.markConfirmed(invoice.getId(), readVersion, InvoiceStatus.DRAFT,
                InvoiceStatus.CONFIRMED, LocalDateTime.of(2026, 1, 11, 10, 0), "alice");

        assertEquals(0, changed);
        Invoice reloaded = invoiceRepository.findById(invoice.getId()).orElseThrow();
        assertEquals(InvoiceStatus.DRAFT, reloaded.getStatus());
        assertNull(reloaded.getConfirmedBy());
        assertEquals(0, new BigDecimal("7").compareTo(reloaded.getItems().get(0).getQuantity()));
    }

    @Test
    void markCancelled_StaleRevision_ShouldChangeNothing() {
        Invoice invoice = newInvoice("SI2026000004", InvoiceType.SALES, InvoiceStatus.CONFIRMED, 5L, "20", "0");
        Long readVersion = invoice.getVersion();
        invoice.setNotes("Delivered in two drops");
        invoiceRepository.saveAndFlush(invoice);

        int changed = invoiceRepository.markCancelled(invoice.getId(), readVersion, InvoiceStatus.CONFIRMED,
                InvoiceStatus.CANCELLED, LocalDateTime.of(2026, 1, 12, 8, 0), "bob", "late");

        assertEquals(0, changed);
        assertEquals(InvoiceStatus.CONFIRMED,
                invoiceRepository.findById(invoice.getId()).orElseThrow().getStatus());
    }

    @Test
    void sumOutstandingSalesByCustomer_ShouldCountConfirmedAndPartialOnly() {
        newInvoice("SI2026000010", InvoiceType.SALES, InvoiceStatus.CONFIRMED, 7L, "1000.00", "0.00");
        newInvoice("SI2026000011", InvoiceType.SALES, InvoiceStatus.PARTIAL, 7L, "500.00", "200.00");
        newInvoice("SI2026000012", InvoiceType.SALES, InvoiceStatus.DRAFT, 7L, "999.00", "0.00");
        newInvoice("SI2026000013", InvoiceType.SALES, InvoiceStatus.CANCELLED, 7L, "999.00", "0.00");
        newInvoice("SR2026000001", InvoiceType.RETURN_SALES, InvoiceStatus.CONFIRMED, 7L, "50.00", "0.00");

        BigDecimal outstanding = invoiceRepository.sumOutstandingSalesByCustomer(7L);

        assertEquals(0, new BigDecimal("1300.00").compareTo(outstanding));
        assertNull(invoiceRepository.sumOutstandingSalesByCustomer(8L));
    }

    @Test
    void findTopByTypeAndPrefix_ShouldReturnHighestNumber() {
        newInvoice("PI2026000003", InvoiceType.PURCHASE, InvoiceStatus.DRAFT, null, "1", "0");
        newInvoice("PI2026000009", InvoiceType.PURCHASE, InvoiceStatus.DRAFT, null, "1", "0");
        newInvoice("PI2025000050", InvoiceType.PURCHASE, InvoiceStatus.DRAFT, null, "1", "0");

        Optional<Invoice> last = invoiceRepository
                .findTopByTypeAndInvoiceNumberStartingWithOrderByInvoiceNumberDesc(InvoiceType.PURCHASE, "PI2026");

        assertTrue(last.isPresent());
        assertEquals("PI2026000009", last.get().getInvoiceNumber());

        List<Invoice> none = invoiceRepository.findByCustomerIdAndStatusIn(99L, List.of(InvoiceStatus.DRAFT));
        assertTrue(none.isEmpty());
    }
}
