package com.tradeerp.invoicing.repository;

import com.tradeerp.invoicing.model.Invoice;
import com.tradeerp.invoicing.model.InvoiceStatus;
import com.tradeerp.invoicing.model.InvoiceType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

public interface InvoiceRepository extends JpaRepository<Invoice, Long> {
    Optional<Invoice> findByInvoiceNumber(String invoiceNumber);

    Optional<Invoice> findTopByTypeAndInvoiceNumberStartingWithOrderByInvoiceNumberDesc(InvoiceType type,
            String prefix);

    List<Invoice> findByCustomerIdAndStatusIn(Long customerId, List<InvoiceStatus> statuses);

    /**
     * Compare-and-swap on status. Returns the number of rows changed: 1 when this caller won the
     * transition, 0 when the invoice was no longer in {@code from}.
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE Invoice i SET i.status = :to, i.version = i.version + 1 WHERE i.id = :id AND i.status = :from")
    int transitionStatus(@Param("id") Long id, @Param("from") InvoiceStatus from, @Param("to") InvoiceStatus to);

    /**
     * Confirms only the exact revision the caller read: an edit committed since then has bumped
     * {@code version} and the update changes no row.
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE Invoice i SET i.status = :to, i.confirmedAt = :at, i.confirmedBy = :user, "
            + "i.version = i.version + 1 WHERE i.id = :id AND i.status = :from AND i.version = :version")
    int markConfirmed(@Param("id") Long id, @Param("version") Long version, @Param("from") InvoiceStatus from,
            @Param("to") InvoiceStatus to, @Param("at") LocalDateTime at, @Param("user") String user);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE Invoice i SET i.status = :to, i.cancelledAt = :at, i.cancelledBy = :user, "
            + "i.cancellationReason = :reason, i.version = i.version + 1 "
            + "WHERE i.id = :id AND i.status = :from AND i.version = :version")
    int markCancelled(@Param("id") Long id, @Param("version") Long version, @Param("from") InvoiceStatus from,
            @Param("to") InvoiceStatus to, @Param("at") LocalDateTime at, @Param("user") String user,
            @Param("reason") String reason);

    @Query("SELECT SUM(i.totals.grandTotal - i.totals.paidAmount) FROM Invoice i WHERE i.customerId = :customerId "
            + "AND i.type = com.tradeerp.invoicing.model.InvoiceType.SALES "
            + "AND i.status IN (com.tradeerp.invoicing.model.InvoiceStatus.CONFIRMED, "
            + "com.tradeerp.invoicing.model.InvoiceStatus.PARTIAL)")
    BigDecimal sumOutstandingSalesByCustomer(@Param("customerId") Long customerId);
}
