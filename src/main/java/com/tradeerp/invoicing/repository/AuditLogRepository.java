package com.tradeerp.invoicing.repository;

import com.tradeerp.invoicing.model.AuditLog;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface AuditLogRepository extends JpaRepository<AuditLog, Long> {
    // Audit details always name the invoice number they concern
    List<AuditLog> findByActionAndDetailsContainingOrderByTimestampDesc(String action, String invoiceNumber);
}
