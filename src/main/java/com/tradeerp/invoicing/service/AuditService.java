package com.tradeerp.invoicing.service;

import com.tradeerp.invoicing.model.AuditLog;
import com.tradeerp.invoicing.repository.AuditLogRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;

/**
 * Writes audit rows inside the caller's transaction, so an audited change and its audit row
 * commit or roll back together.
 */
@Service
public class AuditService {

    public static final String INVOICE_CREATED = "INVOICE_CREATED";
    public static final String INVOICE_UPDATED = "INVOICE_UPDATED";
    public static final String INVOICE_CONFIRMED = "INVOICE_CONFIRMED";
    public static final String INVOICE_CANCELLED = "INVOICE_CANCELLED";
    public static final String INVOICE_PAID = "INVOICE_PAID";
    public static final String INVOICE_PARTIALLY_PAID = "INVOICE_PARTIALLY_PAID";
    public static final String INVOICE_DELETED = "INVOICE_DELETED";
    public static final String STOCK_ADJUSTED = "STOCK_ADJUSTED";

    private static final Logger logger = LoggerFactory.getLogger(AuditService.class);

    private static final int MAX_DETAILS_LENGTH = 1000;

    private final AuditLogRepository auditLogRepository;
    private final Clock clock;

    public AuditService(AuditLogRepository auditLogRepository, Clock clock) {
        this.auditLogRepository = auditLogRepository;
        this.clock = clock;
    }

    @Transactional
    public void log(String action, String details) {
        AuditLog log = new AuditLog();
        log.setAction(action);
        log.setDetails(details != null && details.length() > MAX_DETAILS_LENGTH
                ? details.substring(0, MAX_DETAILS_LENGTH)
                : details);
        log.setUsername(currentUsername());
        log.setTimestamp(LocalDateTime.now(clock));

        auditLogRepository.save(log);
        logger.debug("Audit {} by {}: {}", action, log.getUsername(), details);
    }

    public static String currentUsername() {
        Authentication auth = SecurityContextHolder.getContext().getAuthentication();
        if (auth != null && auth.getName() != null) {
            return auth.getName();
        }
        return "SYSTEM";
    }
}
