package com.tradeerp.invoicing.model;

import jakarta.persistence.*;
import lombok.Data;
import org.hibernate.annotations.Immutable;

import java.time.LocalDateTime;

@Entity
@Immutable
@Table(name = "audit_logs", indexes = {
        @Index(name = "idx_audit_action_time", columnList = "action, logged_at")
})
@Data
public class AuditLog {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, length = 100)
    private String username;

    @Column(nullable = false, length = 64)
    private String action; // One of the AuditService action constants

    @Column(length = 1000)
    private String details;

    @Column(name = "logged_at", nullable = false)
    private LocalDateTime timestamp;
}
