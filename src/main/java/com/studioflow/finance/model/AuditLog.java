package com.studioflow.finance.model;

import jakarta.persistence.*;
import lombok.Data;

import java.time.LocalDateTime;

@Entity
@Table(name = "audit_logs")
@Data
public class AuditLog {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    private String username;
    private String action; // e.g. "RECORD_PAYMENT", "ALLOCATE_ADVANCE"

    @Column(length = 1000)
    private String details; // e.g. "Invoice INV-00012, Amount: 2500.00"

    private LocalDateTime timestamp;

    @PrePersist
    protected void onCreate() {
        timestamp = LocalDateTime.now();
    }
}
