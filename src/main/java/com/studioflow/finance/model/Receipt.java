package com.studioflow.finance.model;

import jakarta.persistence.*;
import lombok.Data;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;

/**
 * Proof of payment handed to the client. Copies the payment's figures so the receipt
 * still reads correctly if the payment is later removed.
 */
@Entity
@Table(name = "receipts")
@Data
public class Receipt {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(unique = true, nullable = false, length = 64)
    private String receiptNumber;

    @OneToOne
    @JoinColumn(name = "payment_id", unique = true)
    private Payment payment;

    @ManyToOne
    @JoinColumn(name = "invoice_id", nullable = false)
    private Invoice invoice;

    @ManyToOne
    @JoinColumn(name = "project_id")
    private Project project;

    @ManyToOne
    @JoinColumn(name = "client_id")
    private Client client;

    @ManyToOne
    @JoinColumn(name = "lead_id")
    private Lead lead;

    @Column(nullable = false)
    private LocalDate receiptDate;

    @Column(nullable = false, precision = 12, scale = 2)
    private BigDecimal amount;

    private String method;
    private String reference;

    @Column(length = 1000)
    private String notes;

    private String generatedBy;

    @Column(updatable = false)
    private LocalDateTime createdAt;

    @PrePersist
    protected void onCreate() {
        createdAt = LocalDateTime.now();
    }
}
