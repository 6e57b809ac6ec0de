package com.studioflow.finance.model;

import jakarta.persistence.*;
import lombok.Data;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;

/**
 * Monthly cash movement (rent, subscriptions, retainers) posted to the ledger
 * automatically. {@code nextRunDate} is the cursor: it only ever moves forward, one
 * calendar month per generated period.
 */
@Entity
@Table(name = "recurring_transaction_rules")
@Data
public class RecurringTransactionRule {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private String name;

    private String description;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private RecurringDirection direction = RecurringDirection.DEBIT;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private TransactionCategory category = TransactionCategory.MISC;

    @Column(nullable = false, precision = 12, scale = 2)
    private BigDecimal amount;

    @Column(nullable = false)
    private int dayOfMonth = 1;

    private LocalDate nextRunDate;

    private boolean active = true;

    @ManyToOne
    @JoinColumn(name = "account_id")
    private Account account;

    @ManyToOne
    @JoinColumn(name = "related_project_id")
    private Project relatedProject;

    @ManyToOne
    @JoinColumn(name = "related_vendor_id")
    private Vendor relatedVendor;

    @Column(updatable = false)
    private LocalDateTime createdAt;

    @PrePersist
    protected void onCreate() {
        createdAt = LocalDateTime.now();
    }
}
