package com.studioflow.finance.model;

import jakarta.persistence.*;
import lombok.Data;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;

/**
 * One cashbook row. Rows mirrored from a settlement event or a recurring rule carry
 * that origin; rows entered by hand (payroll, petty cash) carry none.
 */
@Entity
@Table(name = "ledger_entries", indexes = {
        @Index(name = "idx_ledger_entry_date", columnList = "entryDate"),
        @Index(name = "idx_ledger_entry_origin", columnList = "originType, originId")
})
@Data
public class LedgerEntry {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private LocalDate entryDate;

    @Column(nullable = false)
    private String description;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private TransactionCategory category = TransactionCategory.MISC;

    @Column(nullable = false, precision = 12, scale = 2)
    private BigDecimal debit = BigDecimal.ZERO; // Money out

    @Column(nullable = false, precision = 12, scale = 2)
    private BigDecimal credit = BigDecimal.ZERO; // Money in

    @ManyToOne
    @JoinColumn(name = "account_id")
    private Account account;

    @ManyToOne
    @JoinColumn(name = "related_project_id")
    private Project relatedProject;

    @ManyToOne
    @JoinColumn(name = "related_client_id")
    private Client relatedClient;

    @ManyToOne
    @JoinColumn(name = "related_vendor_id")
    private Vendor relatedVendor;

    private String relatedPerson;

    @Column(length = 1000)
    private String remarks;

    private String recordedBy;

    @Enumerated(EnumType.STRING)
    private LedgerOriginType originType;

    private Long originId;

    @Column(unique = true, length = 100)
    private String originKey;

    @Column(updatable = false)
    private LocalDateTime createdAt;

    @PrePersist
    protected void onCreate() {
        createdAt = LocalDateTime.now();
    }

    public void setOrigin(LedgerOrigin origin) {
        this.originType = origin.getType();
        this.originId = origin.getSourceId();
        this.originKey = origin.key();
    }

    public boolean hasOrigin() {
        return originKey != null;
    }
}
