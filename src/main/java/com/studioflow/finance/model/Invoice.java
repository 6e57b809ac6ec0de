package com.studioflow.finance.model;

import jakarta.persistence.*;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.ToString;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

@Entity
@Table(name = "invoices")
@Data
public class Invoice {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(unique = true, nullable = false)
    private String invoiceNumber;

    @ManyToOne
    @JoinColumn(name = "project_id")
    private Project project;

    @ManyToOne
    @JoinColumn(name = "lead_id")
    private Lead lead;

    @Column(nullable = false)
    private LocalDate invoiceDate;

    @Column(nullable = false)
    private LocalDate dueDate;

    @Column(nullable = false, precision = 12, scale = 2)
    private BigDecimal amount = BigDecimal.ZERO; // Follows the line total once lines are priced

    @Column(precision = 5, scale = 2)
    private BigDecimal taxPercent = BigDecimal.ZERO;

    @Column(precision = 5, scale = 2)
    private BigDecimal discountPercent = BigDecimal.ZERO;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private InvoiceStatus status;

    @Column(length = 2000)
    private String description;

    @OneToMany(mappedBy = "invoice", cascade = CascadeType.ALL, orphanRemoval = true)
    @OrderBy("id")
    @ToString.Exclude
    @EqualsAndHashCode.Exclude
    private List<InvoiceLine> lines = new ArrayList<>();

    @OneToMany(mappedBy = "invoice")
    @ToString.Exclude
    @EqualsAndHashCode.Exclude
    private List<Payment> payments = new ArrayList<>();

    @OneToMany(mappedBy = "invoice")
    @ToString.Exclude
    @EqualsAndHashCode.Exclude
    private List<ClientAdvanceAllocation> advanceAllocations = new ArrayList<>();

    @Column(updatable = false)
    private LocalDateTime createdAt;

    @PrePersist
    protected void onCreate() {
        createdAt = LocalDateTime.now();
        if (status == null)
            status = InvoiceStatus.DRAFT;
    }

    public void addLine(InvoiceLine line) {
        line.setInvoice(this);
        lines.add(line);
    }

    /**
     * Client billed by this invoice: the project's client, or the converted lead's.
     */
    public Client getBilledClient() {
        if (project != null)
            return project.getClient();
        return lead != null ? lead.getClient() : null;
    }

    public InvoiceValuation getValuation() {
        return InvoiceValuation.of(this);
    }

    public BigDecimal getSubtotal() {
        return getValuation().getSubtotal();
    }

    public BigDecimal getTotalWithTax() {
        return getValuation().getTotalWithTax();
    }

    public BigDecimal getAmountReceived() {
        return getValuation().getAmountReceived();
    }

    public BigDecimal getAdvanceApplied() {
        return getValuation().getAdvanceApplied();
    }

    public BigDecimal getAmountSettled() {
        return getValuation().getAmountSettled();
    }

    public BigDecimal getOutstanding() {
        return getValuation().getOutstanding();
    }
}
