package com.studioflow.finance.model;

import com.studioflow.finance.util.MoneyUtils;
import jakarta.persistence.*;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.ToString;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Vendor invoice payable by the firm.
 */
@Entity
@Table(name = "bills")
@Data
public class Bill {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne
    @JoinColumn(name = "vendor_id", nullable = false)
    private Vendor vendor;

    @ManyToOne
    @JoinColumn(name = "project_id")
    private Project project;

    private String billNumber;

    @Column(nullable = false)
    private LocalDate billDate;

    private LocalDate dueDate;

    @Column(nullable = false, precision = 12, scale = 2)
    private BigDecimal amount;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private TransactionCategory category = TransactionCategory.PROJECT_EXPENSE;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private BillStatus status;

    @Column(length = 1000)
    private String notes;

    private String createdBy;

    @OneToMany(mappedBy = "bill")
    @ToString.Exclude
    @EqualsAndHashCode.Exclude
    private List<BillPayment> payments = new ArrayList<>();

    @Column(updatable = false)
    private LocalDateTime createdAt;

    @PrePersist
    protected void onCreate() {
        createdAt = LocalDateTime.now();
        if (status == null)
            status = BillStatus.UNPAID;
    }

    public BigDecimal getAmountPaid() {
        return MoneyUtils.sum(payments.stream().map(BillPayment::getAmount));
    }

    public BigDecimal getOutstanding() {
        return MoneyUtils.max(MoneyUtils.scale(MoneyUtils.scale(amount).subtract(getAmountPaid())),
                MoneyUtils.zero());
    }

    /**
     * Due date used for aging; bills without one age from the bill date. Status
     * only turns OVERDUE against an explicit due date.
     */
    public LocalDate getEffectiveDueDate() {
        return dueDate != null ? dueDate : billDate;
    }
}
