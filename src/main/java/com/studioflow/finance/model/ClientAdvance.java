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
 * Money received from a client before it is billed (retainer). Applied to invoices
 * through {@link ClientAdvanceAllocation}s.
 */
@Entity
@Table(name = "client_advances")
@Data
public class ClientAdvance {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne
    @JoinColumn(name = "client_id", nullable = false)
    private Client client;

    @ManyToOne
    @JoinColumn(name = "project_id")
    private Project project;

    @Column(nullable = false)
    private LocalDate receivedDate;

    @Column(nullable = false, precision = 12, scale = 2)
    private BigDecimal amount;

    @ManyToOne
    @JoinColumn(name = "account_id")
    private Account account;

    private String method;
    private String reference;

    @Column(length = 1000)
    private String notes;

    private String receivedBy;
    private String recordedBy;

    @OneToMany(mappedBy = "advance")
    @ToString.Exclude
    @EqualsAndHashCode.Exclude
    private List<ClientAdvanceAllocation> allocations = new ArrayList<>();

    @Column(updatable = false)
    private LocalDateTime createdAt;

    @PrePersist
    protected void onCreate() {
        createdAt = LocalDateTime.now();
        if (receivedDate == null)
            receivedDate = LocalDate.now();
    }

    public BigDecimal getAllocatedAmount() {
        return MoneyUtils.sum(allocations.stream().map(ClientAdvanceAllocation::getAmount));
    }

    public BigDecimal getAvailableAmount() {
        return MoneyUtils.scale(MoneyUtils.scale(amount).subtract(getAllocatedAmount()));
    }
}
