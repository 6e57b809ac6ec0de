package com.studioflow.finance.dto;

import lombok.Data;

import java.math.BigDecimal;
import java.time.LocalDate;

@Data
public class AgingRow {
    private Long documentId;
    private String documentNumber;
    private String counterparty; // client for invoices, vendor for bills
    private LocalDate dueDate;
    private long daysOverdue;
    private BigDecimal outstanding;
    private String status;

    public AgingRow(Long documentId, String documentNumber, String counterparty, LocalDate dueDate,
            long daysOverdue, BigDecimal outstanding, String status) {
        this.documentId = documentId;
        this.documentNumber = documentNumber;
        this.counterparty = counterparty;
        this.dueDate = dueDate;
        this.daysOverdue = daysOverdue;
        this.outstanding = outstanding;
        this.status = status;
    }
}
