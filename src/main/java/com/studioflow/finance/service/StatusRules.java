package com.studioflow.finance.service;

import com.studioflow.finance.model.BillStatus;
import com.studioflow.finance.model.InvoiceStatus;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * Status of invoices and bills as a function of their current balances. Bills are
 * recomputed from scratch; an invoice keeps its current status unless one of the rules
 * below applies, so a PAID invoice that gets money back stays PAID until it is overdue.
 */
public final class StatusRules {

    private StatusRules() {
    }

    /**
     * PAID when nothing is outstanding, else OVERDUE once past due, else a DRAFT is
     * promoted to SENT. Any other status is kept.
     */
    public static InvoiceStatus invoiceStatus(InvoiceStatus current, BigDecimal outstanding, LocalDate dueDate,
            LocalDate today) {
        if (outstanding == null || outstanding.signum() <= 0)
            return InvoiceStatus.PAID;
        if (dueDate != null && dueDate.isBefore(today))
            return InvoiceStatus.OVERDUE;
        if (current == null || current == InvoiceStatus.DRAFT)
            return InvoiceStatus.SENT;
        return current;
    }

    /**
     * PAID, then PARTIAL, then OVERDUE, then UNPAID. A part-paid bill past its due date
     * reports PARTIAL.
     */
    public static BillStatus billStatus(BigDecimal amount, BigDecimal outstanding, LocalDate dueDate,
            LocalDate today) {
        if (outstanding == null || outstanding.signum() <= 0)
            return BillStatus.PAID;
        if (amount != null && outstanding.compareTo(amount) < 0)
            return BillStatus.PARTIAL;
        if (dueDate != null && dueDate.isBefore(today))
            return BillStatus.OVERDUE;
        return BillStatus.UNPAID;
    }
}
