package com.studioflow.finance.service;

import com.studioflow.finance.dto.AgingReport;
import com.studioflow.finance.dto.AgingRow;
import com.studioflow.finance.exception.ResourceNotFoundException;
import com.studioflow.finance.exception.ValidationException;
import com.studioflow.finance.model.*;
import com.studioflow.finance.repository.InvoiceRepository;
import com.studioflow.finance.repository.PaymentRepository;
import com.studioflow.finance.util.MoneyUtils;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

@Slf4j
@Service
public class InvoiceService {

    private final InvoiceRepository invoiceRepository;
    private final PaymentRepository paymentRepository;
    private final AuditService auditService;
    private final Clock clock;

    public InvoiceService(InvoiceRepository invoiceRepository, PaymentRepository paymentRepository,
            AuditService auditService, Clock clock) {
        this.invoiceRepository = invoiceRepository;
        this.paymentRepository = paymentRepository;
        this.auditService = auditService;
        this.clock = clock;
    }

    /**
     * Saves a new invoice and evaluates its status straight away, so a DRAFT becomes
     * SENT, or OVERDUE when its due date has already passed.
     */
    @Transactional
    public Invoice createInvoice(Invoice invoice) {
        validate(invoice);
        applyLinesTotal(invoice);
        if (invoice.getInvoiceNumber() == null || invoice.getInvoiceNumber().isBlank()) {
            invoice.setInvoiceNumber(nextInvoiceNumber());
        }
        if (invoice.getStatus() == null) {
            invoice.setStatus(InvoiceStatus.DRAFT);
        }
        for (InvoiceLine line : invoice.getLines()) {
            line.setInvoice(invoice);
        }
        Invoice saved = invoiceRepository.save(invoice);
        refreshStatus(saved, true, LocalDate.now(clock));
        auditService.log("CREATE_INVOICE", "Invoice " + saved.getInvoiceNumber() + ", Total: "
                + saved.getTotalWithTax());
        return saved;
    }

    /**
     * Replaces the editable fields and the lines of an invoice, then re-evaluates its
     * status since the total or the due date may have moved.
     */
    @Transactional
    public Invoice updateInvoice(Long invoiceId, Invoice changes) {
        Invoice invoice = getInvoice(invoiceId);
        invoice.setProject(changes.getProject());
        invoice.setLead(changes.getLead());
        invoice.setInvoiceDate(changes.getInvoiceDate());
        invoice.setDueDate(changes.getDueDate());
        invoice.setAmount(changes.getAmount());
        invoice.setTaxPercent(changes.getTaxPercent());
        invoice.setDiscountPercent(changes.getDiscountPercent());
        invoice.setDescription(changes.getDescription());
        if (changes.getStatus() != null) {
            invoice.setStatus(changes.getStatus());
        }
        invoice.getLines().clear();
        for (InvoiceLine line : changes.getLines()) {
            InvoiceLine copy = new InvoiceLine(line.getDescription(), line.getQuantity(), line.getUnitPrice());
            invoice.addLine(copy);
        }
        validate(invoice);
        applyLinesTotal(invoice);

        Invoice saved = invoiceRepository.save(invoice);
        refreshStatus(saved, true, LocalDate.now(clock));
        auditService.log("UPDATE_INVOICE", "Invoice " + saved.getInvoiceNumber());
        return saved;
    }

    @Transactional
    public void deleteInvoice(Long invoiceId) {
        Invoice invoice = getInvoice(invoiceId);
        if (paymentRepository.existsByInvoiceId(invoiceId)) {
            throw new ValidationException("Cannot delete an invoice with recorded payments.");
        }
        if (!invoice.getAdvanceAllocations().isEmpty()) {
            throw new ValidationException("Cannot delete an invoice with applied advances.");
        }
        invoiceRepository.delete(invoice);
        auditService.log("DELETE_INVOICE", "Invoice " + invoice.getInvoiceNumber());
    }

    public Invoice getInvoice(Long invoiceId) {
        return invoiceRepository.findById(invoiceId)
                .orElseThrow(() -> new ResourceNotFoundException("Invoice", invoiceId));
    }

    public InvoiceValuation getValuation(Long invoiceId) {
        return getInvoice(invoiceId).getValuation();
    }

    @Transactional
    public InvoiceStatus refreshStatus(Long invoiceId, boolean save, LocalDate today) {
        return refreshStatus(getInvoice(invoiceId), save, today != null ? today : LocalDate.now(clock));
    }

    /**
     * Recomputes the invoice's status from its current balance. With {@code save}
     * false the computed status is only returned; the entity is left untouched so a
     * managed instance is never flushed with it.
     */
    @Transactional
    public InvoiceStatus refreshStatus(Invoice invoice, boolean save, LocalDate today) {
        InvoiceStatus computed = StatusRules.invoiceStatus(invoice.getStatus(), invoice.getOutstanding(),
                invoice.getDueDate(), today);
        if (save && computed != invoice.getStatus()) {
            log.debug("Invoice {} status {} -> {}", invoice.getInvoiceNumber(), invoice.getStatus(), computed);
            invoice.setStatus(computed);
            invoiceRepository.save(invoice);
        }
        return computed;
    }

    /**
     * Unpaid invoices bucketed by days past due, evaluated against {@code today}
     * without persisting any status change.
     */
    @Transactional(readOnly = true)
    public AgingReport agingReport(LocalDate today) {
        AgingReport report = new AgingReport(today);
        List<Invoice> invoices = invoiceRepository.findByStatusNot(InvoiceStatus.PAID);
        invoices.sort(Comparator.comparing(Invoice::getDueDate));
        for (Invoice invoice : invoices) {
            InvoiceStatus status = refreshStatus(invoice, false, today);
            BigDecimal outstanding = invoice.getOutstanding();
            if (outstanding.signum() <= 0)
                continue;
            long daysOverdue = Math.max(ChronoUnit.DAYS.between(invoice.getDueDate(), today), 0);
            Client client = invoice.getBilledClient();
            String counterparty = client != null ? client.getName()
                    : invoice.getLead() != null ? invoice.getLead().getName() : null;
            report.add(new AgingRow(invoice.getId(), invoice.getInvoiceNumber(), counterparty,
                    invoice.getDueDate(), daysOverdue, outstanding, status.name()));
        }
        return report;
    }

    void validate(Invoice invoice) {
        if (invoice.getProject() == null && invoice.getLead() == null) {
            throw new ValidationException("Select a project or a lead to bill.");
        }
        if (invoice.getInvoiceDate() == null) {
            throw new ValidationException("invoiceDate", "Invoice date is required.");
        }
        if (invoice.getDueDate() == null) {
            throw new ValidationException("dueDate", "Due date is required.");
        }
        if (invoice.getDueDate().isBefore(invoice.getInvoiceDate())) {
            throw new ValidationException("dueDate", "Due date cannot be earlier than the invoice date.");
        }
        if (invoice.getAmount() == null || invoice.getAmount().signum() < 0) {
            throw new ValidationException("amount", "Amount cannot be negative.");
        }
        if (invoice.getTaxPercent() == null || invoice.getTaxPercent().signum() < 0) {
            throw new ValidationException("taxPercent", "Tax percent cannot be negative.");
        }
        if (invoice.getDiscountPercent() == null || invoice.getDiscountPercent().signum() < 0) {
            throw new ValidationException("discountPercent", "Discount percent cannot be negative.");
        }
        for (InvoiceLine line : invoice.getLines()) {
            if (line.getDescription() == null || line.getDescription().isBlank()) {
                throw new ValidationException("lines", "Every line needs a description.");
            }
            if (line.getUnitPrice() == null || line.getUnitPrice().signum() < 0
                    || line.getQuantity() == null || line.getQuantity().signum() < 0) {
                throw new ValidationException("lines", "Line quantity and unit price cannot be negative.");
            }
        }
        BigDecimal linesTotal = linesTotal(invoice);
        if (linesTotal.signum() != 0 && invoice.getAmount().signum() != 0
                && MoneyUtils.scale(invoice.getAmount()).compareTo(linesTotal) != 0) {
            throw new ValidationException("amount", "Total amount must match line items (" + linesTotal + ").");
        }
    }

    /**
     * Once an invoice has priced lines its flat amount follows them, so the stored
     * figure never disagrees with the lines it was entered with.
     */
    private void applyLinesTotal(Invoice invoice) {
        BigDecimal linesTotal = linesTotal(invoice);
        if (linesTotal.signum() != 0) {
            invoice.setAmount(linesTotal);
        }
    }

    private static BigDecimal linesTotal(Invoice invoice) {
        return MoneyUtils.sum(invoice.getLines().stream().map(InvoiceLine::getLineTotal));
    }

    private String nextInvoiceNumber() {
        long nextNum = 1;
        Optional<Invoice> last = invoiceRepository.findTopByOrderByIdDesc();
        if (last.isPresent()) {
            String lastNumber = last.get().getInvoiceNumber();
            if (lastNumber != null && lastNumber.startsWith("INV-")) {
                try {
                    nextNum = Long.parseLong(lastNumber.substring(4)) + 1;
                } catch (NumberFormatException e) {
                    nextNum = invoiceRepository.count() + 1;
                }
            } else {
                nextNum = invoiceRepository.count() + 1;
            }
        }
        return String.format("INV-%05d", nextNum);
    }
}
