package com.studioflow.finance.service;

import com.studioflow.finance.dto.PaymentRequest;
import com.studioflow.finance.event.PaymentRecordedEvent;
import com.studioflow.finance.exception.ResourceNotFoundException;
import com.studioflow.finance.exception.ValidationException;
import com.studioflow.finance.model.Account;
import com.studioflow.finance.model.Invoice;
import com.studioflow.finance.model.LedgerOrigin;
import com.studioflow.finance.model.Payment;
import com.studioflow.finance.repository.AccountRepository;
import com.studioflow.finance.repository.PaymentRepository;
import com.studioflow.finance.util.MoneyUtils;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDate;
import java.util.List;

/**
 * Client payments against invoices. Every change to a payment is mirrored into the
 * cashbook and followed by a status refresh of its invoice, inside one transaction.
 */
@Slf4j
@Service
public class PaymentService {

    private final PaymentRepository paymentRepository;
    private final AccountRepository accountRepository;
    private final InvoiceService invoiceService;
    private final LedgerSyncService ledgerSyncService;
    private final ReceiptService receiptService;
    private final SettingsService settingsService;
    private final AuditService auditService;
    private final ApplicationEventPublisher eventPublisher;
    private final Clock clock;

    public PaymentService(PaymentRepository paymentRepository, AccountRepository accountRepository,
            InvoiceService invoiceService, LedgerSyncService ledgerSyncService, ReceiptService receiptService,
            SettingsService settingsService, AuditService auditService, ApplicationEventPublisher eventPublisher,
            Clock clock) {
        this.paymentRepository = paymentRepository;
        this.accountRepository = accountRepository;
        this.invoiceService = invoiceService;
        this.ledgerSyncService = ledgerSyncService;
        this.receiptService = receiptService;
        this.settingsService = settingsService;
        this.auditService = auditService;
        this.eventPublisher = eventPublisher;
        this.clock = clock;
    }

    @Transactional
    public Payment recordPayment(Long invoiceId, PaymentRequest request) {
        Invoice invoice = invoiceService.getInvoice(invoiceId);
        BigDecimal amount = MoneyUtils.requirePositive(request.getAmount());

        BigDecimal outstanding = invoice.getOutstanding();
        if (outstanding.signum() <= 0) {
            throw new ValidationException("This invoice is already settled.");
        }
        if (amount.compareTo(outstanding) > 0) {
            throw new ValidationException("amount", "Payment exceeds the outstanding balance of " + outstanding + ".");
        }

        String actor = auditService.currentActor();
        Payment payment = new Payment();
        payment.setInvoice(invoice);
        payment.setRecordedBy(actor);
        apply(payment, request, amount);

        Payment saved = paymentRepository.save(payment);
        invoice.getPayments().add(saved);

        LocalDate today = LocalDate.now(clock);
        ledgerSyncService.syncPayment(saved);
        invoiceService.refreshStatus(invoice, true, today);

        if (settingsService.isAutoReceipt()) {
            receiptService.generateReceipt(saved, null);
        }

        log.info("Recorded payment {} of {} against invoice {}", saved.getId(), saved.getAmount(),
                invoice.getInvoiceNumber());
        auditService.log("RECORD_PAYMENT", "Invoice " + invoice.getInvoiceNumber() + ", Amount: "
                + saved.getAmount(), actor);
        eventPublisher.publishEvent(new PaymentRecordedEvent(saved.getId(), invoice.getId(),
                invoice.getInvoiceNumber(), saved.getAmount(), saved.getPaymentDate(), actor));
        return saved;
    }

    /**
     * Edits a payment in place. The new amount may use up to the invoice's outstanding
     * balance plus what this payment already covered.
     */
    @Transactional
    public Payment updatePayment(Long paymentId, PaymentRequest request) {
        Payment payment = getPayment(paymentId);
        Invoice invoice = payment.getInvoice();
        BigDecimal amount = MoneyUtils.requirePositive(request.getAmount());

        BigDecimal headroom = invoice.getOutstanding().add(MoneyUtils.scale(payment.getAmount()));
        if (amount.compareTo(headroom) > 0) {
            throw new ValidationException("amount", "Payment exceeds the outstanding balance of " + headroom + ".");
        }

        BigDecimal previous = payment.getAmount();
        apply(payment, request, amount);
        Payment saved = paymentRepository.save(payment);

        ledgerSyncService.syncPayment(saved);
        invoiceService.refreshStatus(invoice, true, LocalDate.now(clock));
        receiptService.refreshFromPayment(saved);

        auditService.log("UPDATE_PAYMENT", "Invoice " + invoice.getInvoiceNumber() + ", Amount: " + previous
                + " -> " + saved.getAmount());
        return saved;
    }

    /**
     * Removes a payment together with its cashbook row. An issued receipt is kept but
     * no longer points at the payment.
     */
    @Transactional
    public void deletePayment(Long paymentId) {
        Payment payment = getPayment(paymentId);
        Invoice invoice = payment.getInvoice();

        ledgerSyncService.removeEntry(LedgerOrigin.payment(paymentId));
        receiptService.detachPayment(paymentId);
        invoice.getPayments().remove(payment);
        paymentRepository.delete(payment);

        invoiceService.refreshStatus(invoice, true, LocalDate.now(clock));
        log.info("Deleted payment {} from invoice {}", paymentId, invoice.getInvoiceNumber());
        auditService.log("DELETE_PAYMENT", "Invoice " + invoice.getInvoiceNumber() + ", Amount: "
                + payment.getAmount());
    }

    public Payment getPayment(Long paymentId) {
        return paymentRepository.findById(paymentId)
                .orElseThrow(() -> new ResourceNotFoundException("Payment", paymentId));
    }

    public List<Payment> paymentsForInvoice(Long invoiceId) {
        return paymentRepository.findByInvoiceIdOrderByPaymentDateAsc(invoiceId);
    }

    private void apply(Payment payment, PaymentRequest request, BigDecimal amount) {
        payment.setAmount(amount);
        payment.setPaymentDate(request.getPaymentDate() != null ? request.getPaymentDate() : LocalDate.now(clock));
        payment.setAccount(resolveAccount(request.getAccountId()));
        payment.setMethod(request.getMethod());
        payment.setReference(request.getReference());
        payment.setNotes(request.getNotes());
        payment.setReceivedBy(request.getReceivedBy());
    }

    private Account resolveAccount(Long accountId) {
        if (accountId == null)
            return null;
        return accountRepository.findById(accountId)
                .orElseThrow(() -> new ResourceNotFoundException("Account", accountId));
    }
}
