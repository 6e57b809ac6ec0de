package com.studioflow.finance.service;

import com.studioflow.finance.event.ReceiptGeneratedEvent;
import com.studioflow.finance.exception.ResourceNotFoundException;
import com.studioflow.finance.exception.ValidationException;
import com.studioflow.finance.model.Invoice;
import com.studioflow.finance.model.Payment;
import com.studioflow.finance.model.Project;
import com.studioflow.finance.model.Receipt;
import com.studioflow.finance.repository.PaymentRepository;
import com.studioflow.finance.repository.ReceiptRepository;
import com.studioflow.finance.util.MoneyUtils;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;

@Slf4j
@Service
public class ReceiptService {

    private static final DateTimeFormatter DATE_PART = DateTimeFormatter.BASIC_ISO_DATE;
    private static final String GENERIC_CODE = "GEN";

    private final ReceiptRepository receiptRepository;
    private final PaymentRepository paymentRepository;
    private final SettingsService settingsService;
    private final AuditService auditService;
    private final ApplicationEventPublisher eventPublisher;
    private final Clock clock;

    public ReceiptService(ReceiptRepository receiptRepository, PaymentRepository paymentRepository,
            SettingsService settingsService, AuditService auditService, ApplicationEventPublisher eventPublisher,
            Clock clock) {
        this.receiptRepository = receiptRepository;
        this.paymentRepository = paymentRepository;
        this.settingsService = settingsService;
        this.auditService = auditService;
        this.eventPublisher = eventPublisher;
        this.clock = clock;
    }

    @Transactional
    public Receipt generateReceipt(Long paymentId, String notes) {
        Payment payment = paymentRepository.findById(paymentId)
                .orElseThrow(() -> new ResourceNotFoundException("Payment", paymentId));
        return generateReceipt(payment, notes);
    }

    /**
     * Issues the receipt for a saved payment. A payment gets at most one receipt.
     */
    @Transactional
    public Receipt generateReceipt(Payment payment, String notes) {
        if (payment.getId() == null) {
            throw new ValidationException("payment", "Payment must be saved before a receipt is issued.");
        }
        if (receiptRepository.existsByPaymentId(payment.getId())) {
            throw new ValidationException("A receipt already exists for this payment.");
        }

        Invoice invoice = payment.getInvoice();
        LocalDate receiptDate = payment.getPaymentDate() != null ? payment.getPaymentDate() : LocalDate.now(clock);
        String actor = auditService.currentActor();

        Receipt receipt = new Receipt();
        receipt.setReceiptNumber(nextReceiptNumber(invoice.getProject(), receiptDate));
        receipt.setPayment(payment);
        receipt.setInvoice(invoice);
        receipt.setProject(invoice.getProject());
        receipt.setClient(invoice.getBilledClient());
        receipt.setLead(invoice.getLead());
        receipt.setReceiptDate(receiptDate);
        receipt.setAmount(MoneyUtils.scale(payment.getAmount()));
        receipt.setMethod(payment.getMethod());
        receipt.setReference(payment.getReference());
        receipt.setNotes(notes);
        receipt.setGeneratedBy(actor);

        Receipt saved = receiptRepository.save(receipt);
        log.info("Generated receipt {} for payment {}", saved.getReceiptNumber(), payment.getId());
        auditService.log("GENERATE_RECEIPT", "Receipt " + saved.getReceiptNumber() + " for invoice "
                + invoice.getInvoiceNumber() + ", Amount: " + saved.getAmount(), actor);
        eventPublisher.publishEvent(new ReceiptGeneratedEvent(saved.getId(), saved.getReceiptNumber(),
                payment.getId(), saved.getAmount(), actor));
        return saved;
    }

    /**
     * Brings an issued receipt's copied figures in line with an edited payment.
     */
    @Transactional
    public void refreshFromPayment(Payment payment) {
        receiptRepository.findByPaymentId(payment.getId()).ifPresent(receipt -> {
            receipt.setAmount(MoneyUtils.scale(payment.getAmount()));
            receipt.setReceiptDate(payment.getPaymentDate());
            receipt.setMethod(payment.getMethod());
            receipt.setReference(payment.getReference());
            receiptRepository.save(receipt);
        });
    }

    /**
     * Keeps the receipt of a payment being deleted, minus its link to the payment.
     */
    @Transactional
    public void detachPayment(Long paymentId) {
        receiptRepository.findByPaymentId(paymentId).ifPresent(receipt -> {
            receipt.setPayment(null);
            receiptRepository.save(receipt);
            log.debug("Detached receipt {} from deleted payment {}", receipt.getReceiptNumber(), paymentId);
        });
    }

    /**
     * {@code PREFIX-PROJECTCODE-yyyyMMdd-NNN}, numbered per prefix, project and day.
     */
    String nextReceiptNumber(Project project, LocalDate receiptDate) {
        String stem = settingsService.getReceiptPrefix() + "-" + projectCode(project) + "-"
                + receiptDate.format(DATE_PART) + "-";
        long sequence = receiptRepository.countByReceiptNumberStartingWith(stem) + 1;
        return stem + String.format("%03d", sequence);
    }

    static String projectCode(Project project) {
        if (project == null || project.getCode() == null)
            return GENERIC_CODE;
        String code = project.getCode().toUpperCase().replaceAll("[^A-Z0-9]", "");
        return code.isEmpty() ? GENERIC_CODE : code;
    }
}
