package com.studioflow.finance.service;

import com.studioflow.finance.dto.AgingReport;
import com.studioflow.finance.dto.AgingRow;
import com.studioflow.finance.dto.PaymentRequest;
import com.studioflow.finance.exception.ResourceNotFoundException;
import com.studioflow.finance.exception.ValidationException;
import com.studioflow.finance.model.*;
import com.studioflow.finance.repository.AccountRepository;
import com.studioflow.finance.repository.BillPaymentRepository;
import com.studioflow.finance.repository.BillRepository;
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

/**
 * Vendor bills and what the firm has paid against them.
 */
@Slf4j
@Service
public class BillService {

    private final BillRepository billRepository;
    private final BillPaymentRepository billPaymentRepository;
    private final AccountRepository accountRepository;
    private final LedgerSyncService ledgerSyncService;
    private final AuditService auditService;
    private final Clock clock;

    public BillService(BillRepository billRepository, BillPaymentRepository billPaymentRepository,
            AccountRepository accountRepository, LedgerSyncService ledgerSyncService, AuditService auditService,
            Clock clock) {
        this.billRepository = billRepository;
        this.billPaymentRepository = billPaymentRepository;
        this.accountRepository = accountRepository;
        this.ledgerSyncService = ledgerSyncService;
        this.auditService = auditService;
        this.clock = clock;
    }

    @Transactional
    public Bill createBill(Bill bill) {
        if (bill.getVendor() == null) {
            throw new ValidationException("vendor", "Vendor is required.");
        }
        if (bill.getBillDate() == null) {
            throw new ValidationException("billDate", "Bill date is required.");
        }
        if (bill.getDueDate() != null && bill.getDueDate().isBefore(bill.getBillDate())) {
            throw new ValidationException("dueDate", "Due date cannot be earlier than the bill date.");
        }
        bill.setAmount(MoneyUtils.requirePositive(bill.getAmount()));
        if (bill.getCategory() == null) {
            bill.setCategory(TransactionCategory.PROJECT_EXPENSE);
        }
        String actor = auditService.currentActor();
        bill.setCreatedBy(actor);
        bill.setStatus(StatusRules.billStatus(bill.getAmount(), bill.getOutstanding(), bill.getDueDate(),
                LocalDate.now(clock)));

        Bill saved = billRepository.save(bill);
        auditService.log("CREATE_BILL", "Bill " + describe(saved) + ", Amount: " + saved.getAmount(), actor);
        return saved;
    }

    public Bill getBill(Long billId) {
        return billRepository.findById(billId).orElseThrow(() -> new ResourceNotFoundException("Bill", billId));
    }

    @Transactional
    public BillPayment recordBillPayment(Long billId, PaymentRequest request) {
        Bill bill = getBill(billId);
        BigDecimal amount = MoneyUtils.requirePositive(request.getAmount());

        BigDecimal outstanding = bill.getOutstanding();
        if (outstanding.signum() <= 0) {
            throw new ValidationException("This bill is already paid.");
        }
        if (amount.compareTo(outstanding) > 0) {
            throw new ValidationException("amount", "Payment exceeds the outstanding balance of " + outstanding + ".");
        }

        String actor = auditService.currentActor();
        BillPayment payment = new BillPayment();
        payment.setBill(bill);
        payment.setRecordedBy(actor);
        apply(payment, request, amount);

        BillPayment saved = billPaymentRepository.save(payment);
        bill.getPayments().add(saved);

        ledgerSyncService.syncBillPayment(saved);
        refreshStatus(bill, true, LocalDate.now(clock));

        log.info("Recorded payment {} of {} against bill {}", saved.getId(), saved.getAmount(), describe(bill));
        auditService.log("RECORD_BILL_PAYMENT", "Bill " + describe(bill) + ", Amount: " + saved.getAmount(), actor);
        return saved;
    }

    @Transactional
    public BillPayment updateBillPayment(Long billPaymentId, PaymentRequest request) {
        BillPayment payment = getBillPayment(billPaymentId);
        Bill bill = payment.getBill();
        BigDecimal amount = MoneyUtils.requirePositive(request.getAmount());

        BigDecimal headroom = bill.getOutstanding().add(MoneyUtils.scale(payment.getAmount()));
        if (amount.compareTo(headroom) > 0) {
            throw new ValidationException("amount", "Payment exceeds the outstanding balance of " + headroom + ".");
        }

        apply(payment, request, amount);
        BillPayment saved = billPaymentRepository.save(payment);

        ledgerSyncService.syncBillPayment(saved);
        refreshStatus(bill, true, LocalDate.now(clock));
        auditService.log("UPDATE_BILL_PAYMENT", "Bill " + describe(bill) + ", Amount: " + saved.getAmount());
        return saved;
    }

    @Transactional
    public void deleteBillPayment(Long billPaymentId) {
        BillPayment payment = getBillPayment(billPaymentId);
        Bill bill = payment.getBill();

        ledgerSyncService.removeEntry(LedgerOrigin.billPayment(billPaymentId));
        bill.getPayments().remove(payment);
        billPaymentRepository.delete(payment);

        refreshStatus(bill, true, LocalDate.now(clock));
        auditService.log("DELETE_BILL_PAYMENT", "Bill " + describe(bill) + ", Amount: " + payment.getAmount());
    }

    @Transactional
    public BillStatus refreshStatus(Long billId, boolean save, LocalDate today) {
        return refreshStatus(getBill(billId), save, today != null ? today : LocalDate.now(clock));
    }

    @Transactional
    public BillStatus refreshStatus(Bill bill, boolean save, LocalDate today) {
        BillStatus computed = StatusRules.billStatus(MoneyUtils.scale(bill.getAmount()), bill.getOutstanding(),
                bill.getDueDate(), today);
        if (save && computed != bill.getStatus()) {
            log.debug("Bill {} status {} -> {}", bill.getId(), bill.getStatus(), computed);
            bill.setStatus(computed);
            billRepository.save(bill);
        }
        return computed;
    }

    /**
     * Unpaid bills bucketed by days past their effective due date.
     */
    @Transactional(readOnly = true)
    public AgingReport agingReport(LocalDate today) {
        AgingReport report = new AgingReport(today);
        List<Bill> bills = billRepository.findByStatusNot(BillStatus.PAID);
        bills.sort(Comparator.comparing(Bill::getEffectiveDueDate));
        for (Bill bill : bills) {
            BillStatus status = refreshStatus(bill, false, today);
            BigDecimal outstanding = bill.getOutstanding();
            if (outstanding.signum() <= 0)
                continue;
            long daysOverdue = Math.max(ChronoUnit.DAYS.between(bill.getEffectiveDueDate(), today), 0);
            report.add(new AgingRow(bill.getId(), bill.getBillNumber(), bill.getVendor().getName(),
                    bill.getEffectiveDueDate(), daysOverdue, outstanding, status.name()));
        }
        return report;
    }

    private BillPayment getBillPayment(Long billPaymentId) {
        return billPaymentRepository.findById(billPaymentId)
                .orElseThrow(() -> new ResourceNotFoundException("Bill payment", billPaymentId));
    }

    private void apply(BillPayment payment, PaymentRequest request, BigDecimal amount) {
        payment.setAmount(amount);
        payment.setPaymentDate(request.getPaymentDate() != null ? request.getPaymentDate() : LocalDate.now(clock));
        payment.setAccount(request.getAccountId() == null ? null
                : accountRepository.findById(request.getAccountId())
                        .orElseThrow(() -> new ResourceNotFoundException("Account", request.getAccountId())));
        payment.setMethod(request.getMethod());
        payment.setReference(request.getReference());
        payment.setNotes(request.getNotes());
    }

    private static String describe(Bill bill) {
        String vendor = bill.getVendor() != null ? bill.getVendor().getName() : "?";
        return bill.getBillNumber() != null ? bill.getBillNumber() + " (" + vendor + ")" : vendor;
    }
}
