package com.studioflow.finance.service;

import com.studioflow.finance.dto.PaymentRequest;
import com.studioflow.finance.exception.ResourceNotFoundException;
import com.studioflow.finance.exception.ValidationException;
import com.studioflow.finance.model.ExpenseClaim;
import com.studioflow.finance.model.ExpenseClaimPayment;
import com.studioflow.finance.model.ExpenseClaimStatus;
import com.studioflow.finance.repository.AccountRepository;
import com.studioflow.finance.repository.ExpenseClaimPaymentRepository;
import com.studioflow.finance.repository.ExpenseClaimRepository;
import com.studioflow.finance.util.MoneyUtils;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;

/**
 * Employee reimbursements: SUBMITTED, then APPROVED or REJECTED, then PAID once.
 */
@Slf4j
@Service
public class ExpenseClaimService {

    private final ExpenseClaimRepository claimRepository;
    private final ExpenseClaimPaymentRepository claimPaymentRepository;
    private final AccountRepository accountRepository;
    private final LedgerSyncService ledgerSyncService;
    private final AuditService auditService;
    private final Clock clock;

    public ExpenseClaimService(ExpenseClaimRepository claimRepository,
            ExpenseClaimPaymentRepository claimPaymentRepository, AccountRepository accountRepository,
            LedgerSyncService ledgerSyncService, AuditService auditService, Clock clock) {
        this.claimRepository = claimRepository;
        this.claimPaymentRepository = claimPaymentRepository;
        this.accountRepository = accountRepository;
        this.ledgerSyncService = ledgerSyncService;
        this.auditService = auditService;
        this.clock = clock;
    }

    @Transactional
    public ExpenseClaim submitClaim(ExpenseClaim claim) {
        if (claim.getEmployee() == null || claim.getEmployee().isBlank()) {
            throw new ValidationException("employee", "Employee is required.");
        }
        if (claim.getExpenseDate() == null) {
            throw new ValidationException("expenseDate", "Expense date is required.");
        }
        claim.setAmount(MoneyUtils.requirePositive(claim.getAmount()));
        claim.setStatus(ExpenseClaimStatus.SUBMITTED);

        ExpenseClaim saved = claimRepository.save(claim);
        auditService.log("SUBMIT_CLAIM", "Claim " + saved.getId() + " by " + saved.getEmployee() + ", Amount: "
                + saved.getAmount());
        return saved;
    }

    @Transactional
    public ExpenseClaim approveClaim(Long claimId) {
        ExpenseClaim claim = getClaim(claimId);
        if (claim.getStatus() != ExpenseClaimStatus.SUBMITTED) {
            throw new IllegalStateException("Only submitted claims can be approved. Current status: "
                    + claim.getStatus());
        }
        String actor = auditService.currentActor();
        claim.setStatus(ExpenseClaimStatus.APPROVED);
        claim.setApprovedBy(actor);
        claim.setApprovedAt(LocalDateTime.now(clock));

        ExpenseClaim saved = claimRepository.save(claim);
        auditService.log("APPROVE_CLAIM", "Claim " + claimId + " by " + claim.getEmployee(), actor);
        return saved;
    }

    @Transactional
    public ExpenseClaim rejectClaim(Long claimId) {
        ExpenseClaim claim = getClaim(claimId);
        if (claim.getStatus() == ExpenseClaimStatus.PAID) {
            throw new IllegalStateException("A paid claim cannot be rejected.");
        }
        claim.setStatus(ExpenseClaimStatus.REJECTED);
        ExpenseClaim saved = claimRepository.save(claim);
        auditService.log("REJECT_CLAIM", "Claim " + claimId + " by " + claim.getEmployee());
        return saved;
    }

    /**
     * Reimburses an approved claim. The amount defaults to the claimed amount.
     */
    @Transactional
    public ExpenseClaimPayment payClaim(Long claimId, PaymentRequest request) {
        ExpenseClaim claim = getClaim(claimId);
        if (claim.getStatus() != ExpenseClaimStatus.APPROVED) {
            throw new IllegalStateException("Only approved claims can be paid. Current status: " + claim.getStatus());
        }
        if (claimPaymentRepository.existsByClaimId(claimId)) {
            throw new IllegalStateException("Claim " + claimId + " has already been paid.");
        }
        BigDecimal amount = MoneyUtils.requirePositive(
                request.getAmount() != null ? request.getAmount() : claim.getAmount());

        String actor = auditService.currentActor();
        ExpenseClaimPayment payment = new ExpenseClaimPayment();
        payment.setClaim(claim);
        payment.setAmount(amount);
        payment.setPaymentDate(request.getPaymentDate() != null ? request.getPaymentDate() : LocalDate.now(clock));
        payment.setAccount(request.getAccountId() == null ? null
                : accountRepository.findById(request.getAccountId())
                        .orElseThrow(() -> new ResourceNotFoundException("Account", request.getAccountId())));
        payment.setMethod(request.getMethod());
        payment.setReference(request.getReference());
        payment.setRecordedBy(actor);

        ExpenseClaimPayment saved = claimPaymentRepository.save(payment);
        ledgerSyncService.syncExpenseClaimPayment(saved);
        claim.setStatus(ExpenseClaimStatus.PAID);
        claimRepository.save(claim);

        log.info("Paid claim {} of {} to {}", claimId, amount, claim.getEmployee());
        auditService.log("PAY_CLAIM", "Claim " + claimId + " to " + claim.getEmployee() + ", Amount: " + amount,
                actor);
        return saved;
    }

    public ExpenseClaim getClaim(Long claimId) {
        return claimRepository.findById(claimId)
                .orElseThrow(() -> new ResourceNotFoundException("Expense claim", claimId));
    }

    public List<ExpenseClaim> pendingApproval() {
        return claimRepository.findByStatus(ExpenseClaimStatus.SUBMITTED);
    }

    public List<ExpenseClaim> claimsBy(String employee) {
        return claimRepository.findByEmployeeOrderByExpenseDateDesc(employee);
    }
}
