package com.studioflow.finance.service;

import com.studioflow.finance.exception.ResourceNotFoundException;
import com.studioflow.finance.exception.ValidationException;
import com.studioflow.finance.model.Account;
import com.studioflow.finance.model.LedgerEntry;
import com.studioflow.finance.model.Project;
import com.studioflow.finance.model.TransactionCategory;
import com.studioflow.finance.repository.LedgerEntryRepository;
import com.studioflow.finance.util.MoneyUtils;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDate;
import java.util.List;

/**
 * Hand-entered cashbook rows and balances. Rows mirrored from settlements are owned
 * by their source records and are changed only through those.
 */
@Slf4j
@Service
public class CashbookService {

    private final LedgerEntryRepository ledgerEntryRepository;
    private final AuditService auditService;
    private final Clock clock;

    public CashbookService(LedgerEntryRepository ledgerEntryRepository, AuditService auditService, Clock clock) {
        this.ledgerEntryRepository = ledgerEntryRepository;
        this.auditService = auditService;
        this.clock = clock;
    }

    @Transactional
    public LedgerEntry recordSalary(String employee, BigDecimal amount, LocalDate paidOn, Account account,
            Project project, String remarks) {
        if (employee == null || employee.isBlank()) {
            throw new ValidationException("employee", "Employee is required.");
        }
        LedgerEntry entry = new LedgerEntry();
        entry.setEntryDate(paidOn != null ? paidOn : LocalDate.now(clock));
        entry.setDescription(LedgerSyncService.truncate("Salary to " + employee.trim()));
        entry.setCategory(TransactionCategory.SALARY);
        entry.setDebit(MoneyUtils.requirePositive(amount));
        entry.setCredit(MoneyUtils.zero());
        entry.setAccount(account);
        entry.setRelatedProject(project);
        entry.setRelatedPerson(employee.trim());
        entry.setRemarks(remarks);
        return save(entry, "RECORD_SALARY");
    }

    /**
     * Saves a manual row. Exactly one of debit and credit must be non-zero.
     */
    @Transactional
    public LedgerEntry recordManualEntry(LedgerEntry entry) {
        if (entry.hasOrigin()) {
            throw new ValidationException("Mirrored entries cannot be entered by hand.");
        }
        if (entry.getDescription() == null || entry.getDescription().isBlank()) {
            throw new ValidationException("description", "Description is required.");
        }
        BigDecimal debit = MoneyUtils.scale(entry.getDebit());
        BigDecimal credit = MoneyUtils.scale(entry.getCredit());
        if (debit.signum() < 0 || credit.signum() < 0) {
            throw new ValidationException("Debit and credit cannot be negative.");
        }
        if ((debit.signum() > 0) == (credit.signum() > 0)) {
            throw new ValidationException("Enter either a debit or a credit amount.");
        }
        entry.setDebit(debit);
        entry.setCredit(credit);
        if (entry.getEntryDate() == null) {
            entry.setEntryDate(LocalDate.now(clock));
        }
        if (entry.getCategory() == null) {
            entry.setCategory(TransactionCategory.MISC);
        }
        return save(entry, "RECORD_LEDGER_ENTRY");
    }

    @Transactional
    public void deleteManualEntry(Long entryId) {
        LedgerEntry entry = ledgerEntryRepository.findById(entryId)
                .orElseThrow(() -> new ResourceNotFoundException("Ledger entry", entryId));
        if (entry.hasOrigin()) {
            throw new ValidationException("Entry " + entryId + " mirrors " + entry.getOriginKey()
                    + "; change the source record instead.");
        }
        ledgerEntryRepository.delete(entry);
        auditService.log("DELETE_LEDGER_ENTRY", "Entry " + entryId + ": " + entry.getDescription());
    }

    /**
     * Credits minus debits up to and including {@code asOf}.
     */
    public BigDecimal balanceAsOf(LocalDate asOf) {
        return MoneyUtils.scale(ledgerEntryRepository.balanceAsOf(asOf));
    }

    public BigDecimal accountBalanceAsOf(Long accountId, LocalDate asOf) {
        return MoneyUtils.scale(ledgerEntryRepository.accountBalanceAsOf(accountId, asOf));
    }

    public List<LedgerEntry> entriesBetween(LocalDate from, LocalDate to) {
        if (from.isAfter(to)) {
            throw new ValidationException("from", "Start date cannot be after end date.");
        }
        return ledgerEntryRepository.findByEntryDateBetweenOrderByEntryDateAscIdAsc(from, to);
    }

    public BigDecimal salaryPaidTo(String employee) {
        return MoneyUtils.sum(ledgerEntryRepository.findByCategoryAndRelatedPerson(TransactionCategory.SALARY, employee)
                .stream().map(LedgerEntry::getDebit));
    }

    private LedgerEntry save(LedgerEntry entry, String action) {
        String actor = auditService.currentActor();
        entry.setRecordedBy(actor);
        LedgerEntry saved = ledgerEntryRepository.save(entry);
        log.info("Recorded ledger entry {} ({}): debit {} credit {}", saved.getId(), saved.getCategory(),
                saved.getDebit(), saved.getCredit());
        auditService.log(action, saved.getDescription() + ", Debit: " + saved.getDebit() + ", Credit: "
                + saved.getCredit(), actor);
        return saved;
    }
}
