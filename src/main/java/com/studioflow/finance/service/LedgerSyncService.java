package com.studioflow.finance.service;

import com.studioflow.finance.model.*;
import com.studioflow.finance.repository.LedgerEntryRepository;
import com.studioflow.finance.util.MoneyUtils;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.util.Optional;

/**
 * Mirrors settlement events into the cashbook.
 *
 * <p>Each event owns exactly one {@link LedgerEntry}, found by its {@link LedgerOrigin}
 * key. Syncing overwrites that entry from the event's current state, so calling it
 * again after an edit corrects the row and calling it again without one changes
 * nothing. Money in (client payments, advances) posts as credit; money out (vendor
 * bills, reimbursements) posts as debit.
 *
 * <p>An event that is not yet linked to what it settles, or not yet saved, is skipped
 * and {@link Optional#empty()} is returned.
 */
@Slf4j
@Service
public class LedgerSyncService {

    private static final int DESCRIPTION_LIMIT = 255;

    private final LedgerEntryRepository ledgerEntryRepository;

    public LedgerSyncService(LedgerEntryRepository ledgerEntryRepository) {
        this.ledgerEntryRepository = ledgerEntryRepository;
    }

    @Transactional
    public Optional<LedgerEntry> syncPayment(Payment payment) {
        Invoice invoice = payment.getInvoice();
        if (payment.getId() == null || invoice == null) {
            log.debug("Skipping ledger sync for unlinked payment {}", payment.getId());
            return Optional.empty();
        }

        LedgerEntry entry = findOrStart(LedgerOrigin.payment(payment.getId()));
        entry.setEntryDate(payment.getPaymentDate());
        entry.setDescription(truncate("Client payment for invoice " + invoice.getInvoiceNumber()));
        entry.setCategory(TransactionCategory.CLIENT_PAYMENT);
        applyAmount(entry, payment.getAmount(), false);
        entry.setAccount(payment.getAccount());
        entry.setRelatedProject(invoice.getProject());
        entry.setRelatedClient(invoice.getBilledClient());
        entry.setRelatedVendor(null);
        entry.setRelatedPerson(payment.getReceivedBy());
        entry.setRemarks(remarks(payment.getMethod(), payment.getReference()));
        entry.setRecordedBy(payment.getRecordedBy());
        return Optional.of(save(entry));
    }

    @Transactional
    public Optional<LedgerEntry> syncBillPayment(BillPayment billPayment) {
        Bill bill = billPayment.getBill();
        if (billPayment.getId() == null || bill == null) {
            log.debug("Skipping ledger sync for unlinked bill payment {}", billPayment.getId());
            return Optional.empty();
        }

        String vendorName = bill.getVendor() != null ? bill.getVendor().getName() : "vendor";
        String billRef = bill.getBillNumber() != null ? " " + bill.getBillNumber() : "";

        LedgerEntry entry = findOrStart(LedgerOrigin.billPayment(billPayment.getId()));
        entry.setEntryDate(billPayment.getPaymentDate());
        entry.setDescription(truncate("Bill payment to " + vendorName + billRef));
        entry.setCategory(bill.getCategory() != null ? bill.getCategory() : TransactionCategory.PROJECT_EXPENSE);
        applyAmount(entry, billPayment.getAmount(), true);
        entry.setAccount(billPayment.getAccount());
        entry.setRelatedProject(bill.getProject());
        entry.setRelatedClient(bill.getProject() != null ? bill.getProject().getClient() : null);
        entry.setRelatedVendor(bill.getVendor());
        entry.setRelatedPerson(null);
        entry.setRemarks(remarks(billPayment.getMethod(), billPayment.getReference()));
        entry.setRecordedBy(billPayment.getRecordedBy());
        return Optional.of(save(entry));
    }

    @Transactional
    public Optional<LedgerEntry> syncClientAdvance(ClientAdvance advance) {
        if (advance.getId() == null || advance.getClient() == null) {
            log.debug("Skipping ledger sync for unlinked client advance {}", advance.getId());
            return Optional.empty();
        }

        LedgerEntry entry = findOrStart(LedgerOrigin.clientAdvance(advance.getId()));
        entry.setEntryDate(advance.getReceivedDate());
        entry.setDescription(truncate("Advance from " + advance.getClient().getName()));
        entry.setCategory(TransactionCategory.CLIENT_ADVANCE);
        applyAmount(entry, advance.getAmount(), false);
        entry.setAccount(advance.getAccount());
        entry.setRelatedProject(advance.getProject());
        entry.setRelatedClient(advance.getClient());
        entry.setRelatedVendor(null);
        entry.setRelatedPerson(advance.getReceivedBy());
        entry.setRemarks(remarks(advance.getMethod(), advance.getReference()));
        entry.setRecordedBy(advance.getRecordedBy());
        return Optional.of(save(entry));
    }

    @Transactional
    public Optional<LedgerEntry> syncExpenseClaimPayment(ExpenseClaimPayment claimPayment) {
        ExpenseClaim claim = claimPayment.getClaim();
        if (claimPayment.getId() == null || claim == null) {
            log.debug("Skipping ledger sync for unlinked claim payment {}", claimPayment.getId());
            return Optional.empty();
        }

        String category = claim.getCategory() != null ? " (" + claim.getCategory() + ")" : "";

        LedgerEntry entry = findOrStart(LedgerOrigin.expenseClaimPayment(claimPayment.getId()));
        entry.setEntryDate(claimPayment.getPaymentDate());
        entry.setDescription(truncate("Reimbursement to " + claim.getEmployee() + category));
        entry.setCategory(TransactionCategory.REIMBURSEMENT);
        applyAmount(entry, claimPayment.getAmount(), true);
        entry.setAccount(claimPayment.getAccount());
        entry.setRelatedProject(claim.getProject());
        entry.setRelatedClient(claim.getProject() != null ? claim.getProject().getClient() : null);
        entry.setRelatedVendor(null);
        entry.setRelatedPerson(claim.getEmployee());
        entry.setRemarks(remarks(claimPayment.getMethod(), claimPayment.getReference()));
        entry.setRecordedBy(claimPayment.getRecordedBy());
        return Optional.of(save(entry));
    }

    /**
     * Drops the entry mirrored from a source record that is being deleted.
     */
    @Transactional
    public boolean removeEntry(LedgerOrigin origin) {
        Optional<LedgerEntry> existing = ledgerEntryRepository.findByOriginKey(origin.key());
        existing.ifPresent(entry -> {
            ledgerEntryRepository.delete(entry);
            log.debug("Removed ledger entry {} for {}", entry.getId(), origin);
        });
        return existing.isPresent();
    }

    public Optional<LedgerEntry> findEntry(LedgerOrigin origin) {
        return ledgerEntryRepository.findByOriginKey(origin.key());
    }

    private LedgerEntry findOrStart(LedgerOrigin origin) {
        return ledgerEntryRepository.findByOriginKey(origin.key()).orElseGet(() -> {
            LedgerEntry entry = new LedgerEntry();
            entry.setOrigin(origin);
            return entry;
        });
    }

    private LedgerEntry save(LedgerEntry entry) {
        boolean created = entry.getId() == null;
        LedgerEntry saved = ledgerEntryRepository.save(entry);
        log.debug("{} ledger entry {} for {}", created ? "Created" : "Updated", saved.getId(), saved.getOriginKey());
        return saved;
    }

    private static void applyAmount(LedgerEntry entry, BigDecimal amount, boolean outflow) {
        BigDecimal value = MoneyUtils.scale(amount);
        entry.setDebit(outflow ? value : MoneyUtils.zero());
        entry.setCredit(outflow ? MoneyUtils.zero() : value);
    }

    private static String remarks(String method, String reference) {
        StringBuilder sb = new StringBuilder();
        if (method != null && !method.isBlank())
            sb.append(method.trim());
        if (reference != null && !reference.isBlank()) {
            if (sb.length() > 0)
                sb.append(" / ");
            sb.append(reference.trim());
        }
        return sb.length() > 0 ? sb.toString() : null;
    }

    static String truncate(String text) {
        return text.length() > DESCRIPTION_LIMIT ? text.substring(0, DESCRIPTION_LIMIT) : text;
    }
}
