package com.studioflow.finance.service;

import com.studioflow.finance.exception.ResourceNotFoundException;
import com.studioflow.finance.exception.ValidationException;
import com.studioflow.finance.model.*;
import com.studioflow.finance.repository.LedgerEntryRepository;
import com.studioflow.finance.repository.RecurringTransactionRuleRepository;
import com.studioflow.finance.util.MoneyUtils;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDate;
import java.util.List;

/**
 * Expands monthly rules into cashbook entries.
 *
 * <p>A rule yields one entry per period, keyed by rule and period date, so running the
 * expansion twice for the same day creates nothing the second time.
 */
@Slf4j
@Service
public class RecurringTransactionService {

    static final int MAX_DAY_OF_MONTH = 28;

    private final RecurringTransactionRuleRepository ruleRepository;
    private final LedgerEntryRepository ledgerEntryRepository;
    private final AuditService auditService;
    private final Clock clock;

    public RecurringTransactionService(RecurringTransactionRuleRepository ruleRepository,
            LedgerEntryRepository ledgerEntryRepository, AuditService auditService, Clock clock) {
        this.ruleRepository = ruleRepository;
        this.ledgerEntryRepository = ledgerEntryRepository;
        this.auditService = auditService;
        this.clock = clock;
    }

    /**
     * Saves a new rule. Without an explicit {@code nextRunDate} the first run is the
     * next occurrence of its day of month, today included.
     */
    @Transactional
    public RecurringTransactionRule createRule(RecurringTransactionRule rule) {
        if (rule.getName() == null || rule.getName().isBlank()) {
            throw new ValidationException("name", "Name is required.");
        }
        if (rule.getDayOfMonth() < 1 || rule.getDayOfMonth() > MAX_DAY_OF_MONTH) {
            throw new ValidationException("dayOfMonth", "Day of month must be between 1 and " + MAX_DAY_OF_MONTH + ".");
        }
        if (rule.getDirection() == null) {
            throw new ValidationException("direction", "Direction is required.");
        }
        rule.setAmount(MoneyUtils.requirePositive(rule.getAmount()));
        if (rule.getCategory() == null) {
            rule.setCategory(TransactionCategory.MISC);
        }
        if (rule.getNextRunDate() == null) {
            LocalDate today = LocalDate.now(clock);
            LocalDate thisMonth = today.withDayOfMonth(rule.getDayOfMonth());
            rule.setNextRunDate(thisMonth.isBefore(today) ? nextRunDate(thisMonth, rule.getDayOfMonth()) : thisMonth);
        }

        RecurringTransactionRule saved = ruleRepository.save(rule);
        auditService.log("CREATE_RECURRING_RULE", "Rule " + saved.getName() + ", " + saved.getDirection() + " "
                + saved.getAmount() + " on day " + saved.getDayOfMonth());
        return saved;
    }

    @Transactional
    public RecurringTransactionRule deactivateRule(Long ruleId) {
        RecurringTransactionRule rule = ruleRepository.findById(ruleId)
                .orElseThrow(() -> new ResourceNotFoundException("Recurring rule", ruleId));
        rule.setActive(false);
        auditService.log("DEACTIVATE_RECURRING_RULE", "Rule " + rule.getName());
        return ruleRepository.save(rule);
    }

    /**
     * Posts every period due up to and including {@code today} for all active rules and
     * moves each rule's cursor past it.
     *
     * @param actor stored as {@code recordedBy} on created entries, may be null
     * @return number of ledger entries created
     */
    @Transactional
    public int generateRecurringTransactions(LocalDate today, String actor) {
        int created = 0;
        List<RecurringTransactionRule> dueRules = ruleRepository.findByActiveTrueAndNextRunDateLessThanEqual(today);
        for (RecurringTransactionRule rule : dueRules) {
            LocalDate start = rule.getNextRunDate();
            LocalDate cursor = start;
            while (!cursor.isAfter(today)) {
                if (postPeriod(rule, cursor, actor)) {
                    created++;
                }
                cursor = nextRunDate(cursor, rule.getDayOfMonth());
            }
            if (!cursor.equals(start)) {
                rule.setNextRunDate(cursor);
                ruleRepository.save(rule);
            }
        }
        if (created > 0) {
            log.info("Generated {} recurring ledger entries from {} rules as of {}", created, dueRules.size(), today);
            auditService.log("RUN_RECURRING", created + " entries generated as of " + today,
                    actor != null ? actor : AuditService.SYSTEM_ACTOR);
        }
        return created;
    }

    private boolean postPeriod(RecurringTransactionRule rule, LocalDate period, String actor) {
        LedgerOrigin origin = LedgerOrigin.recurringRule(rule.getId(), period);
        if (ledgerEntryRepository.findByOriginKey(origin.key()).isPresent()) {
            log.debug("Recurring entry {} already exists", origin);
            return false;
        }

        LedgerEntry entry = new LedgerEntry();
        entry.setOrigin(origin);
        entry.setEntryDate(period);
        String description = rule.getDescription() != null && !rule.getDescription().isBlank()
                ? rule.getDescription() : rule.getName();
        entry.setDescription(LedgerSyncService.truncate(description));
        entry.setCategory(rule.getCategory());
        boolean outflow = rule.getDirection() == RecurringDirection.DEBIT;
        entry.setDebit(outflow ? MoneyUtils.scale(rule.getAmount()) : MoneyUtils.zero());
        entry.setCredit(outflow ? MoneyUtils.zero() : MoneyUtils.scale(rule.getAmount()));
        entry.setAccount(rule.getAccount());
        entry.setRelatedProject(rule.getRelatedProject());
        entry.setRelatedClient(rule.getRelatedProject() != null ? rule.getRelatedProject().getClient() : null);
        entry.setRelatedVendor(rule.getRelatedVendor());
        entry.setRemarks("Recurring: " + rule.getName());
        entry.setRecordedBy(actor);
        ledgerEntryRepository.save(entry);
        return true;
    }

    /**
     * First of the following month, then the rule's day clamped to 1..28.
     */
    static LocalDate nextRunDate(LocalDate current, int dayOfMonth) {
        int day = Math.min(Math.max(dayOfMonth, 1), MAX_DAY_OF_MONTH);
        return current.withDayOfMonth(1).plusMonths(1).withDayOfMonth(day);
    }
}
