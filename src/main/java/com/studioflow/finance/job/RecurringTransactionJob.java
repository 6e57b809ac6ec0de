package com.studioflow.finance.job;

import com.studioflow.finance.service.AuditService;
import com.studioflow.finance.service.RecurringTransactionService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDate;

/**
 * Nightly expansion of recurring rules, dated in the firm's time zone.
 */
@Slf4j
@Component
@ConditionalOnProperty(prefix = "studioflow.finance", name = "recurring-enabled", havingValue = "true",
        matchIfMissing = true)
public class RecurringTransactionJob {

    private final RecurringTransactionService recurringTransactionService;
    private final Clock clock;

    public RecurringTransactionJob(RecurringTransactionService recurringTransactionService, Clock clock) {
        this.recurringTransactionService = recurringTransactionService;
        this.clock = clock;
    }

    @Scheduled(cron = "${studioflow.finance.recurring-cron:0 15 1 * * *}",
            zone = "${studioflow.finance.time-zone:Asia/Kolkata}")
    public void run() {
        LocalDate today = LocalDate.now(clock);
        log.info("Recurring transaction job started for {}", today);
        try {
            int created = recurringTransactionService.generateRecurringTransactions(today, AuditService.SYSTEM_ACTOR);
            log.info("Recurring transaction job finished: {} entries created", created);
        } catch (RuntimeException e) {
            log.error("Recurring transaction job failed for {}", today, e);
        }
    }
}
