package com.studioflow.finance.event;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

/**
 * Activity feed for settlements. Runs only after the recording transaction commits,
 * so a rolled back payment never shows up here.
 */
@Slf4j
@Component
public class FinanceActivityListener {

    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT, fallbackExecution = true)
    public void onPaymentRecorded(PaymentRecordedEvent event) {
        log.info("Payment {} of {} received against invoice {} on {} (by {})", event.getPaymentId(),
                event.getAmount(), event.getInvoiceNumber(), event.getPaymentDate(), event.getActor());
    }

    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT, fallbackExecution = true)
    public void onReceiptGenerated(ReceiptGeneratedEvent event) {
        log.info("Receipt {} issued for payment {} ({})", event.getReceiptNumber(), event.getPaymentId(),
                event.getAmount());
    }
}
