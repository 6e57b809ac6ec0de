package com.studioflow.finance.event;

import lombok.Getter;
import lombok.ToString;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * Published once an invoice payment has been recorded, synced to the ledger and the
 * invoice status refreshed.
 */
@Getter
@ToString
public class PaymentRecordedEvent {

    private final Long paymentId;
    private final Long invoiceId;
    private final String invoiceNumber;
    private final BigDecimal amount;
    private final LocalDate paymentDate;
    private final String actor;

    public PaymentRecordedEvent(Long paymentId, Long invoiceId, String invoiceNumber, BigDecimal amount,
            LocalDate paymentDate, String actor) {
        this.paymentId = paymentId;
        this.invoiceId = invoiceId;
        this.invoiceNumber = invoiceNumber;
        this.amount = amount;
        this.paymentDate = paymentDate;
        this.actor = actor;
    }
}
