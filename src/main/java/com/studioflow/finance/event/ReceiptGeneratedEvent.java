package com.studioflow.finance.event;

import lombok.Getter;
import lombok.ToString;

import java.math.BigDecimal;

@Getter
@ToString
public class ReceiptGeneratedEvent {

    private final Long receiptId;
    private final String receiptNumber;
    private final Long paymentId;
    private final BigDecimal amount;
    private final String actor;

    public ReceiptGeneratedEvent(Long receiptId, String receiptNumber, Long paymentId, BigDecimal amount,
            String actor) {
        this.receiptId = receiptId;
        this.receiptNumber = receiptNumber;
        this.paymentId = paymentId;
        this.amount = amount;
        this.actor = actor;
    }
}
