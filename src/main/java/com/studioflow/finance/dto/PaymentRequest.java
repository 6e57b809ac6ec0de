package com.studioflow.finance.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * Money moving against an invoice, a bill, an advance or an expense claim.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PaymentRequest {
    private LocalDate paymentDate;
    private BigDecimal amount;
    private Long accountId;
    private String method;
    private String reference;
    private String notes;
    private String receivedBy;
}
