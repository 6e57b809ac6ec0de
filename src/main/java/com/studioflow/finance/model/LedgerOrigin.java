package com.studioflow.finance.model;

import lombok.EqualsAndHashCode;
import lombok.Getter;

import java.time.LocalDate;
import java.util.Objects;

/**
 * The source record a ledger entry mirrors. An entry has at most one origin, and the
 * origin's {@link #key()} is unique across the ledger, which is what makes syncing a
 * source record an upsert instead of an insert.
 *
 * <p>Recurring rules produce one entry per period, so their key also carries the
 * period date.
 */
@Getter
@EqualsAndHashCode
public final class LedgerOrigin {

    private final LedgerOriginType type;
    private final Long sourceId;
    private final LocalDate period;

    private LedgerOrigin(LedgerOriginType type, Long sourceId, LocalDate period) {
        this.type = Objects.requireNonNull(type, "type");
        this.sourceId = Objects.requireNonNull(sourceId, "sourceId");
        this.period = period;
    }

    public static LedgerOrigin payment(Long paymentId) {
        return new LedgerOrigin(LedgerOriginType.PAYMENT, paymentId, null);
    }

    public static LedgerOrigin billPayment(Long billPaymentId) {
        return new LedgerOrigin(LedgerOriginType.BILL_PAYMENT, billPaymentId, null);
    }

    public static LedgerOrigin clientAdvance(Long advanceId) {
        return new LedgerOrigin(LedgerOriginType.CLIENT_ADVANCE, advanceId, null);
    }

    public static LedgerOrigin expenseClaimPayment(Long claimPaymentId) {
        return new LedgerOrigin(LedgerOriginType.EXPENSE_CLAIM_PAYMENT, claimPaymentId, null);
    }

    public static LedgerOrigin recurringRule(Long ruleId, LocalDate period) {
        return new LedgerOrigin(LedgerOriginType.RECURRING_RULE, ruleId, Objects.requireNonNull(period, "period"));
    }

    public String key() {
        String key = type.name() + ":" + sourceId;
        return period != null ? key + ":" + period : key;
    }

    @Override
    public String toString() {
        return key();
    }
}
