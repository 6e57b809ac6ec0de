package com.studioflow.finance.model;

public enum LedgerOriginType {
    PAYMENT, BILL_PAYMENT, CLIENT_ADVANCE, EXPENSE_CLAIM_PAYMENT, RECURRING_RULE
}
