package com.studioflow.finance.model;

public enum ExpenseClaimStatus {
    SUBMITTED, APPROVED, REJECTED, PAID
}
