package com.studioflow.finance.model;

public enum RecurringDirection {
    DEBIT, CREDIT
}
