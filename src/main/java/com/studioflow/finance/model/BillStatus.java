package com.studioflow.finance.model;

public enum BillStatus {
    UNPAID, PARTIAL, PAID, OVERDUE
}
