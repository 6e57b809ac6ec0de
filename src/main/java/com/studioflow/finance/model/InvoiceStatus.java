package com.studioflow.finance.model;

public enum InvoiceStatus {
    DRAFT, SENT, PAID, OVERDUE
}
