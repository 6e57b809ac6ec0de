package com.studioflow.finance.model;

public enum AccountType {
    CASH, BANK, UPI, OTHER
}
