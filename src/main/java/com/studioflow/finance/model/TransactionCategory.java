package com.studioflow.finance.model;

public enum TransactionCategory {
    CLIENT_PAYMENT, CLIENT_ADVANCE, PROJECT_EXPENSE, OFFICE_EXPENSE, SALARY, REIMBURSEMENT, TAX, MISC
}
