package com.studioflow.finance.exception;

import lombok.Getter;

/**
 * Base exception for finance business rule failures.
 */
@Getter
public class FinanceException extends RuntimeException {

    private final String errorCode;

    public FinanceException(String message) {
        this(message, "FIN_ERR_001");
    }

    public FinanceException(String message, String errorCode) {
        super(message);
        this.errorCode = errorCode;
    }
}
