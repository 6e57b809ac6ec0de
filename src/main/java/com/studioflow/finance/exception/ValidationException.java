package com.studioflow.finance.exception;

import lombok.Getter;

/**
 * Input rejected before anything was written.
 */
@Getter
public class ValidationException extends FinanceException {

    private final String field;

    public ValidationException(String message) {
        super(message, "FIN_ERR_400");
        this.field = null;
    }

    public ValidationException(String field, String message) {
        super(String.format("Validation failed for '%s': %s", field, message), "FIN_ERR_400");
        this.field = field;
    }
}
