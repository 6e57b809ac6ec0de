package com.studioflow.finance.exception;

public class ResourceNotFoundException extends FinanceException {

    public ResourceNotFoundException(String resource, Object id) {
        super(resource + " not found: " + id, "FIN_ERR_404");
    }
}
