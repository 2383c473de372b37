package com.tradeerp.invoicing.exception;

public class ValidationException extends ErpException {
    // Offending input field, when one can be named
    private final String field;

    public ValidationException(String message) {
        this(message, null);
    }

    public ValidationException(String message, String field) {
        super(message, "VALIDATION_FAILED");
        this.field = field;
    }

    public String getField() {
        return field;
    }
}
