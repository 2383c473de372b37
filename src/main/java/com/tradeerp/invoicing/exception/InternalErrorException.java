package com.tradeerp.invoicing.exception;

public class InternalErrorException extends ErpException {
    public InternalErrorException(String message) {
        super(message, "INTERNAL_ERROR");
    }

    public InternalErrorException(String message, Throwable cause) {
        super(message, "INTERNAL_ERROR", cause);
    }
}
