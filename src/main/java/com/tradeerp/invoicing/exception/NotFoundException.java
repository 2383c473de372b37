package com.tradeerp.invoicing.exception;

public class NotFoundException extends ErpException {
    public NotFoundException(String message) {
        super(message, "NOT_FOUND");
    }
}
