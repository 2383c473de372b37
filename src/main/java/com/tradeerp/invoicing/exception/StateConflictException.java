package com.tradeerp.invoicing.exception;

/**
 * An operation that is illegal for the invoice's current status.
 */
public class StateConflictException extends ErpException {
    public StateConflictException(String message) {
        super(message, "STATE_CONFLICT");
    }
}
