package com.tradeerp.invoicing.exception;

/**
 * Base of the invoicing error hierarchy. Unchecked, so a failure anywhere inside a
 * transactional service method rolls the whole unit back.
 */
public class ErpException extends RuntimeException {
    private final String code;

    public ErpException(String message, String code) {
        this(message, code, null);
    }

    public ErpException(String message, String code, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public String getCode() {
        return code;
    }
}
