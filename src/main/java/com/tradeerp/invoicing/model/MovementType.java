package com.tradeerp.invoicing.model;

/**
 * Direction of a stock movement. {@code IN} rows carry a positive quantity,
 * {@code OUT} rows a negative one, {@code ADJUSTMENT} rows either sign.
 */
public enum MovementType {
    IN,
    OUT,
    ADJUSTMENT;

    public MovementType opposite() {
        switch (this) {
            case IN:
                return OUT;
            case OUT:
                return IN;
            default:
                return ADJUSTMENT;
        }
    }
}
