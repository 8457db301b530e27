package com.payroll.calculator;

/**
 * A rate table that cannot be read or does not describe a usable set of rates.
 */
public class RateTableException extends RuntimeException {

    public RateTableException(String message) {
        super(message);
    }

    public RateTableException(String message, Throwable cause) {
        super(message, cause);
    }
}
