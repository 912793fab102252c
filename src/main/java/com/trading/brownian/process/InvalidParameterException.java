package com.trading.brownian.process;

/**
 * Thrown when a process or model definition is constructed with parameters
 * outside their domain (negative sigma, non-finite values, bad names).
 */
public class InvalidParameterException extends IllegalArgumentException {
    private static final long serialVersionUID = 1L;

    public InvalidParameterException(String message) {
        super(message);
    }
}
