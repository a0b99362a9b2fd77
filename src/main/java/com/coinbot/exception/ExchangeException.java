package com.coinbot.exception;

/**
 * Failure of an exchange operation: order placement, close, price lookup, account query or timeout.
 */
public class ExchangeException extends Exception {

    public ExchangeException(String message) {
        super(message);
    }

    public ExchangeException(String message, Throwable cause) {
        super(message, cause);
    }
}
