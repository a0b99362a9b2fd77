package com.coinbot.exception;

/**
 * Transient market-data failure. The caller treats it as "no data this round".
 */
public class FetchException extends Exception {

    public FetchException(String message) {
        super(message);
    }

    public FetchException(String message, Throwable cause) {
        super(message, cause);
    }
}
