package com.coinbot.exception;

/**
 * Raised when risk, scheduler or strategy settings are invalid.
 * Fatal for session start; a rejected reload keeps the previous snapshot.
 */
public class ConfigurationException extends RuntimeException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
