package com.spendradar.categorization.remote;

/**
 * Thrown when a remote classification call fails (HTTP error, timeout, unreadable response).
 */
public class RemoteClassifierException extends RuntimeException {

    public RemoteClassifierException(String message) {
        super(message);
    }

    public RemoteClassifierException(String message, Throwable cause) {
        super(message, cause);
    }
}
