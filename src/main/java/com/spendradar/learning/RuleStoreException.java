package com.spendradar.learning;

/**
 * Thrown when the rule table cannot be written. Propagated to the caller so a confirmed correction is
 * never dropped silently.
 */
public class RuleStoreException extends RuntimeException {

    public RuleStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
