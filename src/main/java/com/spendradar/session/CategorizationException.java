package com.spendradar.session;

import lombok.Getter;

/**
 * Thrown by CategorizationSessionService when a request is invalid.
 * API layer maps INVALID_FEEDBACK to 400.
 */
@Getter
public class CategorizationException extends RuntimeException {

    public static final String INVALID_FEEDBACK = "INVALID_FEEDBACK";

    private final String errorCode;

    public CategorizationException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }
}
