package com.spendradar.api.dto;

import java.time.Instant;

/**
 * Error payload for every non-2xx categorization response. {@code error} is a stable code such as
 * DESCRIPTION_REQUIRED or RULE_STORE_UNAVAILABLE; {@code message} is for people.
 */
public record ErrorBody(String error, String message, Instant timestamp) {

    public static ErrorBody of(String error, String message) {
        return new ErrorBody(error, message, Instant.now());
    }
}
