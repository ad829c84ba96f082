package com.spendradar.categorization;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * One description to categorize, with optional amount/date context for the remote tier.
 */
public record CategorizationRequest(String description, BigDecimal amount, LocalDate date) {

    public static CategorizationRequest of(String description) {
        return new CategorizationRequest(description, null, null);
    }

    public boolean isBlank() {
        return description == null || description.isBlank();
    }
}
