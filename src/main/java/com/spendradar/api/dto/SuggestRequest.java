package com.spendradar.api.dto;

import jakarta.validation.constraints.NotBlank;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * POST /api/v1/categorization/suggest body. Amount and date are optional context.
 */
public record SuggestRequest(
        @NotBlank(message = "DESCRIPTION_REQUIRED") String description,
        BigDecimal amount,
        LocalDate date
) {
}
