package com.spendradar.api.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

/**
 * POST /api/v1/categorization/batch body. onlyUncategorized defaults to true.
 */
public record BatchRequest(
        @NotNull(message = "TRANSACTIONS_REQUIRED") List<@Valid Item> transactions,
        Boolean onlyUncategorized
) {

    public boolean onlyUncategorizedOrDefault() {
        return onlyUncategorized == null || onlyUncategorized;
    }

    /**
     * Transaction as supplied by the import layer; id is echoed back so the caller can apply the category.
     */
    public record Item(String id, LocalDate date, String description, BigDecimal amount, String category) {
    }
}
