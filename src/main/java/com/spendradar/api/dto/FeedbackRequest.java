package com.spendradar.api.dto;

import jakarta.validation.constraints.NotBlank;

/**
 * POST /api/v1/categorization/feedback body: a user-confirmed category.
 */
public record FeedbackRequest(
        @NotBlank(message = "DESCRIPTION_REQUIRED") String description,
        @NotBlank(message = "CATEGORY_REQUIRED") String category
) {
}
