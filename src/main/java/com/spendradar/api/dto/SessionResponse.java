package com.spendradar.api.dto;

import java.time.Instant;
import java.util.List;

/**
 * Current session tables summary.
 */
public record SessionResponse(Instant openedAt, int rules, int vendors, List<String> categories) {
}
