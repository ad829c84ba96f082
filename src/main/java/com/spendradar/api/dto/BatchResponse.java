package com.spendradar.api.dto;

import java.util.List;

/**
 * Batch categorization result in input order.
 */
public record BatchResponse(int processed, int assigned, int skipped, List<Item> items) {

    public record Item(String id, String description, boolean assigned, MatchResponse match) {
    }
}
