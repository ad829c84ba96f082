package com.spendradar.api.dto;

import com.spendradar.categorization.MatchResult;

import java.util.Locale;

/**
 * Category decision. category and evidence are null when no confident answer exists.
 */
public record MatchResponse(String category, String strategy, double confidence, String evidence, String note) {

    public static MatchResponse from(MatchResult result) {
        return new MatchResponse(
                result.getCategory().orElse(null),
                result.getStrategy().name().toLowerCase(Locale.ROOT),
                result.getConfidence(),
                result.getEvidence().orElse(null),
                result.getNote());
    }
}
