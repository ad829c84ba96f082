package com.spendradar.api.dto;

import java.util.List;

/**
 * Rules and vendor keys added by a confirmation, and the resulting rule count.
 */
public record LearningResponse(List<RuleDto> addedRules, List<String> vendorKeys, int ruleCount) {

    public record RuleDto(String keyword, String category) {
    }
}
