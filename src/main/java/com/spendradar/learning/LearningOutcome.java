package com.spendradar.learning;

import com.spendradar.categorization.VendorMap;
import com.spendradar.domain.MappingRule;

import java.util.List;

/**
 * Rule list and vendor map after a confirmed correction, plus what was added.
 */
public record LearningOutcome(
        List<MappingRule> rules,
        VendorMap vendorMap,
        List<MappingRule> addedRules,
        List<String> vendorKeys
) {

    public boolean learnedNewRules() {
        return !addedRules.isEmpty();
    }
}
