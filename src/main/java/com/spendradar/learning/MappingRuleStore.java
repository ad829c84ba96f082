package com.spendradar.learning;

import com.spendradar.domain.MappingRule;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Durable (keyword, category) rule table, loaded wholesale at session start and rewritten wholesale on
 * every learning event.
 */
public interface MappingRuleStore {

    /**
     * All stored rules in order. A missing or unreadable store yields an empty list.
     */
    List<MappingRule> loadAll();

    /**
     * Replaces the stored table with the given rules, deduplicated by keyword.
     *
     * @throws RuleStoreException when the write fails
     */
    void replaceAll(List<MappingRule> rules);

    /**
     * Drops blank rules and later duplicates of a keyword, keeping order.
     */
    static List<MappingRule> deduplicate(List<MappingRule> rules) {
        List<MappingRule> out = new ArrayList<>();
        if (rules == null) {
            return out;
        }
        Set<String> seen = new HashSet<>();
        for (MappingRule rule : rules) {
            if (rule == null || rule.isBlank()) {
                continue;
            }
            if (seen.add(rule.keyword())) {
                out.add(rule);
            }
        }
        return out;
    }
}
