package com.spendradar.learning;

import com.spendradar.domain.MappingRule;
import com.spendradar.domain.MappingRuleEntry;
import com.spendradar.domain.MappingRuleEntryRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Rule table in the mapping_rules collection, written as generations: a rewrite saves the new generation
 * first and only then drops older ones, so a failed write leaves the previous table readable.
 * Loads use the newest complete generation. Corrupt rows (blank keyword, or blank category on a
 * non-exclusion rule) are skipped on load.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class MongoMappingRuleStore implements MappingRuleStore {

    private final MappingRuleEntryRepository repository;

    @Override
    public List<MappingRule> loadAll() {
        List<MappingRuleEntry> entries;
        try {
            entries = repository.findAllByOrderByGenerationDescPositionAsc();
        } catch (DataAccessException e) {
            log.warn("Rule store unreadable, continuing with no learned rules: {}", e.getMessage());
            return List.of();
        }
        List<MappingRuleEntry> generation = newestCompleteGeneration(entries);
        List<MappingRule> rules = new ArrayList<>(generation.size());
        int skipped = 0;
        for (MappingRuleEntry entry : generation) {
            MappingRule rule = entry.toRule();
            if (rule.isBlank() || (!rule.isExclusion() && rule.category().isBlank())) {
                skipped++;
                continue;
            }
            rules.add(rule);
        }
        if (skipped > 0) {
            log.warn("Skipped {} corrupt rule rows", skipped);
        }
        return MappingRuleStore.deduplicate(rules);
    }

    @Override
    public void replaceAll(List<MappingRule> rules) {
        List<MappingRule> deduplicated = MappingRuleStore.deduplicate(rules);
        if (deduplicated.isEmpty()) {
            try {
                repository.deleteAll();
            } catch (DataAccessException e) {
                throw new RuleStoreException("Failed to clear rule table", e);
            }
            return;
        }

        long next;
        try {
            next = repository.findFirstByOrderByGenerationDesc().map(MappingRuleEntry::getGeneration).orElse(0L) + 1;
        } catch (DataAccessException e) {
            throw new RuleStoreException("Failed to read current rule generation", e);
        }
        List<MappingRuleEntry> entries = new ArrayList<>(deduplicated.size());
        for (int i = 0; i < deduplicated.size(); i++) {
            entries.add(MappingRuleEntry.of(deduplicated.get(i), i, next, deduplicated.size()));
        }

        try {
            repository.saveAll(entries);
        } catch (DataAccessException e) {
            discardPartialGeneration(next, e);
            throw new RuleStoreException("Failed to write " + entries.size() + " rules; previous table kept", e);
        }
        try {
            repository.deleteByGenerationLessThan(next);
        } catch (DataAccessException e) {
            log.warn("Older rule generations left behind, readers use generation {}: {}", next, e.getMessage());
        }
        log.debug("Rule store rewritten with {} rules (generation {})", entries.size(), next);
    }

    private void discardPartialGeneration(long generation, DataAccessException cause) {
        try {
            repository.deleteByGeneration(generation);
        } catch (DataAccessException cleanup) {
            cause.addSuppressed(cleanup);
            log.warn("Partial rule generation {} left behind; it is ignored on load", generation);
        }
    }

    private static List<MappingRuleEntry> newestCompleteGeneration(List<MappingRuleEntry> entries) {
        Map<Long, List<MappingRuleEntry>> byGeneration = new LinkedHashMap<>();
        for (MappingRuleEntry entry : entries) {
            if (entry != null) {
                byGeneration.computeIfAbsent(entry.getGeneration(), g -> new ArrayList<>()).add(entry);
            }
        }
        for (Map.Entry<Long, List<MappingRuleEntry>> generation : byGeneration.entrySet()) {
            List<MappingRuleEntry> rows = generation.getValue();
            if (rows.size() == rows.get(0).getGenerationSize()) {
                return rows;
            }
            log.warn("Ignoring incomplete rule generation {} ({} of {} rows)",
                    generation.getKey(), rows.size(), rows.get(0).getGenerationSize());
        }
        return List.of();
    }
}
