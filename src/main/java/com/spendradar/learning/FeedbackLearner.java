package com.spendradar.learning;

import com.spendradar.categorization.VendorMap;
import com.spendradar.categorization.config.CategorizationSettings;
import com.spendradar.common.VendorNameNormalizer;
import com.spendradar.domain.MappingRule;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Turns a confirmed (description, category) pair into rules: the first two and three meaningful tokens as
 * phrase rules, and at most one long single-token rule. The vendor map gets the description's first three
 * words in raw and normalized form. Rules already present by keyword are never re-added, so repeating a
 * confirmation does not grow the table. Writes are serialized and merged with the stored table.
 */
@Service
@Slf4j
public class FeedbackLearner {

    private static final String TOKEN_PUNCTUATION = ".,;:!?()[]{}\"'-";
    private static final int VENDOR_KEY_WORDS = 3;

    private final CategorizationSettings.Learner settings;
    private final MappingRuleStore ruleStore;
    private final ReentrantLock writeLock = new ReentrantLock();

    public FeedbackLearner(CategorizationSettings settings, MappingRuleStore ruleStore) {
        this.settings = settings.learner();
        this.ruleStore = ruleStore;
    }

    /**
     * Learn from one confirmed correction and persist the resulting rule list.
     * The inputs are not modified; the outcome carries the new tables.
     *
     * @throws RuleStoreException when the rule list cannot be persisted
     */
    public LearningOutcome learn(String description, String category, List<MappingRule> rules, VendorMap vendorMap) {
        if (description == null || description.isBlank() || category == null || category.isBlank()) {
            throw new IllegalArgumentException("description and category are required");
        }
        String cleanCategory = category.strip();
        List<String> words = words(description);
        List<String> vendorTokens = vendorTokens(words);

        writeLock.lock();
        try {
            List<MappingRule> updated = currentRules(rules);
            List<MappingRule> added = new ArrayList<>();

            if (vendorTokens.size() >= 2) {
                addIfAbsent(updated, added, String.join(" ", vendorTokens.subList(0, 2)), cleanCategory);
            }
            if (vendorTokens.size() >= 3) {
                addIfAbsent(updated, added, String.join(" ", vendorTokens.subList(0, 3)), cleanCategory);
            }
            vendorTokens.stream()
                    .filter(t -> t.length() >= settings.distinctiveTokenMinLength())
                    .findFirst()
                    .ifPresent(t -> addIfAbsent(updated, added, t, cleanCategory));

            VendorMap updatedVendors = vendorMap == null ? VendorMap.empty() : vendorMap.copy();
            List<String> vendorKeys = new ArrayList<>();
            String rawKey = String.join(" ", words.subList(0, Math.min(VENDOR_KEY_WORDS, words.size())));
            if (updatedVendors.put(rawKey, cleanCategory)) {
                vendorKeys.add(rawKey);
            }
            String normalizedKey = VendorNameNormalizer.normalize(rawKey);
            if (!normalizedKey.equals(rawKey) && updatedVendors.put(normalizedKey, cleanCategory)) {
                vendorKeys.add(normalizedKey);
            }

            List<MappingRule> deduplicated = MappingRuleStore.deduplicate(updated);
            ruleStore.replaceAll(deduplicated);
            log.info("Learned from '{}' -> {}: {} new rules, vendor keys {}",
                    description, cleanCategory, added.size(), vendorKeys);
            return new LearningOutcome(List.copyOf(deduplicated), updatedVendors, List.copyOf(added),
                    List.copyOf(vendorKeys));
        } finally {
            writeLock.unlock();
        }
    }

    /**
     * Stored table first, then any caller rules it lacks. A session opened before another write still
     * keeps that write's rules.
     */
    private List<MappingRule> currentRules(List<MappingRule> sessionRules) {
        List<MappingRule> merged = new ArrayList<>(ruleStore.loadAll());
        if (sessionRules != null) {
            merged.addAll(sessionRules);
        }
        return MappingRuleStore.deduplicate(merged);
    }

    /**
     * Up to the configured number of meaningful tokens from the start of the description, in order:
     * punctuation trimmed, short tokens and stop words dropped.
     */
    List<String> vendorTokens(List<String> words) {
        List<String> tokens = new ArrayList<>();
        int window = Math.min(settings.scanWindow(), words.size());
        for (String word : words.subList(0, window)) {
            String token = trimPunctuation(word);
            if (token.length() < settings.minTokenLength() || settings.stopWords().contains(token)) {
                continue;
            }
            tokens.add(token);
            if (tokens.size() >= settings.maxVendorTokens()) {
                break;
            }
        }
        return tokens;
    }

    private static List<String> words(String description) {
        String lower = VendorNameNormalizer.stripMarks(description).strip().toLowerCase(Locale.ROOT);
        return Arrays.stream(lower.split("\\s+")).filter(w -> !w.isEmpty()).toList();
    }

    private static void addIfAbsent(List<MappingRule> rules, List<MappingRule> added, String keyword, String category) {
        MappingRule rule = new MappingRule(keyword, category);
        boolean present = rules.stream().anyMatch(r -> r.keyword().equals(rule.keyword()));
        if (!present) {
            rules.add(rule);
            added.add(rule);
        }
    }

    static String trimPunctuation(String word) {
        int start = 0;
        int end = word.length();
        while (start < end && TOKEN_PUNCTUATION.indexOf(word.charAt(start)) >= 0) {
            start++;
        }
        while (end > start && TOKEN_PUNCTUATION.indexOf(word.charAt(end - 1)) >= 0) {
            end--;
        }
        return word.substring(start, end);
    }
}
