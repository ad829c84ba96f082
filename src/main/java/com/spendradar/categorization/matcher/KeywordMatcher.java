package com.spendradar.categorization.matcher;

import com.spendradar.categorization.MatchResult;
import com.spendradar.categorization.MatchStrategy;
import com.spendradar.categorization.config.CategorizationSettings;
import com.spendradar.common.VendorNameNormalizer;
import com.spendradar.domain.MappingRule;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Rule-table tier. Exclusion rules ({@code !keyword}) veto the description outright; otherwise phrase rules
 * score by word count, whole-token rules score the exact confidence and long keywords found inside a token
 * score the substring confidence. The first rule wins ties.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class KeywordMatcher {

    private static final double PHRASE_WORD_BONUS = 0.01;

    private final CategorizationSettings settings;

    public MatchResult match(String description, List<MappingRule> rules) {
        if (description == null || description.isBlank()) {
            return MatchResult.miss(MatchStrategy.KEYWORD, "Empty description");
        }
        if (rules == null || rules.isEmpty()) {
            return MatchResult.miss(MatchStrategy.KEYWORD, "No keyword rules loaded");
        }
        String text = lowerCased(description);
        Optional<MappingRule> exclusion = findExclusion(text, rules);
        if (exclusion.isPresent()) {
            return MatchResult.miss(MatchStrategy.KEYWORD, "Excluded by rule: " + exclusion.get().keyword());
        }
        Set<String> words = Arrays.stream(text.split("\\s+"))
                .filter(w -> !w.isEmpty())
                .collect(Collectors.toSet());

        MappingRule best = null;
        double bestScore = 0.0;
        for (MappingRule rule : rules) {
            if (rule == null || rule.isExclusion() || rule.isBlank() || rule.category().isBlank()) {
                continue;
            }
            double score = score(rule, text, words);
            if (score > bestScore) {
                bestScore = score;
                best = rule;
            }
        }
        if (best == null) {
            return MatchResult.miss(MatchStrategy.KEYWORD, "No keyword matches found");
        }
        return MatchResult.matched(MatchStrategy.KEYWORD, best.category(), bestScore, best.keyword(),
                String.format(Locale.ROOT, "Keyword match: %s (confidence: %.2f)", best.keyword(), bestScore));
    }

    /**
     * First exclusion rule whose root occurs in the description, if any.
     */
    public Optional<MappingRule> findExclusion(String description, List<MappingRule> rules) {
        if (description == null || description.isBlank() || rules == null) {
            return Optional.empty();
        }
        String text = lowerCased(description);
        return rules.stream()
                .filter(r -> r != null && r.isExclusion() && !r.isBlank())
                .filter(r -> text.contains(r.root()))
                .findFirst();
    }

    private double score(MappingRule rule, String text, Set<String> words) {
        CategorizationSettings.Keyword k = settings.keyword();
        String keyword = rule.keyword();
        if (rule.isPhrase()) {
            if (!text.contains(keyword)) {
                return 0.0;
            }
            int wordCount = keyword.split("\\s+").length;
            return Math.min(k.exactConfidence() + PHRASE_WORD_BONUS * wordCount, k.phraseCap());
        }
        if (words.contains(keyword)) {
            return k.exactConfidence();
        }
        if (keyword.length() >= k.substringMinLength() && text.contains(keyword)) {
            return k.substringConfidence();
        }
        return 0.0;
    }

    private static String lowerCased(String description) {
        return VendorNameNormalizer.stripMarks(description).toLowerCase(Locale.ROOT);
    }
}
