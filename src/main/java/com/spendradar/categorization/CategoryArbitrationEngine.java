package com.spendradar.categorization;

import com.spendradar.categorization.config.CategorizationSettings;
import com.spendradar.categorization.matcher.FuzzyVendorMatcher;
import com.spendradar.categorization.matcher.KeywordMatcher;
import com.spendradar.categorization.matcher.RemoteClassifierMatcher;
import com.spendradar.domain.MappingRule;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Runs keyword → fuzzy → remote (remote only with a credential), boosts categories proposed by two or more
 * tiers, picks the most confident result (ties keep tier order) and refuses winners below the minimum
 * confidence. An exclusion rule short-circuits everything with a refusal.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class CategoryArbitrationEngine {

    private final CategorizationSettings settings;
    private final KeywordMatcher keywordMatcher;
    private final FuzzyVendorMatcher fuzzyVendorMatcher;
    private final RemoteClassifierMatcher remoteClassifierMatcher;

    /**
     * Decide with the configured fuzzy threshold and remote credential.
     */
    public MatchResult decide(CategorizationRequest request, List<MappingRule> rules, VendorMap vendorMap,
                              List<String> categories) {
        return decide(request, rules, vendorMap, categories,
                settings.fuzzyThreshold(), settings.remote().credential().orElse(null));
    }

    /**
     * Decide for one description.
     *
     * @param fuzzyThreshold similarity cutoff for the fuzzy tier, 0..100
     * @param remoteApiKey   credential for the remote tier; null or blank skips the remote call
     * @return the winning tier's result, or a {@link MatchStrategy#NONE} refusal
     */
    public MatchResult decide(CategorizationRequest request, List<MappingRule> rules, VendorMap vendorMap,
                              List<String> categories, int fuzzyThreshold, String remoteApiKey) {
        if (request == null || request.isBlank()) {
            return MatchResult.none("Empty description");
        }
        String description = request.description();
        Optional<MappingRule> exclusion = keywordMatcher.findExclusion(description, rules);
        if (exclusion.isPresent()) {
            log.debug("'{}' excluded by rule {}", description, exclusion.get().keyword());
            return MatchResult.excluded(exclusion.get().keyword());
        }

        List<MatchResult> results = new ArrayList<>(3);
        results.add(keywordMatcher.match(description, rules));
        results.add(fuzzyVendorMatcher.match(description, vendorMap, fuzzyThreshold));
        if (remoteApiKey != null && !remoteApiKey.isBlank()) {
            results.add(remoteClassifierMatcher.match(request, categories, remoteApiKey));
        }

        List<MatchResult> boosted = applyAgreementBoost(results);
        MatchResult best = selectBest(boosted);

        if (!best.hasCategory() || best.getConfidence() < settings.minConfidence()) {
            log.debug("No confident category for '{}' (best {})", description, best);
            return MatchResult.none(String.format(Locale.ROOT,
                    "No high-confidence match found (all strategies below %.2f threshold)", settings.minConfidence()));
        }
        log.debug("Categorized '{}' as {}", description, best);
        return best;
    }

    /**
     * Multiplies the confidence of every result whose category is proposed by at least two tiers.
     * A single proposing tier is left untouched.
     */
    List<MatchResult> applyAgreementBoost(List<MatchResult> results) {
        CategorizationSettings.Agreement agreement = settings.agreement();
        if (!agreement.enabled()) {
            return results;
        }
        Map<String, Integer> votes = new HashMap<>();
        for (MatchResult r : results) {
            r.getCategory().ifPresent(c -> votes.merge(c, 1, Integer::sum));
        }
        List<MatchResult> out = new ArrayList<>(results.size());
        for (MatchResult r : results) {
            String category = r.getCategory().orElse(null);
            if (category != null && votes.get(category) >= 2) {
                double confidence = Math.min(r.getConfidence() * agreement.factor(), agreement.cap());
                out.add(r.withConfidence(confidence, r.getNote() + " [agreement boost x" + votes.get(category) + "]"));
            } else {
                out.add(r);
            }
        }
        return out;
    }

    private static MatchResult selectBest(List<MatchResult> results) {
        MatchResult best = results.get(0);
        for (MatchResult r : results) {
            if (r.getConfidence() > best.getConfidence()) {
                best = r;
            }
        }
        return best;
    }
}
