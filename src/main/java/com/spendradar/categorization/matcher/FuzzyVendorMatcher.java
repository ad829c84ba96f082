package com.spendradar.categorization.matcher;

import com.spendradar.categorization.MatchResult;
import com.spendradar.categorization.MatchStrategy;
import com.spendradar.categorization.VendorMap;
import com.spendradar.categorization.config.CategorizationSettings;
import com.spendradar.common.TokenSetSimilarity;
import com.spendradar.common.VendorNameNormalizer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;

/**
 * Vendor-map tier. Scans several word windows of the normalized description (first 2/3/4 words, words 2-4 to
 * skip a leading transaction code, and the whole text when it is short) against the vendor keys with
 * token-set similarity, keeping the single best hit that reaches the threshold.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class FuzzyVendorMatcher {

    private static final int SHORT_DESCRIPTION_WORDS = 3;

    private final CategorizationSettings settings;

    public MatchResult match(String description, VendorMap vendorMap) {
        return match(description, vendorMap, settings.fuzzyThreshold());
    }

    public MatchResult match(String description, VendorMap vendorMap, int threshold) {
        if (vendorMap == null || vendorMap.isEmpty()) {
            return MatchResult.miss(MatchStrategy.FUZZY, "No vendor mappings available");
        }
        String normalized = VendorNameNormalizer.normalize(description);
        if (normalized.isEmpty()) {
            return MatchResult.miss(MatchStrategy.FUZZY, "Empty description");
        }

        TokenSetSimilarity.ScoredChoice best = null;
        String bestWindow = null;
        for (String window : candidateWindows(normalized)) {
            TokenSetSimilarity.ScoredChoice hit = TokenSetSimilarity.extractOne(window, vendorMap.vendors(), threshold);
            if (hit != null && (best == null || hit.score() > best.score())) {
                best = hit;
                bestWindow = window;
            }
        }
        if (best == null) {
            return MatchResult.miss(MatchStrategy.FUZZY, "No fuzzy matches above threshold " + threshold);
        }

        double confidence = confidenceFor(best.score());
        String category = vendorMap.get(best.choice()).orElse(null);
        log.debug("Fuzzy hit '{}' from window '{}' score {}", best.choice(), bestWindow, best.score());
        return MatchResult.matched(MatchStrategy.FUZZY, category, confidence, best.choice(),
                String.format(Locale.ROOT, "Fuzzy match: '%s' from '%s' (score: %.1f)",
                        best.choice(), bestWindow, best.score()));
    }

    /**
     * Windows in scan order. Blank windows are never produced.
     */
    static List<String> candidateWindows(String normalized) {
        List<String> words = Arrays.stream(normalized.split("\\s+")).filter(w -> !w.isEmpty()).toList();
        List<String> windows = new ArrayList<>();
        if (words.size() >= 2) {
            windows.add(String.join(" ", words.subList(0, 2)));
        }
        if (words.size() >= 3) {
            windows.add(String.join(" ", words.subList(0, 3)));
        }
        if (words.size() >= 4) {
            windows.add(String.join(" ", words.subList(0, 4)));
            windows.add(String.join(" ", words.subList(1, 4)));
        }
        if (!words.isEmpty() && words.size() <= SHORT_DESCRIPTION_WORDS) {
            windows.add(String.join(" ", words));
        }
        return windows;
    }

    double confidenceFor(double score) {
        CategorizationSettings.Fuzzy f = settings.fuzzy();
        double confidence = Math.min(score / 100.0, f.confidenceCap());
        if (score >= f.highScore()) {
            confidence = Math.min(confidence * f.highScoreBoost(), f.highScoreCap());
        }
        return confidence;
    }
}
