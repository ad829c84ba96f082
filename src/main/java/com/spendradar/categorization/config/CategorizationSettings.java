package com.spendradar.categorization.config;

import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Immutable categorization thresholds and constants, built once from {@link CategorizationProperties}
 * and passed to every matcher, the arbitration engine and the learner.
 */
public record CategorizationSettings(
        int fuzzyThreshold,
        double minConfidence,
        Keyword keyword,
        Fuzzy fuzzy,
        Agreement agreement,
        List<String> categories,
        Learner learner,
        Remote remote
) {

    public CategorizationSettings {
        if (fuzzyThreshold < 0 || fuzzyThreshold > 100) {
            throw new IllegalStateException("fuzzy-threshold must be within 0..100: " + fuzzyThreshold);
        }
        requireUnit("min-confidence", minConfidence);
        categories = categories == null ? List.of() : categories.stream()
                .filter(c -> c != null && !c.isBlank())
                .map(String::strip)
                .distinct()
                .toList();
    }

    public static CategorizationSettings defaults() {
        return from(new CategorizationProperties());
    }

    public static CategorizationSettings from(CategorizationProperties p) {
        CategorizationProperties.LearnerProperties l = p.getLearner();
        CategorizationProperties.RemoteProperties r = p.getRemote();
        return new CategorizationSettings(
                p.getFuzzyThreshold(),
                p.getMinConfidence(),
                new Keyword(p.getKeywordExactConfidence(), p.getKeywordSubstringConfidence(),
                        p.getKeywordPhraseCap(), p.getKeywordSubstringMinLength()),
                new Fuzzy(p.getFuzzyConfidenceCap(), p.getFuzzyHighScore(),
                        p.getFuzzyHighScoreBoost(), p.getFuzzyHighScoreCap()),
                new Agreement(p.isAgreementBoostEnabled(), p.getAgreementBoostFactor(), p.getAgreementBoostCap()),
                p.getCategories(),
                new Learner(l.getMinTokenLength(), l.getDistinctiveTokenMinLength(), l.getMaxVendorTokens(),
                        l.getScanWindow(), normalizeStopWords(l.getStopWords())),
                new Remote(r.getApiKey(), r.getBaseUrl(), r.getModel(), r.getConfidence(),
                        Duration.ofSeconds(Math.max(1, r.getTimeoutSeconds())), r.getMaxTokens(), r.getTemperature(),
                        Math.max(1, r.getRequestsPerSecond()), Duration.ofMinutes(Math.max(0, r.getCacheTtlMinutes())))
        );
    }

    /**
     * Copy with another fuzzy threshold; lets a single call override the configured cutoff.
     */
    public CategorizationSettings withFuzzyThreshold(int threshold) {
        return new CategorizationSettings(threshold, minConfidence, keyword, fuzzy, agreement, categories, learner, remote);
    }

    /**
     * Copy with another remote credential (null or blank disables the remote tier).
     */
    public CategorizationSettings withRemoteApiKey(String apiKey) {
        return new CategorizationSettings(fuzzyThreshold, minConfidence, keyword, fuzzy, agreement, categories, learner,
                new Remote(apiKey, remote.baseUrl(), remote.model(), remote.confidence(), remote.timeout(),
                        remote.maxTokens(), remote.temperature(), remote.requestsPerSecond(), remote.cacheTtl()));
    }

    private static Set<String> normalizeStopWords(List<String> words) {
        if (words == null) {
            return Set.of();
        }
        return words.stream()
                .filter(w -> w != null && !w.isBlank())
                .map(w -> w.strip().toLowerCase(Locale.ROOT))
                .collect(Collectors.toUnmodifiableSet());
    }

    private static void requireUnit(String name, double value) {
        if (Double.isNaN(value) || value < 0.0 || value > 1.0) {
            throw new IllegalStateException(name + " must be within 0..1: " + value);
        }
    }

    public record Keyword(double exactConfidence, double substringConfidence, double phraseCap, int substringMinLength) {
        public Keyword {
            requireUnit("keyword-exact-confidence", exactConfidence);
            requireUnit("keyword-substring-confidence", substringConfidence);
            requireUnit("keyword-phrase-cap", phraseCap);
        }
    }

    public record Fuzzy(double confidenceCap, int highScore, double highScoreBoost, double highScoreCap) {
        public Fuzzy {
            requireUnit("fuzzy-confidence-cap", confidenceCap);
            requireUnit("fuzzy-high-score-cap", highScoreCap);
        }
    }

    public record Agreement(boolean enabled, double factor, double cap) {
        public Agreement {
            requireUnit("agreement-boost-cap", cap);
        }
    }

    public record Learner(int minTokenLength, int distinctiveTokenMinLength, int maxVendorTokens, int scanWindow,
                          Set<String> stopWords) {
    }

    public record Remote(String apiKey, String baseUrl, String model, double confidence, Duration timeout,
                         int maxTokens, double temperature, int requestsPerSecond, Duration cacheTtl) {
        public Remote {
            requireUnit("remote.confidence", confidence);
        }

        public Optional<String> credential() {
            return apiKey == null || apiKey.isBlank() ? Optional.empty() : Optional.of(apiKey.strip());
        }

        @Override
        public String toString() {
            return "Remote[baseUrl=" + baseUrl + ", model=" + model + ", credential="
                    + (credential().isPresent() ? "***" : "none") + "]";
        }
    }
}
