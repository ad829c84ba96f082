package com.spendradar.categorization.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * Categorization configuration. Documented in application.yml under spendradar.categorization.
 * Converted once into {@link CategorizationSettings}, which is what the matchers receive.
 */
@ConfigurationProperties(prefix = "spendradar.categorization")
@Getter
@Setter
public class CategorizationProperties {

    /** Token-set similarity cutoff for the fuzzy tier, 0..100. */
    private int fuzzyThreshold = 86;

    /** Arbitration refuses winners below this confidence. */
    private double minConfidence = 0.7;

    /** Whole-token keyword hit; also the base for phrase hits. */
    private double keywordExactConfidence = 0.95;

    /** Keyword found inside a longer token. */
    private double keywordSubstringConfidence = 0.85;

    /** Upper bound for phrase hits (base + 0.01 per word). */
    private double keywordPhraseCap = 0.98;

    /** Minimum keyword length for the substring tier. */
    private int keywordSubstringMinLength = 5;

    /** Fuzzy confidence is score/100 capped here. */
    private double fuzzyConfidenceCap = 0.9;

    /** Fuzzy scores at or above this get the high-score boost. */
    private int fuzzyHighScore = 95;

    private double fuzzyHighScoreBoost = 1.05;

    private double fuzzyHighScoreCap = 0.95;

    /** Multiply agreeing tiers' confidence when two or more propose the same category. */
    private boolean agreementBoostEnabled = true;

    private double agreementBoostFactor = 1.2;

    private double agreementBoostCap = 0.98;

    /**
     * Default closed category list. Categories already used by stored transactions are added per session.
     */
    private List<String> categories = new ArrayList<>();

    private LearnerProperties learner = new LearnerProperties();

    private RemoteProperties remote = new RemoteProperties();

    @Getter
    @Setter
    public static class LearnerProperties {
        /** Tokens shorter than this are never learned. */
        private int minTokenLength = 3;
        /** Single-token rules require at least this length. */
        private int distinctiveTokenMinLength = 6;
        /** Vendor phrase length in tokens. */
        private int maxVendorTokens = 3;
        /** Only the first N raw tokens of a description are scanned. */
        private int scanWindow = 5;
        /** Articles, generic business words and legal-entity suffixes (Hebrew and English). */
        private List<String> stopWords = new ArrayList<>(List.of(
                "של", "את", "על", "עם", "אל", "מן", "כי", "אם", "לא", "או", "גם", "רק",
                "the", "and", "for", "with", "from", "ltd", "inc", "llc", "corp", "limited",
                "בע\"מ", "בעמ", "בע''מ", "חפ", "עמ", "ושות",
                "company", "corporation", "group", "international"));
    }

    @Getter
    @Setter
    public static class RemoteProperties {
        /** Credential for the hosted completion service. Blank disables the remote tier. */
        private String apiKey;
        private String baseUrl = "https://api.openai.com/v1";
        private String model = "gpt-3.5-turbo";
        /** Flat confidence for a valid remote answer; the service reports no certainty. */
        private double confidence = 0.75;
        private int timeoutSeconds = 15;
        private int maxTokens = 50;
        private double temperature = 0.1;
        /** Local limiter for outbound calls. */
        private int requestsPerSecond = 3;
        /** How long a valid answer for an identical request is reused. 0 disables caching. */
        private int cacheTtlMinutes = 60;
    }
}
