package com.spendradar.categorization;

import lombok.Getter;

import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable outcome of one matcher or of arbitration: either a proposed category with a confidence in [0,1],
 * or no category with confidence 0. Evidence is the rule keyword or vendor key that fired, if any.
 */
@Getter
public final class MatchResult {

    private final String category;
    private final MatchStrategy strategy;
    private final double confidence;
    private final String evidence;
    private final String note;

    private MatchResult(String category, MatchStrategy strategy, double confidence, String evidence, String note) {
        this.category = category;
        this.strategy = Objects.requireNonNull(strategy, "strategy");
        this.confidence = clamp(confidence);
        this.evidence = evidence;
        this.note = note == null ? "" : note;
    }

    /**
     * A proposal from the given tier. A blank category or non-positive confidence collapses to a miss.
     */
    public static MatchResult matched(MatchStrategy strategy, String category, double confidence,
                                      String evidence, String note) {
        if (category == null || category.isBlank() || confidence <= 0.0) {
            return miss(strategy, note);
        }
        return new MatchResult(category, strategy, confidence, evidence, note);
    }

    /** The tier ran but has no opinion. */
    public static MatchResult miss(MatchStrategy strategy, String note) {
        return new MatchResult(null, strategy, 0.0, null, note);
    }

    /** Arbitration refused to answer. */
    public static MatchResult none(String note) {
        return new MatchResult(null, MatchStrategy.NONE, 0.0, null, note);
    }

    /** Arbitration refused to answer because an exclusion rule fired. */
    public static MatchResult excluded(String exclusionKeyword) {
        return new MatchResult(null, MatchStrategy.NONE, 0.0, exclusionKeyword,
                "Excluded by rule: " + exclusionKeyword);
    }

    /**
     * Copy with a new confidence and note; used by the agreement boost.
     */
    public MatchResult withConfidence(double newConfidence, String newNote) {
        return new MatchResult(category, strategy, newConfidence, evidence, newNote);
    }

    public boolean hasCategory() {
        return category != null;
    }

    public Optional<String> getCategory() {
        return Optional.ofNullable(category);
    }

    public Optional<String> getEvidence() {
        return Optional.ofNullable(evidence);
    }

    private static double clamp(double value) {
        if (Double.isNaN(value) || value < 0.0) {
            return 0.0;
        }
        return Math.min(value, 1.0);
    }

    @Override
    public String toString() {
        return "MatchResult{" + strategy + ", category=" + category + ", confidence="
                + String.format(Locale.ROOT, "%.3f", confidence) + ", note='" + note + "'}";
    }
}
