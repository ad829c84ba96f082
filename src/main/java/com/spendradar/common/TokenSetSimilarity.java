package com.spendradar.common;

import org.apache.commons.text.similarity.LongestCommonSubsequence;

import java.util.Arrays;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Order-independent, subset-tolerant string similarity on a 0..100 scale.
 * <p>
 * Both inputs are split on whitespace into token sets. When one set is contained in the other the score is 100.
 * Otherwise the score is the best of: intersection + one difference against intersection + the other, and the
 * sorted intersection against intersection + each difference. Similarity is the normalized insertion/deletion
 * distance {@code 100 * (1 - indel / (len(a) + len(b)))}.
 */
public final class TokenSetSimilarity {

    private static final LongestCommonSubsequence LCS = new LongestCommonSubsequence();

    private TokenSetSimilarity() {
    }

    public static double tokenSetRatio(String left, String right) {
        Set<String> a = tokens(left);
        Set<String> b = tokens(right);
        if (a.isEmpty() || b.isEmpty()) {
            return 0.0;
        }
        Set<String> intersection = new TreeSet<>(a);
        intersection.retainAll(b);
        Set<String> diffAb = new TreeSet<>(a);
        diffAb.removeAll(b);
        Set<String> diffBa = new TreeSet<>(b);
        diffBa.removeAll(a);

        if (!intersection.isEmpty() && (diffAb.isEmpty() || diffBa.isEmpty())) {
            return 100.0;
        }

        String diffAbJoined = String.join(" ", diffAb);
        String diffBaJoined = String.join(" ", diffBa);
        int abLen = diffAbJoined.length();
        int baLen = diffBaJoined.length();
        int sectLen = String.join(" ", intersection).length();
        int separator = sectLen > 0 ? 1 : 0;
        int sectAbLen = sectLen + separator + abLen;
        int sectBaLen = sectLen + separator + baLen;

        // (sect + diffAb) vs (sect + diffBa): the shared prefix cancels, only the differences cost edits
        double result = normalized(indelDistance(diffAbJoined, diffBaJoined), sectAbLen + sectBaLen);
        if (sectLen == 0) {
            return result;
        }

        double sectAbRatio = normalized(separator + abLen, sectLen + sectAbLen);
        double sectBaRatio = normalized(separator + baLen, sectLen + sectBaLen);
        return Math.max(result, Math.max(sectAbRatio, sectBaRatio));
    }

    /**
     * Normalized indel similarity, 0..100. Two empty strings are identical (100).
     */
    public static double ratio(String left, String right) {
        String a = left == null ? "" : left;
        String b = right == null ? "" : right;
        int total = a.length() + b.length();
        if (total == 0) {
            return 100.0;
        }
        return normalized(indelDistance(a, b), total);
    }

    private static int indelDistance(String a, String b) {
        return a.length() + b.length() - 2 * LCS.apply(a, b);
    }

    private static double normalized(int distance, int total) {
        return total == 0 ? 100.0 : 100.0 * (1.0 - (double) distance / total);
    }

    /**
     * Best-scoring choice for the query, or null when no choice reaches the cutoff. Ties keep the first choice.
     */
    public static ScoredChoice extractOne(String query, Iterable<String> choices, double cutoff) {
        ScoredChoice best = null;
        for (String choice : choices) {
            double score = tokenSetRatio(query, choice);
            if (score >= cutoff && (best == null || score > best.score())) {
                best = new ScoredChoice(choice, score);
            }
        }
        return best;
    }

    private static Set<String> tokens(String text) {
        if (text == null || text.isBlank()) {
            return Set.of();
        }
        List<String> parts = Arrays.asList(text.strip().split("\\s+"));
        return parts.stream().filter(p -> !p.isEmpty()).collect(Collectors.toCollection(TreeSet::new));
    }

    /**
     * A choice and its 0..100 similarity score.
     */
    public record ScoredChoice(String choice, double score) {
    }
}
