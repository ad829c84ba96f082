package com.spendradar.common;

import java.util.Arrays;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Normalizes merchant descriptions for vendor lookups: strips bidi and invisible marks, lower-cases,
 * drops Hebrew/English legal-entity suffix tokens and collapses whitespace.
 * Suffixes are removed as whole tokens so {@code normalize(normalize(x)) == normalize(x)}.
 */
public final class VendorNameNormalizer {

    /** Bidi embedding/override/isolate controls and LRM/RLM. Replaced by a space. */
    private static final String DIRECTIONAL_MARKS = "\u200e\u200f\u202a\u202b\u202c\u202d\u202e\u2066\u2067\u2068\u2069\u061c";
    /** No-break and typographic spaces. Replaced by a space. */
    private static final String INVISIBLE_SPACES = "\u00a0\u2000\u2001\u2002\u2003\u2004\u2005\u2006\u2007\u2008\u2009\u200a\u202f\u205f\u3000";
    /** Zero-width characters. Removed. */
    private static final String ZERO_WIDTH = "\u200b\u200c\u200d\u2060\ufeff";

    private static final Set<String> LEGAL_SUFFIXES = Set.of(
            "בע\"מ", "בעמ", "בע''מ", "בע״מ",
            "ltd", "inc", "llc", "corp", "limited", "corporation");

    private static final String SUFFIX_TRIM = ".,";

    private VendorNameNormalizer() {
    }

    /**
     * Full vendor normalization. Null or blank input yields an empty string.
     */
    public static String normalize(String text) {
        String cleaned = stripMarks(text).toLowerCase(Locale.ROOT);
        return Arrays.stream(cleaned.split("\\s+"))
                .filter(token -> !token.isEmpty())
                .filter(token -> !isLegalSuffix(token))
                .collect(Collectors.joining(" "));
    }

    /**
     * Replaces directional marks and invisible spaces with a plain space and drops zero-width characters.
     * Case and tokens are preserved.
     */
    public static String stripMarks(String text) {
        if (text == null || text.isEmpty()) {
            return "";
        }
        StringBuilder sb = new StringBuilder(text.length());
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (DIRECTIONAL_MARKS.indexOf(c) >= 0 || INVISIBLE_SPACES.indexOf(c) >= 0) {
                sb.append(' ');
            } else if (ZERO_WIDTH.indexOf(c) < 0) {
                sb.append(c);
            }
        }
        return sb.toString();
    }

    /**
     * True when the lower-cased token is a legal-entity suffix, ignoring trailing dots and commas ("ltd.").
     */
    public static boolean isLegalSuffix(String token) {
        if (token == null || token.isEmpty()) {
            return false;
        }
        int end = token.length();
        while (end > 0 && SUFFIX_TRIM.indexOf(token.charAt(end - 1)) >= 0) {
            end--;
        }
        return end > 0 && LEGAL_SUFFIXES.contains(token.substring(0, end));
    }
}
