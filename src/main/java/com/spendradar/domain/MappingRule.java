package com.spendradar.domain;

import java.util.Locale;

/**
 * Learned (keyword → category) rule. Keyword is lower-cased and trimmed on construction;
 * a leading {@code !} marks an exclusion rule whose category is ignored.
 */
public record MappingRule(String keyword, String category) {

    public static final String EXCLUSION_PREFIX = "!";

    public MappingRule {
        keyword = keyword == null ? "" : keyword.strip().toLowerCase(Locale.ROOT);
        category = category == null ? "" : category.strip();
    }

    public boolean isExclusion() {
        return keyword.startsWith(EXCLUSION_PREFIX);
    }

    /**
     * Keyword without the exclusion marker. Same as {@link #keyword()} for ordinary rules.
     */
    public String root() {
        return isExclusion() ? keyword.substring(EXCLUSION_PREFIX.length()).strip() : keyword;
    }

    public boolean isPhrase() {
        return keyword.indexOf(' ') >= 0;
    }

    public boolean isBlank() {
        return root().isEmpty();
    }
}
