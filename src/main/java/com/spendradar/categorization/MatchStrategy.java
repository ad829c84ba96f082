package com.spendradar.categorization;

/**
 * Tier that produced a {@link MatchResult}. Declaration order is the arbitration tie-break order.
 */
public enum MatchStrategy {
    KEYWORD,
    FUZZY,
    REMOTE,
    NONE
}
