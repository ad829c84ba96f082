package com.spendradar.session;

import com.spendradar.categorization.MatchResult;
import com.spendradar.domain.Transaction;

import java.util.List;

/**
 * Outcome of a sequential batch run. Decisions are in input order; callers write assigned categories back.
 */
public record BatchCategorizationResult(
        List<Decision> decisions,
        int processed,
        int assigned,
        int skipped
) {

    /**
     * One transaction and the arbitration result for it. {@code assigned} is true when the result cleared the
     * minimum confidence and its category should be applied.
     */
    public record Decision(Transaction transaction, MatchResult result, boolean assigned) {
    }
}
