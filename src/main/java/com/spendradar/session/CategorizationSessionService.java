package com.spendradar.session;

import com.spendradar.categorization.CategorizationRequest;
import com.spendradar.categorization.CategoryArbitrationEngine;
import com.spendradar.categorization.MatchResult;
import com.spendradar.categorization.VendorMap;
import com.spendradar.categorization.config.CategorizationSettings;
import com.spendradar.domain.MappingRule;
import com.spendradar.domain.Transaction;
import com.spendradar.domain.TransactionRepository;
import com.spendradar.learning.FeedbackLearner;
import com.spendradar.learning.LearningOutcome;
import com.spendradar.learning.MappingRuleStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Session lifecycle around the arbitration engine: load rules and rebuild the vendor map at session start,
 * categorize single descriptions or sequential batches, and feed confirmed corrections to the learner.
 * Transactions are only read; callers apply returned categories themselves.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CategorizationSessionService {

    private final CategorizationSettings settings;
    private final CategoryArbitrationEngine engine;
    private final FeedbackLearner feedbackLearner;
    private final MappingRuleStore ruleStore;
    private final TransactionRepository transactionRepository;

    /**
     * Opens a session: stored rules, vendor map from categorized transactions, configured + used categories.
     * An unreadable transaction store yields an empty vendor map and only the configured categories.
     */
    public CategorizationSession openSession() {
        List<MappingRule> rules = ruleStore.loadAll();
        VendorMap vendorMap = VendorMap.empty();
        Set<String> categories = new LinkedHashSet<>(settings.categories());
        try {
            vendorMap = VendorMap.fromTransactions(transactionRepository.findByCategoryNotNull());
            categories.addAll(transactionRepository.findDistinctCategories());
        } catch (DataAccessException e) {
            log.warn("Transaction store unreadable, session starts without vendor history: {}", e.getMessage());
        }
        log.info("Categorization session opened: {} rules, {} vendors, {} categories",
                rules.size(), vendorMap.size(), categories.size());
        return new CategorizationSession(rules, vendorMap, new ArrayList<>(categories));
    }

    public MatchResult suggest(CategorizationSession session, String description, BigDecimal amount, LocalDate date) {
        return suggest(session, new CategorizationRequest(description, amount, date));
    }

    public MatchResult suggest(CategorizationSession session, CategorizationRequest request) {
        CategorizationSession.Snapshot snapshot = session.snapshot();
        return engine.decide(request, snapshot.rules(), snapshot.vendorMap(), snapshot.categories());
    }

    /**
     * Categorizes transactions one by one in input order. With {@code onlyUncategorized}, transactions that
     * already have a category are skipped; blank descriptions are always skipped.
     */
    public BatchCategorizationResult categorizeBatch(CategorizationSession session, List<Transaction> transactions,
                                                     boolean onlyUncategorized) {
        List<BatchCategorizationResult.Decision> decisions = new ArrayList<>();
        int processed = 0;
        int assigned = 0;
        int skipped = 0;
        for (Transaction tx : transactions == null ? List.<Transaction>of() : transactions) {
            if (tx == null || (onlyUncategorized && tx.isCategorized())
                    || tx.getDescription() == null || tx.getDescription().isBlank()) {
                skipped++;
                continue;
            }
            MatchResult result = suggest(session, new CategorizationRequest(tx.getDescription(), tx.getAmount(), tx.getDate()));
            boolean apply = result.hasCategory() && result.getConfidence() >= settings.minConfidence();
            decisions.add(new BatchCategorizationResult.Decision(tx, result, apply));
            processed++;
            if (apply) {
                assigned++;
            }
        }
        log.info("Batch categorization: processed={}, assigned={}, skipped={}", processed, assigned, skipped);
        return new BatchCategorizationResult(List.copyOf(decisions), processed, assigned, skipped);
    }

    /**
     * Learns from a user-confirmed category and publishes the new tables to the session.
     *
     * @throws CategorizationException INVALID_FEEDBACK when description or category is blank
     * @throws com.spendradar.learning.RuleStoreException when the rule table cannot be written
     */
    public LearningOutcome confirmCategory(CategorizationSession session, String description, String category) {
        if (description == null || description.isBlank()) {
            throw new CategorizationException(CategorizationException.INVALID_FEEDBACK, "Description is required");
        }
        if (category == null || category.isBlank()) {
            throw new CategorizationException(CategorizationException.INVALID_FEEDBACK, "Category is required");
        }
        synchronized (session) {
            CategorizationSession.Snapshot snapshot = session.snapshot();
            LearningOutcome outcome = feedbackLearner.learn(description, category, snapshot.rules(), snapshot.vendorMap());
            session.replace(outcome.rules(), outcome.vendorMap(), category);
            return outcome;
        }
    }
}
