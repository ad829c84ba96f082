package com.spendradar.categorization.matcher;

import com.github.benmanes.caffeine.cache.Cache;
import com.spendradar.categorization.CategorizationRequest;
import com.spendradar.categorization.MatchResult;
import com.spendradar.categorization.MatchStrategy;
import com.spendradar.categorization.config.CategorizationSettings;
import com.spendradar.categorization.remote.RemoteCategoryClassifier;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Remote tier. Only answers that are exactly one of the allowed categories are accepted, at a flat confidence.
 * Missing credential, failures and invalid answers all become a zero-confidence result; nothing is thrown.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class RemoteClassifierMatcher {

    public static final String NO_CREDENTIAL = "no credential";

    private final CategorizationSettings settings;
    private final RemoteCategoryClassifier classifier;
    @Qualifier("remoteAnswerCache")
    private final Cache<String, String> remoteAnswerCache;

    public MatchResult match(CategorizationRequest request, List<String> categories) {
        return match(request, categories, settings.remote().credential().orElse(null));
    }

    public MatchResult match(CategorizationRequest request, List<String> categories, String apiKey) {
        if (apiKey == null || apiKey.isBlank()) {
            return MatchResult.miss(MatchStrategy.REMOTE, NO_CREDENTIAL);
        }
        if (request == null || request.isBlank()) {
            return MatchResult.miss(MatchStrategy.REMOTE, "Empty description");
        }
        if (categories == null || categories.isEmpty()) {
            return MatchResult.miss(MatchStrategy.REMOTE, "No categories to choose from");
        }

        String context = buildContext(request);
        String cacheKey = context + "\u0000" + String.join("\u0001", categories);
        String answer = remoteAnswerCache.getIfPresent(cacheKey);
        if (answer == null) {
            try {
                answer = classifier.classify(context, categories, apiKey.strip());
            } catch (RuntimeException e) {
                log.warn("Remote classification failed for '{}': {}", request.description(), e.getMessage());
                return MatchResult.miss(MatchStrategy.REMOTE, "error: " + e.getMessage());
            }
        }

        String suggested = answer == null ? "" : answer.strip();
        if (!categories.contains(suggested)) {
            log.debug("Remote classifier answered '{}' outside the category list", suggested);
            return MatchResult.miss(MatchStrategy.REMOTE, "Remote returned invalid category: " + suggested);
        }
        remoteAnswerCache.put(cacheKey, suggested);
        return MatchResult.matched(MatchStrategy.REMOTE, suggested, settings.remote().confidence(), null,
                "Remote suggestion: " + suggested);
    }

    static String buildContext(CategorizationRequest request) {
        StringBuilder sb = new StringBuilder("Transaction: ").append(request.description().strip());
        if (request.amount() != null) {
            sb.append("\nAmount: ").append(request.amount().toPlainString());
        }
        if (request.date() != null) {
            sb.append("\nDate: ").append(request.date());
        }
        return sb.toString();
    }
}
