package com.spendradar.categorization.remote;

import java.util.List;

/**
 * Port to a hosted text-completion service that picks one label from a closed category list.
 */
public interface RemoteCategoryClassifier {

    /**
     * Ask the service for a category.
     *
     * @param context    transaction context (description, optional amount and date)
     * @param categories closed list of allowed labels, passed through unmodified
     * @param apiKey     credential for the call
     * @return the raw answer text; the caller validates it against the list
     * @throws RemoteClassifierException on transport, auth, quota or response-shape failure
     */
    String classify(String context, List<String> categories, String apiKey);
}
