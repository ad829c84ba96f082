package com.spendradar.domain;

import java.util.List;

/**
 * Custom queries for transactions.
 */
public interface TransactionRepositoryCustom {

    /** Non-blank categories already assigned to stored transactions. */
    List<String> findDistinctCategories();
}
