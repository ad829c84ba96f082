package com.spendradar.domain;

import lombok.RequiredArgsConstructor;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.stereotype.Repository;

import java.util.List;

import static org.springframework.data.mongodb.core.query.Criteria.where;

/**
 * MongoTemplate-backed custom queries for transactions.
 */
@Repository
@RequiredArgsConstructor
public class TransactionRepositoryImpl implements TransactionRepositoryCustom {

    private final MongoTemplate mongoTemplate;

    @Override
    public List<String> findDistinctCategories() {
        Query query = new Query(where("category").nin(null, ""));
        return mongoTemplate.findDistinct(query, "category", Transaction.class, String.class).stream()
                .filter(c -> c != null && !c.isBlank())
                .map(String::strip)
                .distinct()
                .sorted()
                .toList();
    }
}
