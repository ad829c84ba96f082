package com.spendradar.domain;

import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;

/**
 * Read access to imported transactions. Categorization never writes through this repository.
 */
public interface TransactionRepository extends MongoRepository<Transaction, String>, TransactionRepositoryCustom {

    List<Transaction> findByCategoryNotNull();
}
