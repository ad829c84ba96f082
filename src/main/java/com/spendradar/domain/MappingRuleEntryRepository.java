package com.spendradar.domain;

import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;
import java.util.Optional;

/**
 * Persistence for mapping_rules.
 */
public interface MappingRuleEntryRepository extends MongoRepository<MappingRuleEntry, String> {

    List<MappingRuleEntry> findAllByOrderByGenerationDescPositionAsc();

    Optional<MappingRuleEntry> findFirstByOrderByGenerationDesc();

    long deleteByGeneration(long generation);

    long deleteByGenerationLessThan(long generation);
}
