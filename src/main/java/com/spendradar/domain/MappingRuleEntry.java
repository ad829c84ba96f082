package com.spendradar.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.mapping.Document;

/**
 * Stored form of a {@link MappingRule}. Every rewrite of the rule table is a new generation; readers use the
 * newest generation whose row count equals {@code generationSize}, so a half-written table is never read.
 * Position keeps the rule list order within a generation.
 */
@Document(collection = "mapping_rules")
@CompoundIndex(name = "generation_keyword", def = "{'generation': 1, 'keyword': 1}", unique = true)
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class MappingRuleEntry {

    @Id
    @EqualsAndHashCode.Include
    private String id;
    private String keyword;
    private String category;
    private int position;
    private long generation;
    private int generationSize;

    public static MappingRuleEntry of(MappingRule rule, int position, long generation, int generationSize) {
        MappingRuleEntry entry = new MappingRuleEntry();
        entry.setKeyword(rule.keyword());
        entry.setCategory(rule.category());
        entry.setPosition(position);
        entry.setGeneration(generation);
        entry.setGenerationSize(generationSize);
        return entry;
    }

    public MappingRule toRule() {
        return new MappingRule(keyword, category);
    }
}
