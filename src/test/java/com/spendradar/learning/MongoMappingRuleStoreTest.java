package com.spendradar.learning;

import com.spendradar.domain.MappingRule;
import com.spendradar.domain.MappingRuleEntry;
import com.spendradar.domain.MappingRuleEntryRepository;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class MongoMappingRuleStoreTest {

    @Mock
    private MappingRuleEntryRepository repository;

    @InjectMocks
    private MongoMappingRuleStore store;

    private static MappingRuleEntry entry(String keyword, String category, int position, long generation, int size) {
        MappingRuleEntry e = new MappingRuleEntry();
        e.setKeyword(keyword);
        e.setCategory(category);
        e.setPosition(position);
        e.setGeneration(generation);
        e.setGenerationSize(size);
        return e;
    }

    @Test
    @DisplayName("loads rules in order, skipping corrupt rows and keeping exclusions")
    void loadAll() {
        when(repository.findAllByOrderByGenerationDescPositionAsc()).thenReturn(List.of(
                entry("gas", "Transportation", 0, 3, 5),
                entry(" ", "Dining", 1, 3, 5),
                entry("aroma", "", 2, 3, 5),
                entry("!creditcardco", null, 3, 3, 5),
                entry("GAS", "Other", 4, 3, 5)));

        assertThat(store.loadAll()).containsExactly(
                new MappingRule("gas", "Transportation"),
                new MappingRule("!creditcardco", ""));
    }

    @Test
    @DisplayName("half-written newer generation is ignored in favour of the last complete one")
    void ignoresIncompleteGeneration() {
        when(repository.findAllByOrderByGenerationDescPositionAsc()).thenReturn(List.of(
                entry("gas", "Transportation", 0, 2, 3),
                entry("aroma", "Dining", 1, 2, 3),
                entry("gas", "Transportation", 0, 1, 1)));

        assertThat(store.loadAll()).containsExactly(new MappingRule("gas", "Transportation"));
    }

    @Test
    @DisplayName("unreadable store loads as empty")
    void unreadable() {
        when(repository.findAllByOrderByGenerationDescPositionAsc())
                .thenThrow(new DataAccessResourceFailureException("down"));

        assertThat(store.loadAll()).isEmpty();
    }

    @Test
    @SuppressWarnings("unchecked")
    @DisplayName("replaceAll writes the next generation, then drops older ones")
    void replaceAll() {
        when(repository.findFirstByOrderByGenerationDesc())
                .thenReturn(Optional.of(entry("gas", "Transportation", 0, 4, 1)));

        store.replaceAll(List.of(
                new MappingRule("gas", "Transportation"),
                new MappingRule("gas", "Other"),
                new MappingRule("aroma", "Dining")));

        ArgumentCaptor<List<MappingRuleEntry>> saved = ArgumentCaptor.forClass(List.class);
        InOrder order = inOrder(repository);
        order.verify(repository).saveAll(saved.capture());
        order.verify(repository).deleteByGenerationLessThan(5L);
        assertThat(saved.getValue())
                .extracting(MappingRuleEntry::getKeyword, MappingRuleEntry::getPosition,
                        MappingRuleEntry::getGeneration, MappingRuleEntry::getGenerationSize)
                .containsExactly(
                        tuple("gas", 0, 5L, 2),
                        tuple("aroma", 1, 5L, 2));
        verify(repository, never()).deleteAll();
    }

    @Test
    @DisplayName("failed write keeps the previous table and discards the partial generation")
    void failedWriteKeepsPreviousTable() {
        when(repository.findFirstByOrderByGenerationDesc())
                .thenReturn(Optional.of(entry("gas", "Transportation", 0, 1, 1)));
        when(repository.saveAll(any())).thenThrow(new DataAccessResourceFailureException("down"));

        assertThatThrownBy(() -> store.replaceAll(List.of(
                new MappingRule("gas", "Transportation"), new MappingRule("aroma", "Dining"))))
                .isInstanceOf(RuleStoreException.class)
                .hasCauseInstanceOf(DataAccessResourceFailureException.class);

        verify(repository).deleteByGeneration(2L);
        verify(repository, never()).deleteByGenerationLessThan(anyLong());
        verify(repository, never()).deleteAll();
    }

    @Test
    @DisplayName("failed cleanup of old generations does not fail the write")
    void oldGenerationCleanupFailure() {
        when(repository.findFirstByOrderByGenerationDesc()).thenReturn(Optional.empty());
        when(repository.deleteByGenerationLessThan(1L)).thenThrow(new DataAccessResourceFailureException("down"));

        store.replaceAll(List.of(new MappingRule("gas", "Transportation")));

        verify(repository).saveAll(any());
    }
}
