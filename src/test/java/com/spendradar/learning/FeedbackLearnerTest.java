package com.spendradar.learning;

import com.spendradar.categorization.VendorMap;
import com.spendradar.categorization.config.CategorizationSettings;
import com.spendradar.domain.MappingRule;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class FeedbackLearnerTest {

    @Mock
    private MappingRuleStore ruleStore;

    private FeedbackLearner learner;

    @BeforeEach
    void setUp() {
        learner = new FeedbackLearner(CategorizationSettings.defaults(), ruleStore);
    }

    @Test
    @DisplayName("learns two- and three-token phrases plus one distinctive token")
    void learnsPhrases() {
        LearningOutcome outcome = learner.learn("Cinema City Glilot 12/03", "Entertainment", List.of(), VendorMap.empty());

        assertThat(outcome.addedRules()).containsExactly(
                new MappingRule("cinema city", "Entertainment"),
                new MappingRule("cinema city glilot", "Entertainment"),
                new MappingRule("cinema", "Entertainment"));
        assertThat(outcome.vendorKeys()).containsExactly("cinema city glilot");
        assertThat(outcome.vendorMap().get("cinema city glilot")).contains("Entertainment");
        verify(ruleStore).replaceAll(outcome.rules());
    }

    @Test
    @DisplayName("repeating a confirmation adds nothing")
    void idempotent() {
        LearningOutcome first = learner.learn("Cinema City Glilot", "Entertainment", List.of(), VendorMap.empty());
        LearningOutcome second = learner.learn("Cinema City Glilot", "Entertainment", first.rules(), first.vendorMap());

        assertThat(second.learnedNewRules()).isFalse();
        assertThat(second.rules()).isEqualTo(first.rules());
        assertThat(second.vendorMap().size()).isEqualTo(first.vendorMap().size());
    }

    @Test
    @DisplayName("stop words and short tokens never become rules")
    void stopWords() {
        LearningOutcome outcome = learner.learn("The Coffee Bean Ltd", "Dining", List.of(), VendorMap.empty());

        assertThat(outcome.addedRules()).extracting(MappingRule::keyword)
                .containsExactly("coffee bean", "coffee");
    }

    @Test
    @DisplayName("Hebrew legal suffix is a stop word and short tokens are dropped")
    void hebrew() {
        LearningOutcome outcome = learner.learn("פז חברת נפט בע\"מ", "תחבורה", List.of(), VendorMap.empty());

        assertThat(outcome.addedRules()).extracting(MappingRule::keyword).containsExactly("חברת נפט");
    }

    @Test
    @DisplayName("vendor map gets raw and normalized keys when they differ")
    void normalizedVendorKey() {
        LearningOutcome outcome = learner.learn("Aroma Espresso Ltd. Tel Aviv", "Dining", List.of(), VendorMap.empty());

        assertThat(outcome.vendorKeys()).containsExactly("aroma espresso ltd.", "aroma espresso");
        assertThat(outcome.addedRules()).extracting(MappingRule::keyword)
                .containsExactly("aroma espresso", "aroma espresso tel", "espresso");
    }

    @Test
    @DisplayName("existing keyword keeps its category")
    void existingRuleKept() {
        List<MappingRule> rules = List.of(new MappingRule("cinema city", "Leisure"));

        LearningOutcome outcome = learner.learn("Cinema City Glilot", "Entertainment", rules, VendorMap.empty());

        assertThat(outcome.rules()).contains(new MappingRule("cinema city", "Leisure"));
        assertThat(outcome.rules()).doesNotContain(new MappingRule("cinema city", "Entertainment"));
    }

    @Test
    @DisplayName("rules written since the caller's snapshot are kept")
    void keepsConcurrentlyStoredRules() {
        MappingRule storedMeanwhile = new MappingRule("aroma espresso", "Dining");
        when(ruleStore.loadAll()).thenReturn(List.of(new MappingRule("gas", "Transportation"), storedMeanwhile));

        LearningOutcome outcome = learner.learn("Cinema City Glilot", "Entertainment",
                List.of(new MappingRule("gas", "Transportation")), VendorMap.empty());

        assertThat(outcome.rules()).startsWith(new MappingRule("gas", "Transportation"), storedMeanwhile)
                .contains(new MappingRule("cinema city", "Entertainment"));
        verify(ruleStore).replaceAll(outcome.rules());
    }

    @Test
    @DisplayName("inputs are left untouched")
    void inputsUnmodified() {
        List<MappingRule> rules = new ArrayList<>(List.of(new MappingRule("gas", "Transportation")));
        VendorMap vendors = VendorMap.empty();

        learner.learn("Super Pharm Haifa", "Health", rules, vendors);

        assertThat(rules).hasSize(1);
        assertThat(vendors.isEmpty()).isTrue();
    }

    @Test
    @DisplayName("punctuation is trimmed from token edges only")
    void punctuation() {
        assertThat(FeedbackLearner.trimPunctuation("(aroma),")).isEqualTo("aroma");
        assertThat(FeedbackLearner.trimPunctuation("a.m.p.m")).isEqualTo("a.m.p.m");
        assertThat(FeedbackLearner.trimPunctuation("...")).isEmpty();
    }

    @Test
    @DisplayName("store failure propagates")
    void storeFailure() {
        doThrow(new RuleStoreException("down", null)).when(ruleStore).replaceAll(anyList());

        assertThatThrownBy(() -> learner.learn("Super Pharm", "Health", List.of(), VendorMap.empty()))
                .isInstanceOf(RuleStoreException.class);
    }

    @Test
    @DisplayName("blank input is rejected before touching the store")
    void blankInput() {
        assertThatThrownBy(() -> learner.learn(" ", "Health", List.of(), VendorMap.empty()))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> learner.learn("Super Pharm", "", List.of(), VendorMap.empty()))
                .isInstanceOf(IllegalArgumentException.class);
        verifyNoInteractions(ruleStore);
    }
}
