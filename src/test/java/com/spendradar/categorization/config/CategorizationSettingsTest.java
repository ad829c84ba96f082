package com.spendradar.categorization.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CategorizationSettingsTest {

    @Test
    @DisplayName("defaults carry the documented thresholds")
    void defaults() {
        CategorizationSettings s = CategorizationSettings.defaults();

        assertThat(s.fuzzyThreshold()).isEqualTo(86);
        assertThat(s.minConfidence()).isEqualTo(0.7);
        assertThat(s.keyword().exactConfidence()).isEqualTo(0.95);
        assertThat(s.keyword().substringConfidence()).isEqualTo(0.85);
        assertThat(s.agreement().factor()).isEqualTo(1.2);
        assertThat(s.remote().credential()).isEmpty();
        assertThat(s.learner().stopWords()).contains("the", "ltd", "של");
    }

    @Test
    @DisplayName("out-of-range values fail fast")
    void validation() {
        CategorizationProperties threshold = new CategorizationProperties();
        threshold.setFuzzyThreshold(101);
        CategorizationProperties confidence = new CategorizationProperties();
        confidence.setMinConfidence(1.5);

        assertThatThrownBy(() -> CategorizationSettings.from(threshold))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("fuzzy-threshold");
        assertThatThrownBy(() -> CategorizationSettings.from(confidence))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("min-confidence");
    }

    @Test
    @DisplayName("categories are stripped, deduplicated and blank-free")
    void categories() {
        CategorizationProperties props = new CategorizationProperties();
        props.setCategories(Arrays.asList(" Dining ", "Dining", "", null, "מזון"));

        assertThat(CategorizationSettings.from(props).categories()).containsExactly("Dining", "מזון");
    }

    @Test
    @DisplayName("stop words are lower-cased")
    void stopWords() {
        CategorizationProperties props = new CategorizationProperties();
        props.getLearner().setStopWords(List.of("THE", " Group "));

        assertThat(CategorizationSettings.from(props).learner().stopWords()).containsExactlyInAnyOrder("the", "group");
    }

    @Test
    @DisplayName("credential override and masking")
    void credential() {
        CategorizationSettings s = CategorizationSettings.defaults().withRemoteApiKey(" sk-secret ");

        assertThat(s.remote().credential()).contains("sk-secret");
        assertThat(s.remote().toString()).doesNotContain("sk-secret").contains("***");
        assertThat(s.withRemoteApiKey("  ").remote().credential()).isEmpty();
        assertThat(s.withFuzzyThreshold(90).fuzzyThreshold()).isEqualTo(90);
    }
}
