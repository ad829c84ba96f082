package com.spendradar.common;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class TokenSetSimilarityTest {

    @Test
    @DisplayName("token subset scores 100 regardless of order")
    void subsetScoresFull() {
        assertThat(TokenSetSimilarity.tokenSetRatio("super market", "super market chain")).isEqualTo(100.0);
        assertThat(TokenSetSimilarity.tokenSetRatio("chain super market", "super market chain")).isEqualTo(100.0);
    }

    @Test
    @DisplayName("empty side scores 0")
    void emptyScoresZero() {
        assertThat(TokenSetSimilarity.tokenSetRatio("", "anything")).isZero();
        assertThat(TokenSetSimilarity.tokenSetRatio("anything", null)).isZero();
    }

    @Test
    @DisplayName("disjoint token sets fall back to plain ratio of sorted tokens")
    void disjointUsesRatio() {
        // "abcd" vs "abce": lcs 3 -> 200*3/8 = 75
        assertThat(TokenSetSimilarity.tokenSetRatio("abcd", "abce")).isCloseTo(75.0, within(1e-9));
    }

    @Test
    @DisplayName("partial overlap scores intersection against intersection + remainder")
    void partialOverlap() {
        // sect "fuel" (4), diffs "gas" (3) / "station" (7): best is 100 * (1 - (1 + 3) / (4 + 8))
        double score = TokenSetSimilarity.tokenSetRatio("fuel gas", "fuel station");
        assertThat(score).isCloseTo(100.0 * (1.0 - 4.0 / 12.0), within(1e-9));
    }

    @Test
    @DisplayName("typo in the non-shared token costs only its edits against both full strings")
    void typoOutsideIntersection() {
        // sect "haifa shufersal" (15), diffs "deal" / "dael": indel 2 over (20 + 20)
        assertThat(TokenSetSimilarity.tokenSetRatio("shufersal deal haifa", "shufersal dael haifa"))
                .isCloseTo(95.0, within(1e-9));
    }

    @Test
    @DisplayName("ratio is symmetric and 100 for equal strings")
    void ratio() {
        assertThat(TokenSetSimilarity.ratio("shufersal", "shufersal")).isEqualTo(100.0);
        assertThat(TokenSetSimilarity.ratio("abc", "xbc")).isEqualTo(TokenSetSimilarity.ratio("xbc", "abc"));
    }

    @Test
    @DisplayName("extractOne returns best choice above cutoff, first on ties")
    void extractOne() {
        List<String> choices = List.of("rami levy", "super market chain", "super market");
        TokenSetSimilarity.ScoredChoice best = TokenSetSimilarity.extractOne("super market", choices, 86);
        assertThat(best).isNotNull();
        assertThat(best.choice()).isEqualTo("super market chain");
        assertThat(best.score()).isEqualTo(100.0);

        assertThat(TokenSetSimilarity.extractOne("cinema city", choices, 86)).isNull();
    }
}
