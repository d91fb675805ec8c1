package com.whalewatch.core.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link CategoryDistribution}.
 */
class CategoryDistributionTest {

    @Test
    @DisplayName("Should match the normalized view when every label has one pod")
    void shouldAgreeWithNormalizedForSingleLabels() {
        Map<String, Integer> counts = new LinkedHashMap<>();
        counts.put("J", 3);
        counts.put("K", 2);
        counts.put("L", 1);

        CategoryDistribution distribution = new CategoryDistribution(counts, 6);

        assertThat(distribution.probability("J")).isEqualTo(0.5);
        assertThat(distribution.normalizedProbability("J")).isEqualTo(0.5);
        assertThat(distribution.getModeProbability()).isEqualTo(0.5);
    }

    @Test
    @DisplayName("Should keep category order and break ties by it")
    void shouldKeepEnumerationOrder() {
        Map<String, Integer> counts = new LinkedHashMap<>();
        counts.put("L", 2);
        counts.put("J", 2);

        CategoryDistribution distribution = new CategoryDistribution(counts, 4);

        assertThat(distribution.getProbabilities().keySet()).containsExactly("L", "J");
        assertThat(distribution.getMode()).isEqualTo("L");
    }

    @Test
    @DisplayName("Should report zero for an unknown category")
    void shouldReturnZeroForUnknownCategory() {
        CategoryDistribution distribution = new CategoryDistribution(Map.of("J", 1), 1);

        assertThat(distribution.probability("X")).isZero();
        assertThat(distribution.normalizedProbability("X")).isZero();
    }

    @Test
    @DisplayName("Should divide by the grand total when counts exceed it in sum")
    void shouldDivideByGrandTotal() {
        Map<String, Integer> counts = new LinkedHashMap<>();
        counts.put("J", 3);
        counts.put("K", 3);
        counts.put("L", 1);

        CategoryDistribution distribution = new CategoryDistribution(counts, 6);

        assertThat(distribution.getProbabilities())
                .containsEntry("J", 0.5)
                .containsEntry("K", 0.5)
                .containsEntry("L", 1.0 / 6);
        assertThat(distribution.rounded(3)).containsEntry("L", 0.167);
        assertThat(distribution.getNormalizedProbabilities()).containsEntry("J", 3.0 / 7);
    }

    @Test
    @DisplayName("Should reject empty or non-positive counts")
    void shouldRejectInvalidCounts() {
        assertThatThrownBy(() -> new CategoryDistribution(Map.of(), 1))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new CategoryDistribution(Map.of("J", 0), 1))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
