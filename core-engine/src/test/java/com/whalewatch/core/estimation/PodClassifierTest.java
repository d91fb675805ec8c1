package com.whalewatch.core.estimation;

import com.whalewatch.core.error.InvalidConfigurationException;
import com.whalewatch.core.model.CategoryDistribution;
import com.whalewatch.core.model.GeoPoint;
import com.whalewatch.core.model.SightingEvent;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.whalewatch.core.support.Sightings.sighting;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.offset;

/**
 * Unit tests for {@link PodClassifier}.
 */
class PodClassifierTest {

    private static final GeoPoint CANDIDATE = GeoPoint.of(48.5, -123.0);

    private PodClassifier classifier;

    @BeforeEach
    void setUp() {
        classifier = new PodClassifier(List.of("J", "K", "L"), 1.0);
    }

    @Test
    @DisplayName("Should give every pod equal positive probability without sightings")
    void shouldBeUniformWithoutSightings() {
        CategoryDistribution distribution = classifier.classify(List.of(), CANDIDATE);

        assertThat(distribution.getProbabilities()).containsOnlyKeys("J", "K", "L");
        assertThat(distribution.getProbabilities().values())
                .allSatisfy(p -> assertThat(p).isCloseTo(1.0 / 3, offset(1e-12)));
        // ties go to the first category
        assertThat(distribution.getMode()).isEqualTo("J");
    }

    @Test
    @DisplayName("Should count compound labels for every pod they contain")
    void shouldCountCompoundLabels() {
        List<SightingEvent> events = List.of(
                sighting("J", 48.6, -123.1),
                sighting("JK", 48.4, -122.9),
                sighting("K", 48.5, -123.0),
                sighting("K", 48.7, -123.2));

        CategoryDistribution distribution = classifier.classify(events, CANDIDATE);

        assertThat(distribution.getCounts()).containsEntry("J", 3).containsEntry("K", 4).containsEntry("L", 1);
        assertThat(distribution.getGrandTotal()).isEqualTo(7);
        assertThat(distribution.getMode()).isEqualTo("K");
        assertThat(distribution.probability("K")).isCloseTo(4.0 / 7, offset(1e-12));
        assertThat(distribution.normalizedProbability("K")).isCloseTo(0.5, offset(1e-12));
    }

    @Test
    @DisplayName("Should report each pod over the sighting total for compound labels")
    void shouldDivideCompoundLabelsByGrandTotal() {
        List<SightingEvent> events = List.of(
                sighting("J", 48.5, -123.0),
                sighting("JK", 48.5, -123.0),
                sighting("K", 48.5, -123.0));

        CategoryDistribution distribution = classifier.classify(events, CANDIDATE);

        assertThat(distribution.getGrandTotal()).isEqualTo(6);
        assertThat(distribution.getMode()).isEqualTo("J");
        assertThat(distribution.getModeProbability()).isEqualTo(0.5);
        assertThat(distribution.getProbabilities())
                .containsEntry("J", 0.5)
                .containsEntry("K", 0.5)
                .containsEntry("L", 1.0 / 6);
    }

    @Test
    @DisplayName("Should let unmatched labels dilute every pod")
    void shouldDiluteWithUnmatchedLabels() {
        List<SightingEvent> events = List.of(
                sighting("JKL", 48.6, -123.1),
                sighting("T", 48.4, -122.9),
                sighting("L", 48.5, -123.0));

        CategoryDistribution distribution = classifier.classify(events, CANDIDATE);

        assertThat(distribution.getGrandTotal()).isEqualTo(6);
        assertThat(distribution.probability("J")).isCloseTo(2.0 / 6, offset(1e-12));
        assertThat(distribution.probability("L")).isCloseTo(0.5, offset(1e-12));
        assertThat(distribution.getProbabilities().values()).allSatisfy(p -> assertThat(p).isPositive());
        double normalizedSum = distribution.getNormalizedProbabilities().values().stream()
                .mapToDouble(Double::doubleValue).sum();
        assertThat(normalizedSum).isCloseTo(1.0, offset(1e-9));
        assertThat(distribution.getMode()).isEqualTo("L");
    }

    @Test
    @DisplayName("Should ignore sightings outside the daily range")
    void shouldIgnoreDistantSightings() {
        List<SightingEvent> events = List.of(
                sighting("L", 40.0, -123.0),
                sighting("L", 48.5, -110.0),
                sighting("K", 48.5, -123.0));

        CategoryDistribution distribution = classifier.classify(events, CANDIDATE);

        assertThat(distribution.getCounts()).containsEntry("L", 1).containsEntry("K", 2);
        assertThat(distribution.getGrandTotal()).isEqualTo(4);
        assertThat(distribution.getMode()).isEqualTo("K");
    }

    @Test
    @DisplayName("Should round probabilities for display only")
    void shouldRoundForDisplay() {
        CategoryDistribution distribution = classifier.classify(List.of(), CANDIDATE);

        assertThat(distribution.rounded(3)).containsEntry("J", 0.333);
        assertThat(distribution.probability("J")).isNotEqualTo(0.333);
    }

    @Test
    @DisplayName("Should throw InvalidConfigurationException for an empty category set")
    void shouldRejectEmptyCategories() {
        assertThatThrownBy(() -> new PodClassifier(List.of(), 1.0))
                .isInstanceOf(InvalidConfigurationException.class);
    }
}
