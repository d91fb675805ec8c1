package com.whalewatch.core.estimation;

import com.whalewatch.core.error.InvalidConfigurationException;
import com.whalewatch.core.model.GeoPoint;
import com.whalewatch.core.model.SightingEvent;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static com.whalewatch.core.support.Sightings.at;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.offset;

/**
 * Unit tests for {@link AreaBootstrapEstimator}.
 */
class AreaBootstrapEstimatorTest {

    private static final GeoPoint CANDIDATE = GeoPoint.of(48.5, -123.0);

    @Test
    @DisplayName("Should collapse to 1/(trials+1) when there are no nearby sightings")
    void shouldReturnSmoothedFloorWithoutSightings() {
        AreaBootstrapEstimator estimator = new AreaBootstrapEstimator(1.0, 0.01, 1_000, 7L);

        assertThat(estimator.estimateProbability(CANDIDATE, List.of()))
                .isEqualTo(1.0 / 1_001);
    }

    @Test
    @DisplayName("Should ignore sightings outside or on the edge of the daily range")
    void shouldIgnoreSightingsOutsideRange() {
        AreaBootstrapEstimator estimator = new AreaBootstrapEstimator(1.0, 0.01, 1_000, 7L);
        List<SightingEvent> far = List.of(
                at(45.0, -123.0),
                at(48.5, -120.0),
                at(49.5, -123.0));

        assertThat(estimator.estimateProbability(CANDIDATE, far)).isEqualTo(1.0 / 1_001);
        assertThat(estimator.analyticProbability(CANDIDATE, far)).isZero();
    }

    @Test
    @DisplayName("Should converge to the analytic probability for large trial counts")
    void shouldConvergeToAnalyticValue() {
        // whale range area 4, view area 1, two inflated sightings of area 1 each:
        // p = 2/4 and the view covers a quarter of the range, so p' = 0.125
        AreaBootstrapEstimator estimator = new AreaBootstrapEstimator(1.0, 0.5, 200_000, 2023L);
        List<SightingEvent> events = List.of(at(48.8, -123.2), at(48.2, -122.7));

        assertThat(estimator.analyticProbability(CANDIDATE, events)).isCloseTo(0.125, offset(1e-12));
        assertThat(estimator.estimateProbability(CANDIDATE, events)).isCloseTo(0.125, offset(0.01));
    }

    @Test
    @DisplayName("Should stay within (0, 1] when summed areas exceed the range")
    void shouldStayInUnitIntervalForDenseData() {
        AreaBootstrapEstimator estimator = new AreaBootstrapEstimator(1.0, 0.5, 20_000, 11L);
        List<SightingEvent> dense = new ArrayList<>();
        for (int i = 0; i < 10; i++) {
            dense.add(at(48.5 + i * 0.01, -123.0));
        }

        double probability = estimator.estimateProbability(CANDIDATE, dense);

        assertThat(probability).isGreaterThan(0.0).isLessThanOrEqualTo(1.0);
        // every draw succeeds, so only the view/range ratio remains
        assertThat(probability).isCloseTo(0.25, offset(0.02));
    }

    @Test
    @DisplayName("Should return identical results for a fixed seed")
    void shouldBeRepeatableWithSeed() {
        AreaBootstrapEstimator estimator = new AreaBootstrapEstimator(1.0, 0.2, 10_000, 99L);
        List<SightingEvent> events = List.of(at(48.6, -123.1), at(48.4, -122.9), at(48.5, -123.0));

        double first = estimator.estimateProbability(CANDIDATE, events);
        double second = estimator.estimateProbability(CANDIDATE, events);

        assertThat(second).isEqualTo(first);
    }

    @Test
    @DisplayName("Should never return zero with the default parameters")
    void shouldNeverReturnZero() {
        AreaBootstrapEstimator estimator = new AreaBootstrapEstimator();

        double probability = estimator.estimateProbability(CANDIDATE, List.of(at(48.51, -123.01)));

        assertThat(probability).isGreaterThan(0.0).isLessThanOrEqualTo(1.0);
    }

    @Test
    @DisplayName("Should reject invalid parameters")
    void shouldRejectInvalidParameters() {
        assertThatThrownBy(() -> new AreaBootstrapEstimator(0, 0.01, 10, null))
                .isInstanceOf(InvalidConfigurationException.class)
                .hasMessageContaining("dailyRange");
        assertThatThrownBy(() -> new AreaBootstrapEstimator(1.0, -0.01, 10, null))
                .isInstanceOf(InvalidConfigurationException.class)
                .hasMessageContaining("pointRadius");
        assertThatThrownBy(() -> new AreaBootstrapEstimator(1.0, 0.01, 0, null))
                .isInstanceOf(InvalidConfigurationException.class)
                .hasMessageContaining("trials");
    }
}
