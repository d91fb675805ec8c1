package com.whalewatch.core.estimation;

import com.whalewatch.core.error.InsufficientDataException;
import com.whalewatch.core.error.InvalidArgumentException;
import com.whalewatch.core.model.InterArrivalModel;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.whalewatch.core.support.Sightings.BASE_TIME;
import static com.whalewatch.core.support.Sightings.hoursAfterBase;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.offset;

/**
 * Unit tests for {@link InterArrivalTimeEstimator}.
 */
class InterArrivalTimeEstimatorTest {

    private InterArrivalTimeEstimator estimator;

    @BeforeEach
    void setUp() {
        estimator = new InterArrivalTimeEstimator();
    }

    @Test
    @DisplayName("Should average the gaps between distinct sighting times")
    void shouldComputeMeanInterval() {
        InterArrivalModel model = estimator.fit(List.of(
                hoursAfterBase(0), hoursAfterBase(10), hoursAfterBase(20), hoursAfterBase(40)));

        assertThat(model.getMeanIntervalHours()).isCloseTo(40.0 / 3, offset(1e-9));
        assertThat(model.getIntervalCount()).isEqualTo(3);
        assertThat(model.expectedWaitHours()).isCloseTo(40.0 / 3, offset(1e-9));
    }

    @Test
    @DisplayName("Should count sightings at the same instant once and sort the rest")
    void shouldDeduplicateAndSort() {
        InterArrivalModel model = estimator.fit(List.of(
                hoursAfterBase(40), hoursAfterBase(10), hoursAfterBase(0),
                hoursAfterBase(10), hoursAfterBase(20), hoursAfterBase(0)));

        assertThat(model.getMeanIntervalHours()).isCloseTo(40.0 / 3, offset(1e-9));
        assertThat(model.getIntervalCount()).isEqualTo(3);
    }

    @Test
    @DisplayName("Should fit directly from timestamps")
    void shouldFitFromTimestamps() {
        InterArrivalModel model = estimator.fitTimestamps(List.of(
                BASE_TIME, BASE_TIME.plusMinutes(90)));

        assertThat(model.getMeanIntervalHours()).isCloseTo(1.5, offset(1e-12));
    }

    @Test
    @DisplayName("Should give survival 1 at zero, e^-1 at the mean and 0 at infinity")
    void shouldAnswerSurvivalQueries() {
        InterArrivalModel model = estimator.fit(List.of(hoursAfterBase(0), hoursAfterBase(24)));

        assertThat(model.survivalProbability(0)).isEqualTo(1.0);
        assertThat(model.survivalProbability(24)).isCloseTo(Math.exp(-1), offset(1e-12));
        assertThat(model.survivalProbability(Double.POSITIVE_INFINITY)).isZero();
    }

    @Test
    @DisplayName("Should not change after repeated queries")
    void shouldStayStatelessAcrossQueries() {
        InterArrivalModel model = estimator.fit(List.of(hoursAfterBase(0), hoursAfterBase(5)));

        double first = model.survivalProbability(3);
        model.survivalProbability(100);
        assertThat(model.survivalProbability(3)).isEqualTo(first);
        assertThat(model.getMeanIntervalHours()).isEqualTo(5.0);
    }

    @Test
    @DisplayName("Should throw InvalidArgumentException for a negative waiting time")
    void shouldRejectNegativeWait() {
        InterArrivalModel model = estimator.fit(List.of(hoursAfterBase(0), hoursAfterBase(5)));

        assertThatThrownBy(() -> model.survivalProbability(-1))
                .isInstanceOf(InvalidArgumentException.class);
        assertThatThrownBy(() -> model.survivalProbability(Double.NaN))
                .isInstanceOf(InvalidArgumentException.class);
    }

    @Test
    @DisplayName("Should throw InsufficientDataException with fewer than two distinct times")
    void shouldRequireTwoDistinctTimes() {
        assertThatThrownBy(() -> estimator.fit(List.of()))
                .isInstanceOf(InsufficientDataException.class);
        assertThatThrownBy(() -> estimator.fit(List.of(hoursAfterBase(3), hoursAfterBase(3))))
                .isInstanceOf(InsufficientDataException.class)
                .hasMessageContaining("got: 1");
    }
}
