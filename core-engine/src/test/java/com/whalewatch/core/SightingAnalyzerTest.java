package com.whalewatch.core;

import com.whalewatch.core.config.EstimatorConfig;
import com.whalewatch.core.error.EmptyInputException;
import com.whalewatch.core.error.InsufficientDataException;
import com.whalewatch.core.error.InvalidConfigurationException;
import com.whalewatch.core.model.CategoryDistribution;
import com.whalewatch.core.model.GeoPoint;
import com.whalewatch.core.model.InterArrivalModel;
import com.whalewatch.core.model.PeakLocation;
import com.whalewatch.core.source.CsvSightingSource;
import com.whalewatch.core.source.InMemorySightingSource;
import com.whalewatch.core.source.SightingFilters;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.whalewatch.core.support.Sightings.at;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.offset;

/**
 * Unit tests for {@link SightingAnalyzer} against the bundled fixture file.
 */
class SightingAnalyzerTest {

    private InMemorySightingSource sightings;
    private EstimatorConfig config;

    @BeforeEach
    void setUp() {
        sightings = InMemorySightingSource.snapshotOf(CsvSightingSource.fromClasspath("sightings.csv"));
        config = EstimatorConfig.defaults();
        config.getBootstrap().setTrials(2_000);
        config.getBootstrap().setSeed(11L);
    }

    @Test
    @DisplayName("Should find the busiest June cell")
    void shouldEstimatePeakForMonth() {
        SightingAnalyzer analyzer = new SightingAnalyzer(sightings, config);

        PeakLocation peak = analyzer.estimatePeakLocation(SightingFilters.inMonth(6));

        assertThat(peak.getLocation()).isEqualTo(GeoPoint.of(48.51, -123.15));
        assertThat(peak.getCount()).isEqualTo(3);
    }

    @Test
    @DisplayName("Should report an empty period")
    void shouldThrowForMonthWithoutSightings() {
        SightingAnalyzer analyzer = new SightingAnalyzer(sightings, config);

        assertThatThrownBy(() -> analyzer.estimatePeakLocation(SightingFilters.inMonth(3)))
                .isInstanceOf(EmptyInputException.class);
    }

    @Test
    @DisplayName("Should return a repeatable probability in (0, 1]")
    void shouldEstimateProbability() {
        SightingAnalyzer analyzer = new SightingAnalyzer(sightings, config);
        GeoPoint spot = GeoPoint.of(48.51, -123.15);

        double first = analyzer.estimateProbability(spot, SightingFilters.inMonth(6));
        double second = analyzer.estimateProbability(spot, SightingFilters.inMonth(6));

        assertThat(first).isGreaterThan(0.0).isLessThanOrEqualTo(1.0);
        assertThat(second).isEqualTo(first);
    }

    @Test
    @DisplayName("Should fall back to the floor probability for an empty month")
    void shouldReturnFloorForEmptyMonth() {
        SightingAnalyzer analyzer = new SightingAnalyzer(sightings, config);

        double p = analyzer.estimateProbability(GeoPoint.of(48.51, -123.15), SightingFilters.inMonth(3));

        assertThat(p).isEqualTo(1.0 / 2_001.0, offset(1e-12));
    }

    @Test
    @DisplayName("Should classify the pod from nearby June sightings")
    void shouldClassifyPod() {
        SightingAnalyzer analyzer = new SightingAnalyzer(sightings, config);

        CategoryDistribution pods = analyzer.classify(GeoPoint.of(48.51, -123.15), SightingFilters.inMonth(6));

        // J: 1 + J + JK, K: 1 + JK + K, L: 1 + L
        assertThat(pods.getCounts()).containsEntry("J", 3).containsEntry("K", 3).containsEntry("L", 2);
        assertThat(pods.getGrandTotal()).isEqualTo(7);
        assertThat(pods.getMode()).isEqualTo("J");
        assertThat(pods.probability("J")).isEqualTo(3.0 / 7.0, offset(1e-12));
    }

    @Test
    @DisplayName("Should fit waiting times on the full history")
    void shouldFitInterArrival() {
        SightingAnalyzer analyzer = new SightingAnalyzer(sightings, config);

        InterArrivalModel model = analyzer.fitInterArrival();

        assertThat(model.getIntervalCount()).isEqualTo(5);
        assertThat(model.expectedWaitHours()).isPositive();
        assertThat(analyzer.fitAndQuery(0)).isEqualTo(1.0);
        assertThat(analyzer.fitAndQuery(model.expectedWaitHours())).isEqualTo(Math.exp(-1), offset(1e-9));
    }

    @Test
    @DisplayName("Should list every configuration problem in one failure")
    void shouldValidateConfigOnce() {
        config.getGrid().setScale(0);
        config.getBootstrap().setTrials(0);

        assertThatThrownBy(() -> new SightingAnalyzer(sightings, config))
                .isInstanceOf(InvalidConfigurationException.class)
                .hasMessageContaining("grid.scale")
                .hasMessageContaining("bootstrap.trials");
    }

    @Test
    @DisplayName("Should read waiting times from a separate history source")
    void shouldUseSeparateHistory() {
        InMemorySightingSource history = new InMemorySightingSource(List.of(at(48.5, -123.0)));
        SightingAnalyzer analyzer = new SightingAnalyzer(sightings, history, config);

        assertThatThrownBy(analyzer::fitInterArrival).isInstanceOf(InsufficientDataException.class);
        assertThat(analyzer.estimatePeakLocation(SightingFilters.inMonth(6)).getCount()).isEqualTo(3);
    }
}
