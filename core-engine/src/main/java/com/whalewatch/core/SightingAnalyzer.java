package com.whalewatch.core;

import com.whalewatch.core.config.EstimatorConfig;
import com.whalewatch.core.error.EmptyInputException;
import com.whalewatch.core.estimation.AreaBootstrapEstimator;
import com.whalewatch.core.estimation.DensityGridEstimator;
import com.whalewatch.core.estimation.EstimatorFactory;
import com.whalewatch.core.estimation.InterArrivalTimeEstimator;
import com.whalewatch.core.estimation.PodClassifier;
import com.whalewatch.core.model.CategoryDistribution;
import com.whalewatch.core.model.GeoPoint;
import com.whalewatch.core.model.InterArrivalModel;
import com.whalewatch.core.model.PeakLocation;
import com.whalewatch.core.model.SightingEvent;
import com.whalewatch.core.source.SightingSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.function.Predicate;

/**
 * Query interface of the inference engine.
 *
 * <h3>Sources</h3>
 * <p>
 * Location, probability and pod queries read the <em>sightings</em> source
 * filtered by the caller's period predicate. Waiting-time queries read the
 * unfiltered <em>history</em> source, which may be the same source.
 * </p>
 *
 * <p>
 * Every query re-reads its source and re-derives its result; nothing is
 * cached between calls.
 * </p>
 *
 * @since 1.0.0
 */
public class SightingAnalyzer {

    private static final Logger LOG = LoggerFactory.getLogger(SightingAnalyzer.class);

    private final SightingSource sightings;
    private final SightingSource history;
    private final DensityGridEstimator densityGrid;
    private final AreaBootstrapEstimator areaBootstrap;
    private final PodClassifier podClassifier;
    private final InterArrivalTimeEstimator interArrival;

    /**
     * @param sightings source with coordinates and pod labels
     * @param history   full sighting history for waiting-time queries
     * @param config    estimator configuration; validated here
     * @throws com.whalewatch.core.error.InvalidConfigurationException if the
     *                                                                 config
     *                                                                 is invalid
     */
    public SightingAnalyzer(SightingSource sightings, SightingSource history, EstimatorConfig config) {
        this.sightings = Objects.requireNonNull(sightings, "sightings source must not be null");
        this.history = Objects.requireNonNull(history, "history source must not be null");
        Objects.requireNonNull(config, "EstimatorConfig must not be null");
        config.validate();
        this.densityGrid = EstimatorFactory.densityGrid(config.getGrid());
        this.areaBootstrap = EstimatorFactory.areaBootstrap(config.getBootstrap());
        this.podClassifier = EstimatorFactory.podClassifier(config.getClassifier());
        this.interArrival = EstimatorFactory.interArrival();
    }

    /** Analyzer that uses one source for every query. */
    public SightingAnalyzer(SightingSource source, EstimatorConfig config) {
        this(source, source, config);
    }

    /**
     * @param periodFilter selects the period, e.g. a month
     * @return busiest grid cell for the period
     * @throws EmptyInputException if no sighting matches the period
     */
    public PeakLocation estimatePeakLocation(Predicate<SightingEvent> periodFilter) {
        List<SightingEvent> events = sightings.load(periodFilter);
        if (events.isEmpty()) {
            throw new EmptyInputException("No sightings recorded for the requested period");
        }
        PeakLocation peak = densityGrid.estimatePeakLocation(events);
        LOG.info("Peak location for period: {} ({} sighting(s))", peak.getLocation(), peak.getCount());
        return peak;
    }

    /**
     * @param location     where the observer stands
     * @param periodFilter selects the period
     * @return smoothed encounter probability in {@code (0, 1]}
     */
    public double estimateProbability(GeoPoint location, Predicate<SightingEvent> periodFilter) {
        Objects.requireNonNull(location, "location must not be null");
        return areaBootstrap.estimateProbability(location, sightings.load(periodFilter));
    }

    /**
     * @param location     where the whale was seen
     * @param periodFilter selects the period
     * @return smoothed pod distribution and its mode
     */
    public CategoryDistribution classify(GeoPoint location, Predicate<SightingEvent> periodFilter) {
        Objects.requireNonNull(location, "location must not be null");
        return podClassifier.classify(sightings.load(periodFilter), location);
    }

    /**
     * Fit the waiting-time model on the full history.
     *
     * @return fitted model
     * @throws com.whalewatch.core.error.InsufficientDataException if the
     *                                                             history has
     *                                                             fewer than two
     *                                                             distinct times
     */
    public InterArrivalModel fitInterArrival() {
        InterArrivalModel model = interArrival.fit(history.load());
        LOG.info("Expected wait for the next sighting: {} hour(s)", model.expectedWaitHours());
        return model;
    }

    /**
     * Fit on the full history, then query the tail probability.
     *
     * @param waitHours waiting time in hours; must be &gt;= 0
     * @return probability of waiting at least {@code waitHours}
     */
    public double fitAndQuery(double waitHours) {
        return fitInterArrival().survivalProbability(waitHours);
    }
}
