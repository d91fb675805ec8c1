package com.whalewatch.core.estimation;

import com.whalewatch.core.error.InvalidConfigurationException;
import com.whalewatch.core.model.BoundingBox;
import com.whalewatch.core.model.GeoPoint;
import com.whalewatch.core.model.SightingEvent;
import org.apache.commons.math3.random.RandomGenerator;
import org.apache.commons.math3.random.Well19937c;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;

/**
 * Estimates the chance of encountering a whale at a candidate location by
 * "area inflation" plus Monte Carlo resampling.
 *
 * <h3>Method</h3>
 * <ol>
 * <li>The whale range is the square of half-width {@code dailyRange} around
 * the candidate; only sightings strictly inside it are used.</li>
 * <li>Each sighting is inflated to a square of half-width
 * {@code pointRadius}. The observer's view is a square of the same size
 * around the candidate.</li>
 * <li>{@code p = sum(sighting square areas) / area(whale range)}. Squares are
 * summed, not unioned, so overlapping sightings count twice. This is a known
 * modelling simplification and is kept as is.</li>
 * <li>For each of {@code trials} draws: with probability {@code p} place a
 * whale uniformly in the range and count a hit when it lands strictly inside
 * the observer's view.</li>
 * <li>Return {@code (hits + 1) / (trials + 1)}.</li>
 * </ol>
 *
 * <p>
 * The result is always in {@code (0, 1]}. With no nearby sightings it is
 * exactly {@code 1 / (trials + 1)}.
 * </p>
 *
 * <h3>Randomness</h3>
 * <p>
 * When a seed is configured every call starts a fresh generator from that
 * seed, so identical inputs give identical outputs. Without a seed each call
 * uses a freshly seeded generator and results are only statistically
 * reproducible.
 * </p>
 *
 * @since 1.0.0
 */
public class AreaBootstrapEstimator {

    private static final Logger LOG = LoggerFactory.getLogger(AreaBootstrapEstimator.class);

    public static final double DEFAULT_DAILY_RANGE = 1.0;
    public static final double DEFAULT_POINT_RADIUS = 0.01;
    public static final int DEFAULT_TRIALS = 100_000;

    private final double dailyRange;
    private final double pointRadius;
    private final int trials;
    private final Long seed;

    /** Estimator with the default range, radius and trial count, unseeded. */
    public AreaBootstrapEstimator() {
        this(DEFAULT_DAILY_RANGE, DEFAULT_POINT_RADIUS, DEFAULT_TRIALS, null);
    }

    /**
     * @param dailyRange  half-width of the whale range in degrees; must be &gt; 0
     * @param pointRadius half-width of each inflated sighting; must be &gt; 0
     * @param trials      number of Monte Carlo draws; must be &gt;= 1
     * @param seed        optional seed, {@code null} for a fresh generator per
     *                    call
     * @throws InvalidConfigurationException if any parameter is out of range
     */
    public AreaBootstrapEstimator(double dailyRange, double pointRadius, int trials, Long seed) {
        if (!(dailyRange > 0) || Double.isInfinite(dailyRange)) {
            throw new InvalidConfigurationException("dailyRange must be finite and > 0, got: " + dailyRange);
        }
        if (!(pointRadius > 0) || Double.isInfinite(pointRadius)) {
            throw new InvalidConfigurationException("pointRadius must be finite and > 0, got: " + pointRadius);
        }
        if (trials < 1) {
            throw new InvalidConfigurationException("trials must be >= 1, got: " + trials);
        }
        this.dailyRange = dailyRange;
        this.pointRadius = pointRadius;
        this.trials = trials;
        this.seed = seed;
    }

    /**
     * Estimate the encounter probability at {@code candidate}.
     *
     * @param candidate    where the observer stands
     * @param nearbyEvents sightings for the period; may already be
     *                     pre-filtered, they are re-checked against the whale
     *                     range here
     * @return Laplace-smoothed probability in {@code (0, 1]}
     */
    public double estimateProbability(GeoPoint candidate, List<SightingEvent> nearbyEvents) {
        Objects.requireNonNull(candidate, "candidate must not be null");
        Objects.requireNonNull(nearbyEvents, "nearbyEvents must not be null");

        BoundingBox whaleBounds = BoundingBox.centeredOn(candidate, dailyRange);
        BoundingBox sightBounds = BoundingBox.centeredOn(candidate, pointRadius);
        double p = occupiedFraction(whaleBounds, nearbyEvents);

        long hits = 0;
        if (p == 0) {
            LOG.warn("No sightings within {} degree(s) of {}; probability collapses to 1/(trials+1)",
                    dailyRange, candidate);
        } else {
            hits = countHits(p, whaleBounds, sightBounds);
        }

        double probability = (hits + 1.0) / (trials + 1.0);
        LOG.debug("Bootstrap at {}: p={} hits={} trials={} -> {}", candidate, p, hits, trials, probability);
        return probability;
    }

    private long countHits(double p, BoundingBox whaleBounds, BoundingBox sightBounds) {
        RandomGenerator random = newGenerator();
        long hits = 0;
        for (int i = 0; i < trials; i++) {
            if (random.nextDouble() <= p) {
                double lat = whaleBounds.getLatMin()
                        + (whaleBounds.getLatMax() - whaleBounds.getLatMin()) * random.nextDouble();
                double lon = whaleBounds.getLongMin()
                        + (whaleBounds.getLongMax() - whaleBounds.getLongMin()) * random.nextDouble();
                if (sightBounds.containsStrictly(lat, lon)) {
                    hits++;
                }
            }
        }
        return hits;
    }

    /**
     * Closed-form value the bootstrap converges to (before smoothing):
     * {@code p * area(view ∩ range) / area(range)}.
     *
     * @param candidate    where the observer stands
     * @param nearbyEvents sightings for the period
     * @return analytic encounter probability
     */
    public double analyticProbability(GeoPoint candidate, List<SightingEvent> nearbyEvents) {
        Objects.requireNonNull(candidate, "candidate must not be null");
        Objects.requireNonNull(nearbyEvents, "nearbyEvents must not be null");

        BoundingBox whaleBounds = BoundingBox.centeredOn(candidate, dailyRange);
        BoundingBox sightBounds = BoundingBox.centeredOn(candidate, pointRadius);
        double p = Math.min(1.0, occupiedFraction(whaleBounds, nearbyEvents));
        return p * sightBounds.intersectionArea(whaleBounds) / whaleBounds.area();
    }

    /**
     * Summed area of the inflated sightings inside {@code whaleBounds}, as a
     * fraction of its area. May exceed 1 when sightings are dense.
     */
    double occupiedFraction(BoundingBox whaleBounds, List<SightingEvent> events) {
        double sampleSpace = whaleBounds.area();
        if (sampleSpace <= 0) {
            return 0.0;
        }
        double eventSpace = 0;
        int used = 0;
        for (SightingEvent event : events) {
            if (whaleBounds.containsStrictly(event.getLocation())) {
                eventSpace += BoundingBox.centeredOn(event.getLocation(), pointRadius).area();
                used++;
            }
        }
        LOG.trace("{} of {} sighting(s) fall inside {}", used, events.size(), whaleBounds);
        return eventSpace / sampleSpace;
    }

    private RandomGenerator newGenerator() {
        return seed != null ? new Well19937c(seed) : new Well19937c();
    }

    public double getDailyRange() {
        return dailyRange;
    }

    public double getPointRadius() {
        return pointRadius;
    }

    public int getTrials() {
        return trials;
    }

    public Long getSeed() {
        return seed;
    }
}
