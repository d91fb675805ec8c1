package com.whalewatch.core.estimation;

import com.whalewatch.core.error.EmptyInputException;
import com.whalewatch.core.error.InvalidConfigurationException;
import com.whalewatch.core.model.GeoPoint;
import com.whalewatch.core.model.PeakLocation;
import com.whalewatch.core.model.SightingEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Finds the grid cell with the most historical sightings.
 *
 * <p>
 * Each coordinate is discretised as {@code round(coordinate * scale)}; counts
 * are accumulated in a sparse map keyed by the (latitude, longitude) bin pair,
 * so memory grows with the number of occupied cells only.
 * </p>
 *
 * <h3>Tie-break</h3>
 * <p>
 * A single pass over the events in their given order tracks the running
 * maximum. A cell replaces the current winner only when its count becomes
 * strictly greater, so among equally busy cells the one that reached that
 * count first wins.
 * </p>
 *
 * <p>
 * This estimator is <strong>stateless</strong>; instances are safe to share.
 * </p>
 *
 * @since 1.0.0
 */
public class DensityGridEstimator {

    private static final Logger LOG = LoggerFactory.getLogger(DensityGridEstimator.class);

    /** Bins per degree used when none is configured. */
    public static final double DEFAULT_SCALE = 100;

    private final double scale;

    public DensityGridEstimator() {
        this(DEFAULT_SCALE);
    }

    /**
     * @param scale bins per degree; must be &gt; 0
     * @throws InvalidConfigurationException if {@code scale} is not positive
     */
    public DensityGridEstimator(double scale) {
        if (!(scale > 0) || Double.isInfinite(scale)) {
            throw new InvalidConfigurationException("Grid scale must be finite and > 0, got: " + scale);
        }
        this.scale = scale;
    }

    /**
     * Estimate the busiest location.
     *
     * @param events sightings already filtered to the period of interest
     * @return centre of the busiest cell and its count
     * @throws EmptyInputException if {@code events} is empty
     */
    public PeakLocation estimatePeakLocation(List<SightingEvent> events) {
        Objects.requireNonNull(events, "events must not be null");
        if (events.isEmpty()) {
            throw new EmptyInputException("No sightings to bin: the event list is empty");
        }

        Map<Cell, Integer> counts = new HashMap<>();
        Cell best = null;
        int bestCount = 0;

        for (SightingEvent event : events) {
            Cell cell = new Cell(bin(event.getLatitude()), bin(event.getLongitude()));
            int count = counts.merge(cell, 1, Integer::sum);
            if (count > bestCount) {
                bestCount = count;
                best = cell;
            }
        }

        GeoPoint centre = GeoPoint.of(best.latBin / scale, best.longBin / scale);
        LOG.debug("Binned {} sighting(s) into {} cell(s); peak {} with {} sighting(s)",
                events.size(), counts.size(), centre, bestCount);
        return new PeakLocation(centre, bestCount, best.latBin, best.longBin);
    }

    public double getScale() {
        return scale;
    }

    long bin(double coordinate) {
        return Math.round(coordinate * scale);
    }

    private static final class Cell {
        private final long latBin;
        private final long longBin;

        private Cell(long latBin, long longBin) {
            this.latBin = latBin;
            this.longBin = longBin;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o)
                return true;
            if (!(o instanceof Cell that))
                return false;
            return latBin == that.latBin && longBin == that.longBin;
        }

        @Override
        public int hashCode() {
            return 31 * Long.hashCode(latBin) + Long.hashCode(longBin);
        }
    }
}
