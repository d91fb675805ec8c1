package com.whalewatch.core.estimation;

import com.whalewatch.core.error.InsufficientDataException;
import com.whalewatch.core.model.InterArrivalModel;
import com.whalewatch.core.model.SightingEvent;
import org.apache.commons.math3.stat.StatUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.TreeSet;

/**
 * Fits an exponential inter-arrival model to the sighting history.
 *
 * <p>
 * Timestamps are de-duplicated (several sightings recorded at the same
 * instant count once) and sorted; the model mean is the arithmetic mean of
 * the consecutive gaps, in hours.
 * </p>
 *
 * @since 1.0.0
 */
public class InterArrivalTimeEstimator {

    private static final Logger LOG = LoggerFactory.getLogger(InterArrivalTimeEstimator.class);

    private static final double SECONDS_PER_HOUR = 3600.0;

    /**
     * @param events full, unfiltered sighting history
     * @return fitted model
     * @throws InsufficientDataException if fewer than two distinct timestamps
     *                                   exist
     */
    public InterArrivalModel fit(List<SightingEvent> events) {
        Objects.requireNonNull(events, "events must not be null");

        List<LocalDateTime> timestamps = new ArrayList<>(events.size());
        for (SightingEvent event : events) {
            timestamps.add(event.getTimestamp());
        }
        return fitTimestamps(timestamps);
    }

    /**
     * Fit directly from timestamps; duplicates and ordering are handled here.
     *
     * @param timestamps sighting instants
     * @return fitted model
     * @throws InsufficientDataException if fewer than two distinct timestamps
     *                                   exist
     */
    public InterArrivalModel fitTimestamps(Iterable<LocalDateTime> timestamps) {
        Objects.requireNonNull(timestamps, "timestamps must not be null");

        TreeSet<LocalDateTime> distinct = new TreeSet<>();
        timestamps.forEach(distinct::add);
        if (distinct.size() < 2) {
            throw new InsufficientDataException(
                    "At least two distinct sighting times are required, got: " + distinct.size());
        }

        List<LocalDateTime> sorted = new ArrayList<>(distinct);
        double[] gaps = new double[sorted.size() - 1];
        for (int i = 1; i < sorted.size(); i++) {
            Duration gap = Duration.between(sorted.get(i - 1), sorted.get(i));
            gaps[i - 1] = gap.getSeconds() / SECONDS_PER_HOUR + gap.getNano() / (SECONDS_PER_HOUR * 1e9);
        }

        double mean = StatUtils.mean(gaps);
        LOG.debug("Fitted inter-arrival model from {} distinct time(s): mean={} h", sorted.size(), mean);
        return new InterArrivalModel(mean, gaps.length);
    }
}
