package com.whalewatch.core.model;

import com.whalewatch.core.error.InvalidArgumentException;
import org.apache.commons.math3.distribution.ExponentialDistribution;

import java.io.Serializable;

/**
 * Exponential waiting-time model fitted to the gaps between distinct sighting
 * timestamps.
 *
 * <p>
 * The model is stateless after construction: survival queries never refit or
 * mutate it.
 * </p>
 *
 * @since 1.0.0
 */
public final class InterArrivalModel implements Serializable {

    private static final long serialVersionUID = 1L;

    private final double meanIntervalHours;
    private final int intervalCount;
    private final ExponentialDistribution distribution;

    /**
     * @param meanIntervalHours mean gap between sightings; must be &gt; 0
     * @param intervalCount     number of gaps the mean was computed from
     */
    public InterArrivalModel(double meanIntervalHours, int intervalCount) {
        if (!(meanIntervalHours > 0) || Double.isInfinite(meanIntervalHours)) {
            throw new InvalidArgumentException(
                    "meanIntervalHours must be finite and > 0, got: " + meanIntervalHours);
        }
        this.meanIntervalHours = meanIntervalHours;
        this.intervalCount = intervalCount;
        this.distribution = new ExponentialDistribution(null, meanIntervalHours);
    }

    /** @return mean inter-arrival time in hours */
    public double getMeanIntervalHours() {
        return meanIntervalHours;
    }

    public int getIntervalCount() {
        return intervalCount;
    }

    /** @return rate parameter, {@code 1 / mean} */
    public double getRate() {
        return 1.0 / meanIntervalHours;
    }

    /** @return expected wait until the next sighting, in hours */
    public double expectedWaitHours() {
        return distribution.getNumericalMean();
    }

    /**
     * Probability of waiting at least {@code hours} for the next sighting.
     *
     * @param hours waiting time; must be &gt;= 0 ({@code +Infinity} allowed)
     * @return {@code P(X > hours) = 1 - CDF(hours)}
     * @throws InvalidArgumentException if {@code hours} is negative or NaN
     */
    public double survivalProbability(double hours) {
        if (Double.isNaN(hours) || hours < 0) {
            throw new InvalidArgumentException("Waiting time must be >= 0 hours, got: " + hours);
        }
        return 1.0 - distribution.cumulativeProbability(hours);
    }

    @Override
    public String toString() {
        return "InterArrivalModel{" +
                "meanIntervalHours=" + meanIntervalHours +
                ", intervalCount=" + intervalCount +
                '}';
    }
}
