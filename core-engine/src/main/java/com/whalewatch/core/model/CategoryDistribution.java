package com.whalewatch.core.model;

import java.io.Serializable;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Laplace-smoothed probability of each known category, in category order.
 *
 * <p>
 * {@link #probability} divides a category's count by the <em>grand total</em>,
 * which grows by one per classified sighting however many categories its
 * label matched. A compound label such as {@code JK} therefore adds to both
 * pods, and a label matching no category dilutes every pod. The probabilities
 * sum to one only when each label matches exactly one category;
 * {@link #normalizedProbability} rescales by the sum of the counts for callers
 * that need a proper distribution.
 * </p>
 *
 * <p>
 * Probabilities are kept at full precision; {@link #rounded(int)} is a display
 * helper only. Every known category has a strictly positive probability because
 * counts start at one.
 * </p>
 *
 * @since 1.0.0
 */
public final class CategoryDistribution implements Serializable {

    private static final long serialVersionUID = 1L;

    private final LinkedHashMap<String, Integer> counts;
    private final int grandTotal;
    private final int countSum;
    private final String mode;

    /**
     * @param counts     smoothed counts in category enumeration order; must not
     *                   be empty, every count must be &gt; 0
     * @param grandTotal number of categories plus number of classified
     *                   sightings
     */
    public CategoryDistribution(Map<String, Integer> counts, int grandTotal) {
        Objects.requireNonNull(counts, "counts must not be null");
        if (counts.isEmpty()) {
            throw new IllegalArgumentException("counts must not be empty");
        }
        if (grandTotal <= 0) {
            throw new IllegalArgumentException("grandTotal must be > 0, got: " + grandTotal);
        }
        int sum = 0;
        for (Map.Entry<String, Integer> entry : counts.entrySet()) {
            if (entry.getValue() == null || entry.getValue() <= 0) {
                throw new IllegalArgumentException(
                        "count for '" + entry.getKey() + "' must be > 0, got: " + entry.getValue());
            }
            sum += entry.getValue();
        }
        this.counts = new LinkedHashMap<>(counts);
        this.grandTotal = grandTotal;
        this.countSum = sum;

        String best = null;
        int bestCount = Integer.MIN_VALUE;
        for (Map.Entry<String, Integer> entry : this.counts.entrySet()) {
            // strict comparison keeps the earliest category on ties
            if (entry.getValue() > bestCount) {
                bestCount = entry.getValue();
                best = entry.getKey();
            }
        }
        this.mode = best;
    }

    /** @return the most probable category */
    public String getMode() {
        return mode;
    }

    /** @return probability of the mode */
    public double getModeProbability() {
        return probability(mode);
    }

    /**
     * @param category a known category
     * @return its smoothed probability, or {@code 0} for an unknown category
     */
    public double probability(String category) {
        Integer count = counts.get(category);
        return count == null ? 0.0 : (double) count / grandTotal;
    }

    /**
     * Smoothed count over the sum of all counts; sums to one across
     * categories whatever the labels looked like.
     *
     * @param category a known category
     * @return count / sum of counts, or {@code 0} for an unknown category
     */
    public double normalizedProbability(String category) {
        Integer count = counts.get(category);
        return count == null ? 0.0 : (double) count / countSum;
    }

    /** @return unmodifiable category to probability map in enumeration order */
    public Map<String, Double> getProbabilities() {
        Map<String, Double> result = new LinkedHashMap<>();
        counts.forEach((category, count) -> result.put(category, (double) count / grandTotal));
        return Collections.unmodifiableMap(result);
    }

    /** @return unmodifiable map of {@link #normalizedProbability} values */
    public Map<String, Double> getNormalizedProbabilities() {
        Map<String, Double> result = new LinkedHashMap<>();
        counts.forEach((category, count) -> result.put(category, (double) count / countSum));
        return Collections.unmodifiableMap(result);
    }

    /** @return unmodifiable view of the smoothed counts */
    public Map<String, Integer> getCounts() {
        return Collections.unmodifiableMap(counts);
    }

    public int getGrandTotal() {
        return grandTotal;
    }

    /**
     * Probabilities rounded half-up for display.
     *
     * @param places decimal places
     * @return unmodifiable map of rounded probabilities
     */
    public Map<String, Double> rounded(int places) {
        Map<String, Double> result = new LinkedHashMap<>();
        counts.forEach((category, count) -> result.put(category,
                BigDecimal.valueOf((double) count / grandTotal)
                        .setScale(places, RoundingMode.HALF_UP)
                        .doubleValue()));
        return Collections.unmodifiableMap(result);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof CategoryDistribution that))
            return false;
        return grandTotal == that.grandTotal && counts.equals(that.counts);
    }

    @Override
    public int hashCode() {
        return Objects.hash(counts, grandTotal);
    }

    @Override
    public String toString() {
        return "CategoryDistribution{mode=" + mode + ", probabilities=" + getProbabilities() + '}';
    }
}
