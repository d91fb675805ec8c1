package com.whalewatch.core.estimation;

import com.whalewatch.core.error.InvalidConfigurationException;
import com.whalewatch.core.model.BoundingBox;
import com.whalewatch.core.model.CategoryDistribution;
import com.whalewatch.core.model.GeoPoint;
import com.whalewatch.core.model.SightingEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Predicts which pod a whale seen near a location most likely belongs to.
 *
 * <p>
 * Counts nearby sightings per category with add-one (Laplace) smoothing:
 * every category starts at 1 and the grand total starts at the number of
 * categories.
 * </p>
 *
 * <h3>Compound labels</h3>
 * <p>
 * A label matches every category code it contains as a substring, so a
 * {@code "JK"} sighting increments both {@code J} and {@code K}. The grand
 * total still grows by exactly one per sighting; see
 * {@link CategoryDistribution} for how both totals are exposed.
 * </p>
 *
 * @since 1.0.0
 */
public class PodClassifier {

    private static final Logger LOG = LoggerFactory.getLogger(PodClassifier.class);

    private final List<String> categories;
    private final double dailyRange;

    /**
     * @param categories known category codes in enumeration order; must not be
     *                   empty
     * @param dailyRange half-width in degrees of the neighbourhood searched
     * @throws InvalidConfigurationException if {@code categories} is empty or
     *                                       {@code dailyRange} is not positive
     */
    public PodClassifier(Collection<String> categories, double dailyRange) {
        Objects.requireNonNull(categories, "categories must not be null");
        if (categories.isEmpty()) {
            throw new InvalidConfigurationException("At least one category is required");
        }
        if (!(dailyRange > 0) || Double.isInfinite(dailyRange)) {
            throw new InvalidConfigurationException("dailyRange must be finite and > 0, got: " + dailyRange);
        }
        this.categories = Collections.unmodifiableList(new ArrayList<>(new LinkedHashSet<>(categories)));
        this.dailyRange = dailyRange;
    }

    /**
     * Classify the sightings around {@code candidate}.
     *
     * @param events    sightings for the period of interest
     * @param candidate centre of the neighbourhood
     * @return smoothed distribution over the known categories
     */
    public CategoryDistribution classify(List<SightingEvent> events, GeoPoint candidate) {
        Objects.requireNonNull(events, "events must not be null");
        Objects.requireNonNull(candidate, "candidate must not be null");

        BoundingBox bounds = BoundingBox.centeredOn(candidate, dailyRange);

        Map<String, Integer> counts = new LinkedHashMap<>();
        for (String category : categories) {
            counts.put(category, 1);
        }
        int total = categories.size();
        int nearby = 0;

        for (SightingEvent event : events) {
            if (!bounds.containsStrictly(event.getLocation())) {
                continue;
            }
            nearby++;
            total++;
            String label = event.getCategory();
            for (String category : categories) {
                if (label.contains(category)) {
                    counts.merge(category, 1, Integer::sum);
                }
            }
        }

        CategoryDistribution distribution = new CategoryDistribution(counts, total);
        LOG.debug("Classified {} nearby sighting(s) around {}: {}", nearby, candidate, distribution);
        return distribution;
    }

    public List<String> getCategories() {
        return categories;
    }

    public double getDailyRange() {
        return dailyRange;
    }
}
