package com.whalewatch.core.source;

import com.whalewatch.core.model.SightingEvent;

import java.util.List;
import java.util.Objects;
import java.util.function.Predicate;

/**
 * Supplies sighting events to the estimators.
 *
 * <p>
 * Implementations either return every event or fail; a partially loaded list
 * would bias the density and classification estimates.
 * </p>
 */
public interface SightingSource {

    /**
     * @return every sighting, in source order; never {@code null}
     * @throws com.whalewatch.core.error.InvalidArgumentException if a record
     *                                                            is malformed
     */
    List<SightingEvent> load();

    /**
     * Load and keep only the sightings accepted by {@code filter}, preserving
     * source order.
     *
     * @param filter predicate such as {@link SightingFilters#inMonth(int)}
     * @return matching sightings; may be empty
     */
    default List<SightingEvent> load(Predicate<SightingEvent> filter) {
        Objects.requireNonNull(filter, "filter must not be null");
        return load().stream().filter(filter).toList();
    }
}
