/**
 * Event Store Adapter: where sightings come from and how they are filtered.
 *
 * <p>
 * {@link com.whalewatch.core.source.CsvSightingSource} parses the four-column
 * sighting file, {@link com.whalewatch.core.source.InMemorySightingSource}
 * holds a loaded snapshot, and
 * {@link com.whalewatch.core.source.SightingFilters} builds the period and
 * area predicates.
 * </p>
 *
 * @since 1.0.0
 */
package com.whalewatch.core.source;
