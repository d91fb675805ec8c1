/**
 * Value types shared by the estimators and the shell.
 *
 * <ul>
 * <li>{@link com.whalewatch.core.model.SightingEvent}: one recorded
 * observation</li>
 * <li>{@link com.whalewatch.core.model.GeoPoint} and
 * {@link com.whalewatch.core.model.BoundingBox}: flat-earth geometry</li>
 * <li>{@link com.whalewatch.core.model.PeakLocation},
 * {@link com.whalewatch.core.model.CategoryDistribution} and
 * {@link com.whalewatch.core.model.InterArrivalModel}: estimator results</li>
 * </ul>
 *
 * <p>
 * Nothing in this package is mutated after construction.
 * </p>
 *
 * @since 1.0.0
 */
package com.whalewatch.core.model;
