/**
 * The four estimators of the sighting inference engine.
 *
 * <ul>
 * <li>{@link com.whalewatch.core.estimation.DensityGridEstimator}: busiest
 * grid cell for a period</li>
 * <li>{@link com.whalewatch.core.estimation.AreaBootstrapEstimator}: local
 * encounter probability by area inflation and Monte Carlo draws</li>
 * <li>{@link com.whalewatch.core.estimation.PodClassifier}: Laplace-smoothed
 * pod distribution around a location</li>
 * <li>{@link com.whalewatch.core.estimation.InterArrivalTimeEstimator}:
 * exponential waiting-time model</li>
 * </ul>
 *
 * <p>
 * Estimators hold configuration only. Every call re-scans its input and keeps
 * no state between calls, so one instance can serve concurrent queries.
 * </p>
 *
 * @since 1.0.0
 */
package com.whalewatch.core.estimation;
