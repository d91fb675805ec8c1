/**
 * Spatial-statistical inference over historical whale sightings.
 *
 * <p>
 * {@link com.whalewatch.core.SightingAnalyzer} is the entry point; it wires a
 * {@link com.whalewatch.core.source.SightingSource} and an
 * {@link com.whalewatch.core.config.EstimatorConfig} to the estimators in
 * {@link com.whalewatch.core.estimation}.
 * </p>
 *
 * @since 1.0.0
 */
package com.whalewatch.core;
