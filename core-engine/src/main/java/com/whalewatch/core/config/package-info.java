/**
 * YAML configuration for the estimators.
 *
 * <p>
 * {@link com.whalewatch.core.config.EstimatorConfigLoader} reads a
 * {@link com.whalewatch.core.config.EstimatorConfig} and validates it right
 * after parsing.
 * </p>
 *
 * @since 1.0.0
 */
package com.whalewatch.core.config;
