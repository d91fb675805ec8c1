/**
 * Error taxonomy of the sighting inference engine.
 *
 * <p>
 * Every estimator either returns a valid result or throws one of the
 * {@link com.whalewatch.core.error.SightingAnalysisException} subtypes, so
 * callers can branch on the named condition.
 * </p>
 *
 * @since 1.0.0
 */
package com.whalewatch.core.error;
