package com.whalewatch.core.error;

/**
 * Thrown when estimator parameters are unusable (empty category set,
 * non-positive ranges, zero trials).
 *
 * <p>
 * Indicates a programmer or deployment error; callers are expected to abort
 * rather than retry.
 * </p>
 */
public class InvalidConfigurationException extends SightingAnalysisException {

    private static final long serialVersionUID = 1L;

    public InvalidConfigurationException(String message) {
        super(message);
    }

    public InvalidConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
