package com.whalewatch.core.error;

/**
 * Base type for every failure the inference engine reports to its caller.
 *
 * <p>
 * All subclasses are unchecked. Callers that drive an interactive flow branch
 * on the concrete subtype to decide whether to re-prompt
 * ({@link EmptyInputException}, {@link InsufficientDataException},
 * {@link InvalidArgumentException}) or abort
 * ({@link InvalidConfigurationException}).
 * </p>
 *
 * @since 1.0.0
 */
public abstract class SightingAnalysisException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    protected SightingAnalysisException(String message) {
        super(message);
    }

    protected SightingAnalysisException(String message, Throwable cause) {
        super(message, cause);
    }
}
