package com.whalewatch.core.error;

/**
 * Thrown when no sighting matches the requested period or area.
 *
 * <p>
 * This is a recoverable condition: the caller should report that there is no
 * data for the period and ask for another one, rather than treat it as zero
 * density.
 * </p>
 */
public class EmptyInputException extends SightingAnalysisException {

    private static final long serialVersionUID = 1L;

    public EmptyInputException(String message) {
        super(message);
    }
}
