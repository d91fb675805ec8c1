package com.whalewatch.core.error;

/**
 * Thrown when fewer than two distinct timestamps are available, so no
 * inter-arrival interval can be computed.
 */
public class InsufficientDataException extends SightingAnalysisException {

    private static final long serialVersionUID = 1L;

    public InsufficientDataException(String message) {
        super(message);
    }
}
