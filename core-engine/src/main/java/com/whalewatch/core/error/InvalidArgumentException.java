package com.whalewatch.core.error;

/**
 * Thrown for rejected input values: a negative waiting time, a malformed
 * coordinate or an unparseable sighting row.
 */
public class InvalidArgumentException extends SightingAnalysisException {

    private static final long serialVersionUID = 1L;

    public InvalidArgumentException(String message) {
        super(message);
    }

    public InvalidArgumentException(String message, Throwable cause) {
        super(message, cause);
    }
}
