package com.phillippitts.tunemerge.exception;

/**
 * Base exception for all TuneMerge application-specific errors.
 * All domain exceptions should extend this class to enable centralized error handling.
 */
public class TuneMergeException extends RuntimeException {

    public TuneMergeException(String message) {
        super(message);
    }

    public TuneMergeException(String message, Throwable cause) {
        super(message, cause);
    }

    public TuneMergeException(Throwable cause) {
        super(cause);
    }
}
