package com.phillippitts.tunemerge.exception;

/**
 * Thrown by a source when a call against its backing catalog fails.
 * This may occur due to network errors, rate limiting, auth expiry, or unparseable responses.
 */
public class SourceException extends TuneMergeException {

    private final String sourceKey;

    public SourceException(String message) {
        super(message);
        this.sourceKey = "unknown";
    }

    public SourceException(String message, String sourceKey) {
        super(message + " (source: " + sourceKey + ")");
        this.sourceKey = sourceKey;
    }

    public SourceException(String message, Throwable cause) {
        super(message, cause);
        this.sourceKey = "unknown";
    }

    public SourceException(String message, String sourceKey, Throwable cause) {
        super(message + " (source: " + sourceKey + ")", cause);
        this.sourceKey = sourceKey;
    }

    public String getSourceKey() {
        return sourceKey;
    }
}
