package com.phillippitts.tunemerge.exception;

/**
 * Thrown when an operation is requested from a source that is not registered or does not
 * implement the required capability. Never retried.
 */
public class CapabilityNotSupportedException extends TuneMergeException {

    public static final String PLAYLISTS = "playlists";
    public static final String STREAMING = "streaming";
    public static final String ALBUM_TRACKS = "album tracks";

    private final String sourceKey;
    private final String capability;

    public CapabilityNotSupportedException(String sourceKey, String capability) {
        super("Source \"" + sourceKey + "\" does not support " + capability);
        this.sourceKey = sourceKey;
        this.capability = capability;
    }

    public String getSourceKey() {
        return sourceKey;
    }

    public String getCapability() {
        return capability;
    }
}
