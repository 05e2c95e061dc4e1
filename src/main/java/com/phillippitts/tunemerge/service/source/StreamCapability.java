package com.phillippitts.tunemerge.service.source;

/**
 * Resolves a playable URL for a track.
 */
public interface StreamCapability {

    String getStreamUrl(String trackId);
}
