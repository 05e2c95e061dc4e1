package com.phillippitts.tunemerge.service.source;

/**
 * Convenience union of both playlist halves.
 */
public interface PlaylistCapability extends PlaylistListingCapability, PlaylistTracksCapability {
}
