package com.phillippitts.tunemerge.service.source;

import com.phillippitts.tunemerge.domain.AlbumTracks;

/**
 * Fetches an album with its full track listing.
 */
public interface AlbumCapability {

    AlbumTracks getAlbumTracks(String albumId);
}
