package com.phillippitts.tunemerge.service.source;

import com.phillippitts.tunemerge.domain.CanonicalTrack;

import java.util.List;

/**
 * Resolves the tracks of one playlist. Paired with {@link PlaylistListingCapability}.
 */
public interface PlaylistTracksCapability {

    List<CanonicalTrack> getPlaylistTracks(String playlistId);
}
