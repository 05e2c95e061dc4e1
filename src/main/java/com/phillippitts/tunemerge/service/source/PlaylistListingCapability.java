package com.phillippitts.tunemerge.service.source;

import com.phillippitts.tunemerge.domain.CanonicalPlaylist;

import java.util.List;

/**
 * Lists the playlists (or stations) owned by the current user.
 *
 * <p>Only half of the playlist capability: a source counts as playlist-capable only when it
 * also implements {@link PlaylistTracksCapability}.
 */
public interface PlaylistListingCapability {

    List<CanonicalPlaylist> listPlaylists();
}
