package com.phillippitts.tunemerge.domain;

import java.util.List;
import java.util.Objects;

/**
 * An album together with its track listing, as returned by a single provider.
 */
public record AlbumTracks(CanonicalAlbum album, List<CanonicalTrack> tracks) {

    public AlbumTracks {
        Objects.requireNonNull(album, "album");
        tracks = tracks == null ? List.of() : List.copyOf(tracks);
    }
}
