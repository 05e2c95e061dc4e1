package com.phillippitts.tunemerge.domain;

import java.util.List;

/**
 * Tracks and albums matching a search query.
 */
public record SearchResult(List<CanonicalTrack> tracks, List<CanonicalAlbum> albums) {

    public SearchResult {
        tracks = tracks == null ? List.of() : List.copyOf(tracks);
        albums = albums == null ? List.of() : List.copyOf(albums);
    }

    public static SearchResult empty() {
        return new SearchResult(List.of(), List.of());
    }
}
