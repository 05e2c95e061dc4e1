package com.phillippitts.tunemerge.domain;

import java.util.List;
import java.util.Objects;

/**
 * Provider-independent album.
 *
 * <p>An album may be backed by several catalogs once merged, so identity is the list of
 * {@code sourceIds} rather than a single provider/id pair. {@code id} is the local id of the
 * first source id and is kept for callers that need a single handle.
 *
 * @param year       release year, null when unknown
 * @param artworkUrl cover image, null when unknown
 * @param genres     genre tags, empty when the provider reports none
 */
public record CanonicalAlbum(
        String id,
        String title,
        String artist,
        Integer year,
        List<CanonicalTrack> tracks,
        String artworkUrl,
        List<SourceId> sourceIds,
        List<String> genres
) {
    public CanonicalAlbum {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(title, "title");
        artist = artist == null ? "" : artist;
        tracks = tracks == null ? List.of() : List.copyOf(tracks);
        sourceIds = sourceIds == null ? List.of() : List.copyOf(sourceIds);
        genres = genres == null ? List.of() : List.copyOf(genres);
    }

    /**
     * Creates a single-source album with no tracks, year, artwork or genres.
     */
    public static CanonicalAlbum of(String id, String title, String artist, SourceId sourceId) {
        return new CanonicalAlbum(id, title, artist, null, List.of(), null, List.of(sourceId), List.of());
    }
}
