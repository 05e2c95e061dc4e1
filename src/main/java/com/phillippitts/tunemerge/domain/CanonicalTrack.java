package com.phillippitts.tunemerge.domain;

import java.util.Objects;

/**
 * Provider-independent track.
 *
 * @param durationSeconds track length, or null when the provider does not report it
 * @param artworkUrl      cover image, may be null
 */
public record CanonicalTrack(
        String id,
        String title,
        String artist,
        String album,
        Integer durationSeconds,
        SourceId sourceId,
        String artworkUrl
) {
    public CanonicalTrack {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(title, "title");
        Objects.requireNonNull(sourceId, "sourceId");
        artist = artist == null ? "" : artist;
        album = album == null ? "" : album;
    }

    public static CanonicalTrack of(String id, String title, String artist, String album, SourceId sourceId) {
        return new CanonicalTrack(id, title, artist, album, null, sourceId, null);
    }
}
