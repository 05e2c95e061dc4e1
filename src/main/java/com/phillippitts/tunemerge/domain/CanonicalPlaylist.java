package com.phillippitts.tunemerge.domain;

import java.util.Objects;

/**
 * Provider-independent playlist (or radio station, for station-based providers).
 */
public record CanonicalPlaylist(
        String id,
        String name,
        SourceType source,
        String description,
        String artworkUrl
) {
    public CanonicalPlaylist {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(source, "source");
    }

    public static CanonicalPlaylist of(String id, String name, SourceType source) {
        return new CanonicalPlaylist(id, name, source, null, null);
    }
}
