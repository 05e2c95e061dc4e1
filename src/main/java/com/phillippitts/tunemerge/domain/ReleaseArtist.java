package com.phillippitts.tunemerge.domain;

import java.util.List;
import java.util.Objects;

/**
 * Artist credit on a release, with the provider ids known for that artist.
 */
public record ReleaseArtist(String name, List<SourceId> ids) {

    public ReleaseArtist {
        Objects.requireNonNull(name, "name");
        ids = ids == null ? List.of() : List.copyOf(ids);
    }

    public static ReleaseArtist of(String name, SourceId... ids) {
        return new ReleaseArtist(name, List.of(ids));
    }
}
