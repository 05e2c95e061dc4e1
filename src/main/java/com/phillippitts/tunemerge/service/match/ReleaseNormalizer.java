package com.phillippitts.tunemerge.service.match;

import com.phillippitts.tunemerge.domain.CanonicalAlbum;
import com.phillippitts.tunemerge.domain.CanonicalTrack;
import com.phillippitts.tunemerge.domain.NormalizedRelease;
import com.phillippitts.tunemerge.domain.ReleaseArtist;
import com.phillippitts.tunemerge.domain.ReleaseType;
import com.phillippitts.tunemerge.domain.SourceId;
import com.phillippitts.tunemerge.domain.SourceType;

import java.util.List;
import java.util.Objects;

/**
 * Converts between the public album shape and the release shape the matcher works on.
 */
public final class ReleaseNormalizer {

    private ReleaseNormalizer() {
        // Utility class - prevent instantiation
    }

    /**
     * Normalizes an album reported by a primary source.
     *
     * <p>The release keeps the album's own source ids; an album that carries none is identified
     * by the reporting source and the album id. The artist credit is a single artist without
     * ids, release type is {@link ReleaseType#ALBUM} and confidence is 1.0.
     *
     * @param album    album as reported
     * @param reporter source that reported the album
     */
    public static NormalizedRelease fromAlbum(CanonicalAlbum album, SourceType reporter) {
        Objects.requireNonNull(album, "album");
        List<SourceId> ids = album.sourceIds().isEmpty()
                ? List.of(SourceId.of(Objects.requireNonNull(reporter, "reporter"), album.id()))
                : album.sourceIds();
        return new NormalizedRelease("", album.title(), List.of(ReleaseArtist.of(album.artist())),
                ReleaseType.ALBUM, album.year(), ids, 1.0, album.genres(), album.artworkUrl(), null);
    }

    /**
     * Converts a merged release back to an album. The first id's local id becomes the album id
     * and the first credited artist becomes the album artist.
     *
     * @param release merged release
     * @param tracks  tracks to attach, usually those of the primary album the entry grew from
     */
    public static CanonicalAlbum toAlbum(NormalizedRelease release, List<CanonicalTrack> tracks) {
        Objects.requireNonNull(release, "release");
        return new CanonicalAlbum(release.ids().get(0).id(), release.title(),
                release.primaryArtistName(), release.year(), tracks, release.artworkUrl(),
                release.ids(), release.genres());
    }

    public static CanonicalAlbum toAlbum(NormalizedRelease release) {
        return toAlbum(release, List.of());
    }
}
