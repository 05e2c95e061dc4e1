package com.phillippitts.tunemerge.service.enrich;

import com.phillippitts.tunemerge.domain.CanonicalAlbum;
import com.phillippitts.tunemerge.domain.SourceId;
import com.phillippitts.tunemerge.service.match.MatcherStats;

import java.util.List;
import java.util.Objects;

/**
 * Outcome of enriching one album with metadata catalogs.
 *
 * @param original     album as passed in
 * @param enriched     album with merged ids, genres, year and artwork; equal to {@code original}
 *                     when nothing matched
 * @param newSourceIds ids the album gained, in merge order
 * @param stats        decisions of the matcher used for this album
 */
public record EnrichmentResult(
        CanonicalAlbum original,
        CanonicalAlbum enriched,
        List<SourceId> newSourceIds,
        MatcherStats stats
) {
    private static final MatcherStats NO_MATCHING = new MatcherStats(0, 0, 0, 0);

    public EnrichmentResult {
        Objects.requireNonNull(original, "original");
        Objects.requireNonNull(enriched, "enriched");
        newSourceIds = newSourceIds == null ? List.of() : List.copyOf(newSourceIds);
        stats = stats == null ? NO_MATCHING : stats;
    }

    public static EnrichmentResult unmatched(CanonicalAlbum album) {
        return new EnrichmentResult(album, album, List.of(), NO_MATCHING);
    }

    /** True when at least one metadata catalog contributed a new id. */
    public boolean matched() {
        return !newSourceIds.isEmpty();
    }
}
