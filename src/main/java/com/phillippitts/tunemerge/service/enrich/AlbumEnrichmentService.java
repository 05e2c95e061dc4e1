package com.phillippitts.tunemerge.service.enrich;

import com.phillippitts.tunemerge.domain.CanonicalAlbum;
import com.phillippitts.tunemerge.domain.MetadataSearchQuery;
import com.phillippitts.tunemerge.domain.NormalizedRelease;
import com.phillippitts.tunemerge.domain.SourceId;
import com.phillippitts.tunemerge.service.match.ReleaseMatcher;
import com.phillippitts.tunemerge.service.match.ReleaseMatcherFactory;
import com.phillippitts.tunemerge.service.match.ReleaseNormalizer;
import com.phillippitts.tunemerge.service.source.MetadataSource;
import com.phillippitts.tunemerge.service.source.SourceCallExecutor;
import com.phillippitts.tunemerge.service.source.SourceManager;
import com.phillippitts.tunemerge.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;

/**
 * Looks an album up in every metadata catalog and merges what they report into it.
 *
 * <p>Each catalog receives a structured title/artist query. A failing catalog contributes
 * nothing. The album seeds a fresh matcher, so it stays the base entry: its title and artist
 * are kept and catalogs only add ids, genres, a missing year and better artwork.
 */
public class AlbumEnrichmentService {
    private static final Logger LOG = LogManager.getLogger(AlbumEnrichmentService.class);

    static final String OP_ENRICH = "searchReleases";

    private final SourceManager sourceManager;
    private final SourceCallExecutor calls;
    private final ReleaseMatcherFactory matcherFactory;
    private final int limit;

    /**
     * @param limit releases requested from each catalog (positive)
     */
    public AlbumEnrichmentService(SourceManager sourceManager,
                                  SourceCallExecutor calls,
                                  ReleaseMatcherFactory matcherFactory,
                                  int limit) {
        if (limit <= 0) {
            throw new IllegalArgumentException("limit must be positive, got: " + limit);
        }
        this.sourceManager = Objects.requireNonNull(sourceManager, "sourceManager");
        this.calls = Objects.requireNonNull(calls, "calls");
        this.matcherFactory = Objects.requireNonNull(matcherFactory, "matcherFactory");
        this.limit = limit;
    }

    /**
     * @param album album to enrich; must carry at least one source id
     * @return future that never fails because of a catalog
     * @throws IllegalArgumentException if the album has no source ids
     */
    public CompletableFuture<EnrichmentResult> enrich(CanonicalAlbum album) {
        Objects.requireNonNull(album, "album");
        if (album.sourceIds().isEmpty()) {
            throw new IllegalArgumentException("album must carry at least one source id: " + album.id());
        }
        List<MetadataSource> catalogs = sourceManager.getAllMetadataSources();
        if (catalogs.isEmpty()) {
            return CompletableFuture.completedFuture(EnrichmentResult.unmatched(album));
        }

        MetadataSearchQuery query = MetadataSearchQuery.structured(album.title(), album.artist());
        LOG.debug("Enriching album '{}'", LogSanitizer.queryPreview(query.describe()));
        List<CompletableFuture<Optional<List<NormalizedRelease>>>> futures = new ArrayList<>();
        for (MetadataSource catalog : catalogs) {
            futures.add(calls.settle(catalog, OP_ENRICH, () -> catalog.searchReleases(query, limit)));
        }
        return CompletableFuture.allOf(futures.toArray(CompletableFuture[]::new))
                .thenApply(v -> {
                    List<NormalizedRelease> found = new ArrayList<>();
                    for (CompletableFuture<Optional<List<NormalizedRelease>>> f : futures) {
                        f.join().ifPresent(releases -> releases.stream()
                                .filter(Objects::nonNull)
                                .forEach(found::add));
                    }
                    return merge(album, found);
                });
    }

    private EnrichmentResult merge(CanonicalAlbum album, List<NormalizedRelease> found) {
        if (found.isEmpty()) {
            LOG.debug("No metadata releases found for album {}", album.id());
            return EnrichmentResult.unmatched(album);
        }
        ReleaseMatcher matcher = matcherFactory.create();
        matcher.add(ReleaseNormalizer.fromAlbum(album, album.sourceIds().get(0).source()));
        for (NormalizedRelease release : found) {
            matcher.addOrMerge(release);
        }
        NormalizedRelease merged = matcher.getAll().get(0);

        Set<String> known = new HashSet<>();
        album.sourceIds().forEach(id -> known.add(id.key()));
        List<SourceId> gained = merged.ids().stream()
                .filter(id -> !known.contains(id.key()))
                .toList();

        CanonicalAlbum enriched = new CanonicalAlbum(album.id(), album.title(), album.artist(),
                merged.year(), album.tracks(), merged.artworkUrl(), merged.ids(), merged.genres());
        if (gained.isEmpty()) {
            LOG.debug("Album {} unchanged: no release matched", album.id());
        } else {
            LOG.info("Album {} gained {} source ids", album.id(), gained.size());
        }
        return new EnrichmentResult(album, enriched, gained, matcher.getStats());
    }
}
