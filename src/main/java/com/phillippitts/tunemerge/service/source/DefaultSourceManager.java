package com.phillippitts.tunemerge.service.source;

import com.phillippitts.tunemerge.domain.AlbumTracks;
import com.phillippitts.tunemerge.domain.CanonicalAlbum;
import com.phillippitts.tunemerge.domain.CanonicalPlaylist;
import com.phillippitts.tunemerge.domain.CanonicalTrack;
import com.phillippitts.tunemerge.domain.MetadataSearchQuery;
import com.phillippitts.tunemerge.domain.NormalizedRelease;
import com.phillippitts.tunemerge.domain.SearchResult;
import com.phillippitts.tunemerge.domain.SourceId;
import com.phillippitts.tunemerge.domain.SourceType;
import com.phillippitts.tunemerge.exception.CapabilityNotSupportedException;
import com.phillippitts.tunemerge.service.match.MatcherStats;
import com.phillippitts.tunemerge.service.match.ReleaseMatcher;
import com.phillippitts.tunemerge.service.match.ReleaseMatcherFactory;
import com.phillippitts.tunemerge.service.match.ReleaseNormalizer;
import com.phillippitts.tunemerge.service.metrics.SourceMetrics;
import com.phillippitts.tunemerge.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.function.Predicate;

/**
 * Default {@link SourceManager}.
 *
 * <p><b>Thread Model:</b> every source call runs on the source executor through
 * {@link SourceCallExecutor}; the manager never blocks a calling thread. Results are joined with
 * {@code allOf} and read back in registration order.
 *
 * <p><b>Aggregate search:</b>
 * <ol>
 *   <li>Fan out {@code search} to every search-capable source and {@code searchReleases} to
 *       every metadata source, each call settled independently</li>
 *   <li>Concatenate tracks of every successful source</li>
 *   <li>Without metadata sources, return albums exactly as reported</li>
 *   <li>Otherwise feed normalized primary albums and then metadata releases into a fresh
 *       {@link ReleaseMatcher}, so primary albums are always the base entries that metadata
 *       enriches</li>
 * </ol>
 *
 * <p><b>Registry:</b> read-only after construction. When two sources share a
 * {@link SourceType}, lookup by type resolves to the one registered last.
 *
 * @see SourceManagerBuilder
 */
public class DefaultSourceManager implements SourceManager {
    private static final Logger LOG = LogManager.getLogger(DefaultSourceManager.class);

    static final String OP_SEARCH = "search";
    static final String OP_SEARCH_RELEASES = "searchReleases";
    static final String OP_LIST_PLAYLISTS = "listPlaylists";
    static final String OP_PLAYLIST_TRACKS = "getPlaylistTracks";
    static final String OP_STREAM_URL = "getStreamUrl";
    static final String OP_ALBUM_TRACKS = "getAlbumTracks";

    private final List<Source> sources;
    private final List<MetadataSource> metadataSources;
    private final Map<SourceType, Source> byType;
    private final SourceCallExecutor calls;
    private final ReleaseMatcherFactory matcherFactory;
    private final int metadataLimit;
    private final SourceMetrics metrics;

    DefaultSourceManager(List<Source> sources,
                         List<MetadataSource> metadataSources,
                         SourceCallExecutor calls,
                         ReleaseMatcherFactory matcherFactory,
                         int metadataLimit,
                         SourceMetrics metrics) {
        if (metadataLimit <= 0) {
            throw new IllegalArgumentException("metadataLimit must be positive, got: " + metadataLimit);
        }
        this.sources = List.copyOf(sources);
        this.metadataSources = List.copyOf(metadataSources);
        this.calls = Objects.requireNonNull(calls, "calls");
        this.matcherFactory = Objects.requireNonNull(matcherFactory, "matcherFactory");
        this.metadataLimit = metadataLimit;
        this.metrics = Objects.requireNonNull(metrics, "metrics");

        Map<SourceType, Source> index = new EnumMap<>(SourceType.class);
        for (Source source : this.sources) {
            Source previous = index.put(source.getType(), source);
            if (previous != null) {
                LOG.warn("Source type {} registered twice ({} replaces {})",
                        source.getType(), source.getName(), previous.getName());
            }
            LOG.info("Registered source {} ({}): {}", source.getType(), source.getName(),
                    SourceCapabilities.describe(source));
        }
        this.byType = index;
        for (MetadataSource source : this.metadataSources) {
            LOG.info("Registered metadata source {} ({})", source.getType(), source.getName());
        }
    }

    @Override
    public Optional<Source> getSource(SourceType type) {
        return Optional.ofNullable(byType.get(type));
    }

    @Override
    public List<Source> getAllSources() {
        return sources;
    }

    @Override
    public List<MetadataSource> getAllMetadataSources() {
        return metadataSources;
    }

    @Override
    public CompletableFuture<List<CanonicalPlaylist>> listAllPlaylists() {
        List<CompletableFuture<List<CanonicalPlaylist>>> futures = new ArrayList<>();
        for (Source source : sources) {
            if (SourceCapabilities.hasPlaylistCapability(source)) {
                PlaylistListingCapability listing = (PlaylistListingCapability) source;
                futures.add(calls.call(source, OP_LIST_PLAYLISTS, listing::listPlaylists));
            }
        }
        return CompletableFuture.allOf(futures.toArray(CompletableFuture[]::new))
                .thenApply(v -> {
                    List<CanonicalPlaylist> all = new ArrayList<>();
                    for (CompletableFuture<List<CanonicalPlaylist>> f : futures) {
                        List<CanonicalPlaylist> playlists = f.join();
                        if (playlists != null) {
                            all.addAll(playlists);
                        }
                    }
                    return List.copyOf(all);
                });
    }

    @Override
    public CompletableFuture<List<CanonicalTrack>> getPlaylistTracks(SourceType type, String playlistId) {
        Source source = requireCapable(type, SourceCapabilities::hasPlaylistCapability,
                CapabilityNotSupportedException.PLAYLISTS);
        PlaylistTracksCapability playlists = (PlaylistTracksCapability) source;
        return calls.call(source, OP_PLAYLIST_TRACKS, () -> playlists.getPlaylistTracks(playlistId));
    }

    @Override
    public CompletableFuture<String> getStreamUrl(SourceType type, String trackId) {
        Source source = requireCapable(type, SourceCapabilities::hasStreamCapability,
                CapabilityNotSupportedException.STREAMING);
        StreamCapability streams = (StreamCapability) source;
        return calls.call(source, OP_STREAM_URL, () -> streams.getStreamUrl(trackId));
    }

    @Override
    public CompletableFuture<AlbumTracks> getAlbumTracks(SourceType type, String albumId) {
        Source source = requireCapable(type, SourceCapabilities::hasAlbumCapability,
                CapabilityNotSupportedException.ALBUM_TRACKS);
        AlbumCapability albums = (AlbumCapability) source;
        return calls.call(source, OP_ALBUM_TRACKS, () -> albums.getAlbumTracks(albumId));
    }

    @Override
    public CompletableFuture<SearchResult> searchAll(String query) {
        Objects.requireNonNull(query, "query");
        LOG.debug("searchAll query='{}'", LogSanitizer.queryPreview(query));

        List<Source> searchable = new ArrayList<>();
        List<CompletableFuture<Optional<SearchResult>>> primary = new ArrayList<>();
        for (Source source : sources) {
            if (SourceCapabilities.hasSearchCapability(source)) {
                SearchCapability search = (SearchCapability) source;
                searchable.add(source);
                primary.add(calls.settle(source, OP_SEARCH, () -> search.search(query)));
            }
        }

        MetadataSearchQuery metadataQuery = MetadataSearchQuery.text(query);
        List<CompletableFuture<Optional<List<NormalizedRelease>>>> metadata = new ArrayList<>();
        for (MetadataSource source : metadataSources) {
            metadata.add(calls.settle(source, OP_SEARCH_RELEASES,
                    () -> source.searchReleases(metadataQuery, metadataLimit)));
        }

        List<CompletableFuture<?>> all = new ArrayList<>(primary);
        all.addAll(metadata);
        return CompletableFuture.allOf(all.toArray(CompletableFuture[]::new))
                .thenApply(v -> assemble(searchable, primary, metadata));
    }

    private SearchResult assemble(List<Source> searchable,
                                  List<CompletableFuture<Optional<SearchResult>>> primary,
                                  List<CompletableFuture<Optional<List<NormalizedRelease>>>> metadata) {
        List<CanonicalTrack> tracks = new ArrayList<>();
        List<CanonicalAlbum> albums = new ArrayList<>();
        List<SourceType> reporters = new ArrayList<>();
        for (int i = 0; i < primary.size(); i++) {
            Optional<SearchResult> result = primary.get(i).join();
            if (result.isPresent()) {
                tracks.addAll(result.get().tracks());
                for (CanonicalAlbum album : result.get().albums()) {
                    albums.add(album);
                    reporters.add(searchable.get(i).getType());
                }
            }
        }

        if (metadataSources.isEmpty()) {
            return new SearchResult(tracks, albums);
        }

        ReleaseMatcher matcher = matcherFactory.create();
        Map<String, List<CanonicalTrack>> tracksByAnchor = new HashMap<>();
        for (int i = 0; i < albums.size(); i++) {
            CanonicalAlbum album = albums.get(i);
            NormalizedRelease release = ReleaseNormalizer.fromAlbum(album, reporters.get(i));
            tracksByAnchor.putIfAbsent(release.ids().get(0).key(), album.tracks());
            matcher.addOrMerge(release);
        }
        for (CompletableFuture<Optional<List<NormalizedRelease>>> f : metadata) {
            for (NormalizedRelease release : f.join().orElse(List.of())) {
                if (release != null) {
                    matcher.addOrMerge(release);
                }
            }
        }

        MatcherStats stats = matcher.getStats();
        metrics.recordMatchStats(stats);
        LOG.debug("searchAll merged {} releases into {} albums (exact={}, fuzzy={})",
                stats.exactMatches() + stats.fuzzyMatches() + stats.newEntries(), stats.total(),
                stats.exactMatches(), stats.fuzzyMatches());

        List<CanonicalAlbum> merged = new ArrayList<>(stats.total());
        for (NormalizedRelease release : matcher.getAll()) {
            List<CanonicalTrack> albumTracks =
                    tracksByAnchor.getOrDefault(release.ids().get(0).key(), List.of());
            merged.add(ReleaseNormalizer.toAlbum(release, albumTracks));
        }
        return new SearchResult(tracks, merged);
    }

    @Override
    public Optional<SourceId> getPreferredSourceId(CanonicalAlbum album) {
        Objects.requireNonNull(album, "album");
        return album.sourceIds().stream()
                .filter(id -> SourceCapabilities.hasAlbumCapability(byType.get(id.source())))
                .min(Comparator.comparingInt(id -> id.source().streamPriority()));
    }

    private Source requireCapable(SourceType type, Predicate<Object> capability, String label) {
        Objects.requireNonNull(type, "type");
        Source source = byType.get(type);
        if (!capability.test(source)) {
            throw new CapabilityNotSupportedException(type.key(), label);
        }
        return source;
    }
}
